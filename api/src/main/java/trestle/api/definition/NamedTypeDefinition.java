package trestle.api.definition;

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A definition that introduces a named type. Names are unique across all kinds within one type
 * cache.
 */
public interface NamedTypeDefinition {

  /** Returns {@code name} if it can name a type, which requires it to be non-empty. */
  static String requireName(String name) {
    Objects.requireNonNull(name, "name");
    if (name.isEmpty()) {
      throw new IllegalArgumentException("Type name must not be empty");
    }
    return name;
  }

  String name();

  @Nullable String description();

  TypeKind kind();
}
