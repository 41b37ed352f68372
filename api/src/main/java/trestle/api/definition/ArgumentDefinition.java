package trestle.api.definition;

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/** An argument of a field or directive. */
public record ArgumentDefinition(
    @Nullable String name,
    TypeRef type,
    DefaultValue defaultValue,
    @Nullable String description) {

  public ArgumentDefinition {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(defaultValue, "defaultValue");
  }

  public static ArgumentDefinition of(String name, TypeRef type) {
    return new ArgumentDefinition(name, type, DefaultValue.notProvided(), null);
  }

  public ArgumentDefinition withDefault(DefaultValue defaultValue) {
    return new ArgumentDefinition(name, type, defaultValue, description);
  }

  public ArgumentDefinition withDescription(@Nullable String description) {
    return new ArgumentDefinition(name, type, defaultValue, description);
  }
}
