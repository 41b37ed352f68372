package trestle.api.definition;

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/** One value of an enum: the name exposed in the schema and the native value it maps to. */
public record EnumValueDefinition(
    String name, Object value, @Nullable String description, @Nullable String deprecationReason) {

  public EnumValueDefinition {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(value, "value");
  }

  public static EnumValueDefinition of(String name, Object value) {
    return new EnumValueDefinition(name, value, null, null);
  }
}
