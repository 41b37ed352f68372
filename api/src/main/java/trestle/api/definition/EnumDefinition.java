package trestle.api.definition;

import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

public record EnumDefinition(
    String name, @Nullable String description, List<EnumValueDefinition> values)
    implements NamedTypeDefinition {

  public EnumDefinition {
    NamedTypeDefinition.requireName(name);
    values = List.copyOf(values);
  }

  /** Defines an enum whose values are the constants of {@code enumClass}, named as declared. */
  public static <E extends Enum<E>> EnumDefinition fromEnum(
      String name, @Nullable String description, Class<E> enumClass) {
    List<EnumValueDefinition> values = new ArrayList<>();
    for (E constant : enumClass.getEnumConstants()) {
      values.add(EnumValueDefinition.of(constant.name(), constant));
    }
    return new EnumDefinition(name, description, values);
  }

  @Override
  public TypeKind kind() {
    return TypeKind.ENUM;
  }
}
