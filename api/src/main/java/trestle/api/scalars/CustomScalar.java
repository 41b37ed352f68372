package trestle.api.scalars;

import graphql.schema.Coercing;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import trestle.api.definition.NamedTypeDefinition;
import trestle.api.definition.TypeKind;

/**
 * A scalar with its own serialization. {@code coercing} supplies serialize, parse-value and
 * parse-literal; registering it is the scalar registry's job.
 */
public record CustomScalar(
    String name,
    @Nullable String description,
    Coercing<?, ?> coercing,
    @Nullable String specifiedByUrl)
    implements NamedTypeDefinition, ScalarMarker {

  public CustomScalar {
    NamedTypeDefinition.requireName(name);
    Objects.requireNonNull(coercing, "coercing");
  }

  public static CustomScalar of(String name, Coercing<?, ?> coercing) {
    return new CustomScalar(name, null, coercing, null);
  }

  @Override
  public TypeKind kind() {
    return TypeKind.SCALAR;
  }
}
