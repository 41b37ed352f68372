package trestle.converter.scalars;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import graphql.Scalars;
import graphql.schema.GraphQLScalarType;
import java.util.List;
import org.junit.jupiter.api.Test;
import trestle.api.cache.TypeCache;
import trestle.api.definition.EnumDefinition;
import trestle.api.definition.EnumValueDefinition;
import trestle.api.exceptions.InternalConsistencyException;
import trestle.api.scalars.BuiltInScalar;
import trestle.api.scalars.CustomScalar;
import trestle.converter.TestCoercing;

class DefaultScalarRegistryTest {

  private final DefaultScalarRegistry registry = new DefaultScalarRegistry();
  private final TypeCache cache = new TypeCache();

  @Test
  void builtInsMapToSharedInstancesWithoutTouchingTheCache() {
    assertThat(registry.resolve(BuiltInScalar.STRING, cache)).isSameAs(Scalars.GraphQLString);
    assertThat(registry.resolve(BuiltInScalar.INT, cache)).isSameAs(Scalars.GraphQLInt);
    assertThat(registry.resolve(BuiltInScalar.FLOAT, cache)).isSameAs(Scalars.GraphQLFloat);
    assertThat(registry.resolve(BuiltInScalar.BOOLEAN, cache)).isSameAs(Scalars.GraphQLBoolean);
    assertThat(registry.resolve(BuiltInScalar.ID, cache)).isSameAs(Scalars.GraphQLID);
    assertThat(cache.size()).isZero();
  }

  @Test
  void customScalarIsBuiltOncePerCache() {
    CustomScalar date =
        new CustomScalar(
            "Date", "ISO-8601 date", new TestCoercing(), "https://tools.ietf.org/html/rfc3339");

    GraphQLScalarType first = registry.resolve(date, cache);
    GraphQLScalarType second = registry.resolve(CustomScalar.of("Date", new TestCoercing()), cache);

    assertThat(second).isSameAs(first);
    assertThat(first.getDescription()).isEqualTo("ISO-8601 date");
    assertThat(first.getSpecifiedByUrl()).isEqualTo("https://tools.ietf.org/html/rfc3339");
    assertThat(cache.get("Date").orElseThrow().implementation()).isSameAs(first);
    assertThat(registry.resolve(date, new TypeCache())).isNotSameAs(first);
  }

  @Test
  void scalarNameTakenByAnotherKindIsRejected() {
    cache.register(
        new EnumDefinition("Date", null, List.of(EnumValueDefinition.of("TODAY", "TODAY"))));

    assertThatThrownBy(() -> registry.resolve(CustomScalar.of("Date", new TestCoercing()), cache))
        .isInstanceOf(InternalConsistencyException.class)
        .hasMessageContaining("Date");
  }
}
