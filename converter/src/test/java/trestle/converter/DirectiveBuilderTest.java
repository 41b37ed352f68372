package trestle.converter;

import static org.assertj.core.api.Assertions.assertThat;

import graphql.introspection.Introspection.DirectiveLocation;
import graphql.schema.GraphQLArgument;
import graphql.schema.GraphQLDirective;
import graphql.schema.GraphQLNonNull;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import trestle.api.definition.ArgumentDefinition;
import trestle.api.definition.DefaultValue;
import trestle.api.definition.DirectiveDefinition;
import trestle.api.definition.EnumDefinition;
import trestle.api.definition.TypeRef;

class DirectiveBuilderTest {

  enum Audience {
    PUBLIC,
    INTERNAL
  }

  private final SchemaTypeConverter converter = new SchemaTypeConverter();

  @Test
  void buildsLocationsArgumentsAndRepeatability() {
    EnumDefinition audience = EnumDefinition.fromEnum("Audience", null, Audience.class);
    DirectiveDefinition visibility =
        new DirectiveDefinition(
            "visibility",
            Set.of(DirectiveLocation.FIELD_DEFINITION, DirectiveLocation.OBJECT),
            List.of(
                ArgumentDefinition.of("audience", TypeRef.of(audience)),
                ArgumentDefinition.of("note", TypeRef.optional(TypeRef.string()))
                    .withDefault(DefaultValue.nullValue())),
            "Restricts who can see an element",
            true);

    GraphQLDirective directive = converter.fromDirective(visibility);

    assertThat(directive.getName()).isEqualTo("visibility");
    assertThat(directive.getDescription()).isEqualTo("Restricts who can see an element");
    assertThat(directive.isRepeatable()).isTrue();
    assertThat(directive.validLocations())
        .containsExactlyInAnyOrder(DirectiveLocation.FIELD_DEFINITION, DirectiveLocation.OBJECT);
    assertThat(directive.getArguments())
        .extracting(GraphQLArgument::getName)
        .containsExactly("audience", "note");
    assertThat(DefaultValues.read(directive.getArgument("note")))
        .isEqualTo(DefaultValue.nullValue());
  }

  @Test
  void argumentTypesGoThroughTheCache() {
    EnumDefinition audience = EnumDefinition.fromEnum("Audience", null, Audience.class);
    DirectiveDefinition directive =
        new DirectiveDefinition(
            "audience",
            Set.of(DirectiveLocation.FIELD),
            List.of(ArgumentDefinition.of("value", TypeRef.of(audience))),
            null,
            false);

    converter.fromDirective(directive);
    GraphQLDirective again = converter.fromDirective(directive);

    GraphQLNonNull value = (GraphQLNonNull) again.getArgument("value").getType();
    assertThat(value.getWrappedType()).isSameAs(converter.fromEnum(audience));
    assertThat(converter.cache().size()).isEqualTo(1);
  }
}
