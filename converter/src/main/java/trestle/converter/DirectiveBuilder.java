package trestle.converter;

import graphql.introspection.Introspection.DirectiveLocation;
import graphql.schema.GraphQLDirective;
import trestle.api.definition.ArgumentDefinition;
import trestle.api.definition.DirectiveDefinition;

/** Builds directives. Directives are not named types, so nothing here touches the cache. */
final class DirectiveBuilder {

  private final FieldMaterializer fields;

  DirectiveBuilder(FieldMaterializer fields) {
    this.fields = fields;
  }

  GraphQLDirective fromDirective(DirectiveDefinition definition) {
    GraphQLDirective.Builder builder =
        GraphQLDirective.newDirective()
            .name(definition.name())
            .description(definition.description())
            .repeatable(definition.repeatable());
    for (DirectiveLocation location : definition.locations()) {
      builder.validLocation(location);
    }
    for (ArgumentDefinition argument : definition.arguments()) {
      builder.argument(fields.fromArgument("@" + definition.name(), argument));
    }
    return builder.build();
  }
}
