package trestle.converter;

import graphql.schema.GraphQLEnumType;
import graphql.schema.GraphQLEnumValueDefinition;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import trestle.api.definition.EnumDefinition;
import trestle.api.definition.EnumValueDefinition;

final class EnumTypeBuilder {

  private static final Logger log = LoggerFactory.getLogger(EnumTypeBuilder.class);

  private final BuildContext context;

  EnumTypeBuilder(BuildContext context) {
    this.context = context;
  }

  GraphQLEnumType fromEnum(EnumDefinition definition) {
    Optional<GraphQLEnumType> cached = context.built(definition, GraphQLEnumType.class);
    if (cached.isPresent()) {
      return cached.get();
    }

    log.debug("Building enum type '{}'", definition.name());
    GraphQLEnumType.Builder builder =
        GraphQLEnumType.newEnum().name(definition.name()).description(definition.description());
    for (EnumValueDefinition value : definition.values()) {
      builder.value(
          GraphQLEnumValueDefinition.newEnumValueDefinition()
              .name(value.name())
              .value(value.value())
              .description(value.description())
              .deprecationReason(value.deprecationReason())
              .build());
    }

    GraphQLEnumType enumType = builder.build();
    context.cache().put(definition.name(), definition, enumType);
    return enumType;
  }
}
