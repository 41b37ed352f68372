package trestle.converter;

import graphql.schema.DataFetcher;
import graphql.schema.FieldCoordinates;
import graphql.schema.GraphQLArgument;
import graphql.schema.GraphQLFieldDefinition;
import graphql.schema.GraphQLInputObjectField;
import org.jspecify.annotations.Nullable;
import trestle.api.definition.ArgumentDefinition;
import trestle.api.definition.FieldDefinition;
import trestle.api.exceptions.InternalConsistencyException;

/**
 * Converts fields, input fields and arguments, and registers each output field's fetcher in the
 * cache's code registry under the field's coordinates.
 *
 * <p>A subscription field is split in two: the declared resolver becomes the subscriber, which
 * produces the event stream, and the exposed resolver returns each event unchanged.
 */
final class FieldMaterializer {

  private final SchemaTypeConverter converter;
  private final BuildContext context;

  FieldMaterializer(SchemaTypeConverter converter, BuildContext context) {
    this.converter = converter;
    this.context = context;
  }

  /** Converts an object field and registers its active fetcher. */
  ConvertedField fromField(String parentTypeName, FieldDefinition field) {
    ConvertedField converted = convertField(parentTypeName, field);
    context
        .cache()
        .codeRegistry()
        .dataFetcher(
            FieldCoordinates.coordinates(parentTypeName, converted.definition().getName()),
            converted.activeFetcher());
    return converted;
  }

  /**
   * Converts a field without wiring it. Interface fields go through here: execution always
   * fetches through the implementing object's coordinates.
   */
  ConvertedField convertField(String parentTypeName, FieldDefinition field) {
    String name = requireName(field.name(), "a field", parentTypeName);

    GraphQLFieldDefinition.Builder builder =
        GraphQLFieldDefinition.newFieldDefinition()
            .name(name)
            .description(field.description())
            .type(converter.outputType(field.type()));
    for (ArgumentDefinition argument : field.arguments()) {
      builder.argument(fromArgument(parentTypeName + "." + name, argument));
    }
    if (field.deprecationReason() != null) {
      builder.deprecate(field.deprecationReason());
    }

    DataFetcher<?> resolver = fromResolver(name, field.resolver());
    DataFetcher<?> subscriber = null;
    if (field.subscription()) {
      subscriber = resolver;
      resolver = SubscriptionEventFetcher.INSTANCE;
    }

    return new ConvertedField(builder.build(), resolver, subscriber);
  }

  GraphQLInputObjectField fromInputField(String parentTypeName, FieldDefinition field) {
    String name = requireName(field.name(), "an input field", parentTypeName);
    GraphQLInputObjectField.Builder builder =
        GraphQLInputObjectField.newInputObjectField()
            .name(name)
            .description(field.description())
            .type(converter.inputType(field.type()));
    return DefaultValues.applyTo(builder, field.defaultValue()).build();
  }

  /**
   * Converts an argument.
   *
   * @param owner coordinates of the field or directive declaring it, used in error messages
   */
  GraphQLArgument fromArgument(String owner, ArgumentDefinition argument) {
    String name = requireName(argument.name(), "an argument", owner);
    GraphQLArgument.Builder builder =
        GraphQLArgument.newArgument()
            .name(name)
            .description(argument.description())
            .type(converter.inputType(argument.type()));
    return DefaultValues.applyTo(builder, argument.defaultValue()).build();
  }

  private DataFetcher<?> fromResolver(String fieldName, @Nullable DataFetcher<?> resolver) {
    if (resolver != null) {
      return resolver;
    }
    return context.options().defaultResolverFactory().apply(fieldName);
  }

  private static String requireName(@Nullable String name, String what, String owner) {
    if (name == null || name.isEmpty()) {
      throw new InternalConsistencyException("Found " + what + " without a name on " + owner);
    }
    return name;
  }
}
