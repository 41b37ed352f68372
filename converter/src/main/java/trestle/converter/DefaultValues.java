package trestle.converter;

import graphql.language.NullValue;
import graphql.schema.GraphQLArgument;
import graphql.schema.GraphQLInputObjectField;
import graphql.schema.InputValueWithState;
import trestle.api.definition.DefaultValue;

/**
 * Moves default values between {@link DefaultValue} and graphql-java's
 * {@link InputValueWithState}. "Not provided" leaves the schema default unset; "null" sets it to
 * an explicit null.
 */
public final class DefaultValues {

  private DefaultValues() {}

  public static GraphQLArgument.Builder applyTo(
      GraphQLArgument.Builder builder, DefaultValue defaultValue) {
    if (defaultValue instanceof DefaultValue.Value value) {
      builder.defaultValueProgrammatic(value.value());
    } else if (defaultValue instanceof DefaultValue.Null) {
      builder.defaultValueProgrammatic(null);
    }
    return builder;
  }

  public static GraphQLInputObjectField.Builder applyTo(
      GraphQLInputObjectField.Builder builder, DefaultValue defaultValue) {
    if (defaultValue instanceof DefaultValue.Value value) {
      builder.defaultValueProgrammatic(value.value());
    } else if (defaultValue instanceof DefaultValue.Null) {
      builder.defaultValueProgrammatic(null);
    }
    return builder;
  }

  public static DefaultValue read(GraphQLArgument argument) {
    return read(argument.getArgumentDefaultValue());
  }

  public static DefaultValue read(GraphQLInputObjectField field) {
    return read(field.getInputFieldDefaultValue());
  }

  /** Reads a schema default back. Literal defaults are returned as their AST value. */
  public static DefaultValue read(InputValueWithState state) {
    if (state.isNotSet()) {
      return DefaultValue.notProvided();
    }
    Object value = state.getValue();
    if (value == null || value instanceof NullValue) {
      return DefaultValue.nullValue();
    }
    return DefaultValue.of(value);
  }
}
