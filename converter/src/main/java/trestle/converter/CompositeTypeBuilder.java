package trestle.converter;

import graphql.schema.GraphQLInputObjectType;
import graphql.schema.GraphQLInterfaceType;
import graphql.schema.GraphQLNamedType;
import graphql.schema.GraphQLObjectType;
import graphql.schema.GraphQLTypeReference;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import trestle.api.cache.TypeCache;
import trestle.api.definition.FieldDefinition;
import trestle.api.definition.TypeDefinition;
import trestle.api.definition.TypeRef;
import trestle.api.exceptions.WrongKindForBuilderException;

/**
 * Builds object, input object and interface types.
 *
 * <p>Each builder marks its name as being built before converting interfaces and fields, so a
 * field that leads back to the type gets the type's reference instead of recursing. Input types
 * follow the same protocol: a cycle through input fields is accepted here and left to schema
 * validation, which rejects only cycles made entirely of non-null fields.
 */
final class CompositeTypeBuilder {

  private static final Logger log = LoggerFactory.getLogger(CompositeTypeBuilder.class);

  private final BuildContext context;
  private final SchemaTypeConverter converter;
  private final FieldMaterializer fields;

  CompositeTypeBuilder(
      BuildContext context, SchemaTypeConverter converter, FieldMaterializer fields) {
    this.context = context;
    this.converter = converter;
    this.fields = fields;
  }

  GraphQLObjectType fromObjectType(TypeDefinition definition) {
    requireKind(definition, TypeDefinition.Kind.OBJECT);
    Optional<GraphQLObjectType> cached = context.built(definition, GraphQLObjectType.class);
    if (cached.isPresent()) {
      return cached.get();
    }

    TypeCache cache = context.cache();
    cache.markBuilding(definition);
    log.debug("Building object type '{}'", definition.name());
    try {
      GraphQLObjectType.Builder builder =
          GraphQLObjectType.newObject()
              .name(definition.name())
              .description(definition.description());
      for (TypeDefinition iface : definition.interfaces()) {
        GraphQLNamedType implemented = implementedInterface(definition, iface);
        if (implemented instanceof GraphQLInterfaceType interfaceType) {
          builder.withInterface(interfaceType);
        } else {
          builder.withInterface((GraphQLTypeReference) implemented);
        }
      }
      for (FieldDefinition field : definition.fields()) {
        builder.field(fields.fromField(definition.name(), field).definition());
      }

      GraphQLObjectType objectType = builder.build();
      cache.put(definition.name(), definition, objectType);
      return objectType;
    } catch (RuntimeException e) {
      cache.abandon(definition);
      throw e;
    }
  }

  GraphQLInterfaceType fromInterface(TypeDefinition definition) {
    requireKind(definition, TypeDefinition.Kind.INTERFACE);
    Optional<GraphQLInterfaceType> cached = context.built(definition, GraphQLInterfaceType.class);
    if (cached.isPresent()) {
      return cached.get();
    }

    TypeCache cache = context.cache();
    cache.markBuilding(definition);
    log.debug("Building interface type '{}'", definition.name());
    try {
      GraphQLInterfaceType.Builder builder =
          GraphQLInterfaceType.newInterface()
              .name(definition.name())
              .description(definition.description());
      for (TypeDefinition iface : definition.interfaces()) {
        GraphQLNamedType implemented = implementedInterface(definition, iface);
        if (implemented instanceof GraphQLInterfaceType interfaceType) {
          builder.withInterface(interfaceType);
        } else {
          builder.withInterface((GraphQLTypeReference) implemented);
        }
      }
      for (FieldDefinition field : definition.fields()) {
        builder.field(fields.convertField(definition.name(), field).definition());
      }

      GraphQLInterfaceType interfaceType = builder.build();
      cache.put(definition.name(), definition, interfaceType);
      cache
          .codeRegistry()
          .typeResolver(
              definition.name(),
              new InterfaceImplementationTypeResolver(definition.name(), cache));
      return interfaceType;
    } catch (RuntimeException e) {
      cache.abandon(definition);
      throw e;
    }
  }

  GraphQLInputObjectType fromInputObjectType(TypeDefinition definition) {
    requireKind(definition, TypeDefinition.Kind.INPUT);
    Optional<GraphQLInputObjectType> cached =
        context.built(definition, GraphQLInputObjectType.class);
    if (cached.isPresent()) {
      return cached.get();
    }

    TypeCache cache = context.cache();
    cache.markBuilding(definition);
    log.debug("Building input object type '{}'", definition.name());
    try {
      GraphQLInputObjectType.Builder builder =
          GraphQLInputObjectType.newInputObject()
              .name(definition.name())
              .description(definition.description());
      for (FieldDefinition field : definition.fields()) {
        builder.field(fields.fromInputField(definition.name(), field));
      }

      GraphQLInputObjectType inputType = builder.build();
      cache.put(definition.name(), definition, inputType);
      return inputType;
    } catch (RuntimeException e) {
      cache.abandon(definition);
      throw e;
    }
  }

  private GraphQLNamedType implementedInterface(TypeDefinition implementor, TypeDefinition iface) {
    if (iface.definitionKind() != TypeDefinition.Kind.INTERFACE) {
      throw new WrongKindForBuilderException(
          "'"
              + implementor.name()
              + "' cannot implement "
              + iface.definitionKind()
              + " type '"
              + iface.name()
              + "'");
    }
    return converter.namedType(TypeRef.of(iface));
  }

  private static void requireKind(TypeDefinition definition, TypeDefinition.Kind expected) {
    if (definition.definitionKind() != expected) {
      throw new WrongKindForBuilderException(
          "'"
              + definition.name()
              + "' is "
              + definition.definitionKind()
              + " type, expected "
              + expected);
    }
  }
}
