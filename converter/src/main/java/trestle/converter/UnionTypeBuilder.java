package trestle.converter;

import graphql.schema.GraphQLNamedType;
import graphql.schema.GraphQLObjectType;
import graphql.schema.GraphQLTypeReference;
import graphql.schema.GraphQLUnionType;
import graphql.schema.TypeResolver;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import trestle.api.cache.TypeCache;
import trestle.api.definition.TypeKind;
import trestle.api.definition.TypeRef;
import trestle.api.definition.UnionDefinition;
import trestle.api.exceptions.UnallowedReturnTypeForUnionException;

/**
 * Builds union types. Every member must convert to an object type; a member that is still being
 * built counts when its definition is an object definition.
 */
final class UnionTypeBuilder {

  private static final Logger log = LoggerFactory.getLogger(UnionTypeBuilder.class);

  private final BuildContext context;
  private final SchemaTypeConverter converter;

  UnionTypeBuilder(BuildContext context, SchemaTypeConverter converter) {
    this.context = context;
    this.converter = converter;
  }

  GraphQLUnionType fromUnion(UnionDefinition definition) {
    Optional<GraphQLUnionType> cached = context.built(definition, GraphQLUnionType.class);
    if (cached.isPresent()) {
      return cached.get();
    }

    TypeCache cache = context.cache();
    cache.markBuilding(definition);
    log.debug("Building union type '{}'", definition.name());

    try {
      GraphQLUnionType.Builder builder =
          GraphQLUnionType.newUnionType()
              .name(definition.name())
              .description(definition.description());
      for (TypeRef member : definition.members()) {
        addMember(builder, definition, member);
      }

      TypeResolver typeResolver = definition.typeResolverFactory().create(definition, cache);
      GraphQLUnionType unionType = builder.build();
      cache.put(definition.name(), definition, unionType);
      cache.codeRegistry().typeResolver(definition.name(), typeResolver);
      return unionType;
    } catch (RuntimeException e) {
      cache.abandon(definition);
      throw e;
    }
  }

  private void addMember(
      GraphQLUnionType.Builder builder, UnionDefinition definition, TypeRef member) {
    if (!member.kind().isNamed()) {
      throw new UnallowedReturnTypeForUnionException(definition.name(), member.toString());
    }
    GraphQLNamedType memberType = converter.namedType(member);
    if (memberType instanceof GraphQLObjectType objectType) {
      builder.possibleType(objectType);
    } else if (memberType instanceof GraphQLTypeReference reference
        && member.kind() == TypeKind.OBJECT) {
      builder.possibleType(reference);
    } else {
      throw new UnallowedReturnTypeForUnionException(definition.name(), memberType.getName());
    }
  }
}
