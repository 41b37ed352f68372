package trestle.converter.scalars;

import graphql.Scalars;
import graphql.schema.GraphQLScalarType;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import trestle.api.cache.CacheEntry;
import trestle.api.cache.TypeCache;
import trestle.api.definition.TypeKind;
import trestle.api.exceptions.InternalConsistencyException;
import trestle.api.scalars.BuiltInScalar;
import trestle.api.scalars.CustomScalar;
import trestle.api.scalars.ScalarMarker;
import trestle.api.scalars.ScalarRegistry;

/**
 * Maps built-in scalars to graphql-java's shared instances and builds custom scalars once per
 * cache.
 */
public class DefaultScalarRegistry implements ScalarRegistry {

  private static final Logger log = LoggerFactory.getLogger(DefaultScalarRegistry.class);

  @Override
  public GraphQLScalarType resolve(ScalarMarker marker, TypeCache cache) {
    if (marker instanceof BuiltInScalar builtIn) {
      return builtIn(builtIn);
    }
    return custom((CustomScalar) marker, cache);
  }

  private static GraphQLScalarType builtIn(BuiltInScalar scalar) {
    return switch (scalar) {
      case STRING -> Scalars.GraphQLString;
      case INT -> Scalars.GraphQLInt;
      case FLOAT -> Scalars.GraphQLFloat;
      case BOOLEAN -> Scalars.GraphQLBoolean;
      case ID -> Scalars.GraphQLID;
    };
  }

  private static GraphQLScalarType custom(CustomScalar scalar, TypeCache cache) {
    Optional<CacheEntry> cached = cache.get(scalar.name());
    if (cached.isPresent() && cached.get().isBuilt()) {
      CacheEntry entry = cached.get();
      if (entry.definition().kind() != TypeKind.SCALAR) {
        throw new InternalConsistencyException(
            "Type name '"
                + scalar.name()
                + "' is already used by "
                + entry.definition().kind()
                + ", cannot reuse it for SCALAR");
      }
      return (GraphQLScalarType) entry.implementation();
    }

    log.debug("Building scalar type '{}'", scalar.name());
    GraphQLScalarType.Builder builder =
        GraphQLScalarType.newScalar()
            .name(scalar.name())
            .description(scalar.description())
            .coercing(scalar.coercing());
    if (scalar.specifiedByUrl() != null) {
      builder.specifiedByUrl(scalar.specifiedByUrl());
    }
    GraphQLScalarType scalarType = builder.build();
    cache.put(scalar.name(), scalar, scalarType);
    return scalarType;
  }
}
