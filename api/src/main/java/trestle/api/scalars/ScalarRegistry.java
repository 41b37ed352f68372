package trestle.api.scalars;

import graphql.schema.GraphQLScalarType;
import trestle.api.cache.TypeCache;

/**
 * Turns scalar markers into graphql-java scalar types. Implementations memoize custom scalars by
 * name in the given cache so that every reference to a scalar yields the same instance.
 */
public interface ScalarRegistry {

  GraphQLScalarType resolve(ScalarMarker marker, TypeCache cache);
}
