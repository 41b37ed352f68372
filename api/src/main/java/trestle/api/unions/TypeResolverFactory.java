package trestle.api.unions;

import graphql.schema.TypeResolver;
import trestle.api.cache.TypeCache;
import trestle.api.definition.UnionDefinition;

/**
 * Creates the function that picks a union member for a runtime value. It receives the cache the
 * union is built into, so the returned resolver can hand back the exact member instances.
 */
@FunctionalInterface
public interface TypeResolverFactory {

  TypeResolver create(UnionDefinition union, TypeCache cache);
}
