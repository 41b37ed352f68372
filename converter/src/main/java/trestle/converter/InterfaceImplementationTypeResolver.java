package trestle.converter;

import graphql.TypeResolutionEnvironment;
import graphql.execution.UnresolvedTypeException;
import graphql.schema.GraphQLInterfaceType;
import graphql.schema.GraphQLObjectType;
import graphql.schema.TypeResolver;
import org.jspecify.annotations.Nullable;
import trestle.api.cache.CacheEntry;
import trestle.api.cache.TypeCache;
import trestle.api.definition.TypeDefinition;
import trestle.api.definition.TypeKind;
import trestle.api.exceptions.InternalConsistencyException;

/**
 * Type resolver installed for every interface: a value resolves to the first cached object type
 * that implements the interface and whose origin class the value is an instance of.
 */
final class InterfaceImplementationTypeResolver implements TypeResolver {

  private final String interfaceName;
  private final TypeCache cache;

  InterfaceImplementationTypeResolver(String interfaceName, TypeCache cache) {
    this.interfaceName = interfaceName;
    this.cache = cache;
  }

  @Override
  public GraphQLObjectType getType(TypeResolutionEnvironment env) {
    Object value = env.getObject();
    return resolve(value);
  }

  GraphQLObjectType resolve(@Nullable Object value) {
    if (value != null) {
      for (CacheEntry entry : cache.entries()) {
        if (entry.isBuilt()
            && entry.definition().kind() == TypeKind.OBJECT
            && entry.definition() instanceof TypeDefinition definition
            && definition.implementsInterface(interfaceName)
            && definition.origin().isInstance(value)) {
          return (GraphQLObjectType) entry.implementation();
        }
      }
    }
    String valueType = value == null ? "null" : value.getClass().getSimpleName();
    throw new UnresolvedTypeException(
        "No object type implementing '" + interfaceName + "' matches a value of type " + valueType,
        interfaceType());
  }

  private GraphQLInterfaceType interfaceType() {
    return cache
        .get(interfaceName)
        .filter(CacheEntry::isBuilt)
        .map(entry -> (GraphQLInterfaceType) entry.implementation())
        .orElseThrow(
            () ->
                new InternalConsistencyException(
                    "Interface '" + interfaceName + "' is not built"));
  }
}
