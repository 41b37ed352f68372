package trestle.api.unions;

import graphql.TypeResolutionEnvironment;
import graphql.schema.GraphQLNamedType;
import graphql.schema.GraphQLObjectType;
import graphql.schema.GraphQLUnionType;
import graphql.schema.TypeResolver;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import trestle.api.cache.CacheEntry;
import trestle.api.cache.TypeCache;
import trestle.api.definition.TypeRef;
import trestle.api.definition.UnionDefinition;
import trestle.api.exceptions.InternalConsistencyException;
import trestle.api.exceptions.WrongReturnTypeForUnionException;

/**
 * Default union type resolver: a value belongs to the first member whose origin class it is an
 * instance of. Member types are looked up in the cache, not in the executing schema, so they are
 * the instances the converter built.
 */
public final class UnionMemberTypeResolver implements TypeResolver {

  private final UnionDefinition union;
  private final TypeCache cache;

  public UnionMemberTypeResolver(UnionDefinition union, TypeCache cache) {
    this.union = Objects.requireNonNull(union, "union");
    this.cache = Objects.requireNonNull(cache, "cache");
  }

  public static TypeResolverFactory factory() {
    return UnionMemberTypeResolver::new;
  }

  @Override
  public GraphQLObjectType getType(TypeResolutionEnvironment env) {
    Object value = env.getObject();
    return resolve(value, env.getField().getName());
  }

  /**
   * Returns the member type of {@code value}.
   *
   * @throws WrongReturnTypeForUnionException if no member matches
   */
  public GraphQLObjectType resolve(@Nullable Object value, String fieldName) {
    if (value != null) {
      for (TypeRef member : union.members()) {
        if (member instanceof TypeRef.CompositeRef composite
            && composite.definition().origin().isInstance(value)) {
          return lookup(composite.definition().name(), GraphQLObjectType.class);
        }
      }
    }
    String returnType = value == null ? "null" : value.getClass().getSimpleName();
    throw new WrongReturnTypeForUnionException(
        lookup(union.name(), GraphQLUnionType.class), fieldName, returnType);
  }

  private <T extends GraphQLNamedType> T lookup(String name, Class<T> expected) {
    CacheEntry entry =
        cache
            .get(name)
            .orElseThrow(
                () -> new InternalConsistencyException("Type '" + name + "' is not in the cache"));
    if (!entry.isBuilt() || !expected.isInstance(entry.implementation())) {
      throw new InternalConsistencyException(
          "Type '" + name + "' is not a built " + expected.getSimpleName());
    }
    return expected.cast(entry.implementation());
  }
}
