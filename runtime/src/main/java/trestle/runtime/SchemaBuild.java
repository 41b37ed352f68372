package trestle.runtime;

import graphql.GraphQL;
import graphql.schema.GraphQLNamedType;
import graphql.schema.GraphQLSchema;
import java.util.Objects;
import java.util.Optional;
import trestle.api.cache.CacheEntry;
import trestle.api.cache.TypeCache;

/** An assembled schema and the cache its types came from. */
public record SchemaBuild(GraphQLSchema schema, TypeCache cache) {

  public SchemaBuild {
    Objects.requireNonNull(schema, "schema");
    Objects.requireNonNull(cache, "cache");
  }

  /** Returns the cached type of {@code name}, which is the instance the schema holds. */
  public Optional<GraphQLNamedType> type(String name) {
    return cache.get(name).filter(CacheEntry::isBuilt).map(CacheEntry::implementation);
  }

  public GraphQL graphQL() {
    return GraphQL.newGraphQL(schema).build();
  }
}
