package trestle.api.cache;

import graphql.schema.GraphQLNamedType;
import graphql.schema.GraphQLTypeReference;
import java.util.Objects;
import trestle.api.definition.NamedTypeDefinition;

/**
 * A named type known to a {@link TypeCache}. Until the entry is {@link State#BUILT}, its
 * implementation is a {@link GraphQLTypeReference} standing in for the real type.
 */
public record CacheEntry(
    NamedTypeDefinition definition, GraphQLNamedType implementation, State state) {

  public enum State {
    /** Registered by the first pass; nothing has been built yet. */
    REGISTERED,
    /** Construction has started; references to it resolve to the skeleton. */
    BUILDING,
    BUILT
  }

  public CacheEntry {
    Objects.requireNonNull(definition, "definition");
    Objects.requireNonNull(implementation, "implementation");
    Objects.requireNonNull(state, "state");
  }

  static CacheEntry skeleton(NamedTypeDefinition definition, State state) {
    return new CacheEntry(definition, GraphQLTypeReference.typeRef(definition.name()), state);
  }

  public String name() {
    return definition.name();
  }

  public boolean isBuilt() {
    return state == State.BUILT;
  }
}
