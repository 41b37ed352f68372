package trestle.converter;

import graphql.schema.GraphQLNamedType;
import java.util.Objects;
import java.util.Optional;
import trestle.api.cache.CacheEntry;
import trestle.api.cache.TypeCache;
import trestle.api.definition.NamedTypeDefinition;
import trestle.api.exceptions.InternalConsistencyException;

/**
 * State of one schema build: the type cache being filled and the options it is filled with.
 * Builds that share a context share type identity; separate contexts are fully independent.
 */
public final class BuildContext {

  private final TypeCache cache;
  private final ConverterOptions options;

  public BuildContext(TypeCache cache, ConverterOptions options) {
    this.cache = Objects.requireNonNull(cache, "cache");
    this.options = Objects.requireNonNull(options, "options");
  }

  public static BuildContext create() {
    return new BuildContext(new TypeCache(), ConverterOptions.defaults());
  }

  public TypeCache cache() {
    return cache;
  }

  public ConverterOptions options() {
    return options;
  }

  /**
   * Returns the built implementation of {@code definition}'s name, or empty if the name still
   * has to be built. A name that is under construction cannot be handed out as a finished type.
   */
  <T extends GraphQLNamedType> Optional<T> built(NamedTypeDefinition definition, Class<T> type) {
    Optional<CacheEntry> cached = cache.get(definition.name());
    if (cached.isEmpty()) {
      return Optional.empty();
    }
    CacheEntry entry = cached.get();
    checkSameKind(entry, definition);
    return switch (entry.state()) {
      case REGISTERED -> Optional.empty();
      case BUILDING -> throw new InternalConsistencyException(
          "Type '" + definition.name() + "' was requested while it is being built");
      case BUILT -> Optional.of(type.cast(entry.implementation()));
    };
  }

  static void checkSameKind(CacheEntry entry, NamedTypeDefinition definition) {
    if (entry.definition().kind() != definition.kind()) {
      throw new InternalConsistencyException(
          "Type name '"
              + definition.name()
              + "' is already used by "
              + entry.definition().kind()
              + ", cannot reuse it for "
              + definition.kind());
    }
  }
}
