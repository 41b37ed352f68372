package trestle.api.cache;

import graphql.schema.GraphQLCodeRegistry;
import graphql.schema.GraphQLNamedType;
import graphql.schema.GraphQLTypeReference;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import trestle.api.definition.NamedTypeDefinition;
import trestle.api.exceptions.InternalConsistencyException;

/**
 * Name-indexed memo of every named type built for a schema. At most one implementation exists
 * per name; builders consult the cache before constructing and record a skeleton before doing any
 * nested work, which is what keeps cyclic definitions from recursing forever.
 *
 * <p>The cache also owns the code registry that receives data fetchers and type resolvers, so a
 * cache reused for a second schema carries the wiring of the types it hands out.
 *
 * <p>Not thread-safe. One cache belongs to one build at a time.
 */
public final class TypeCache {

  private static final Logger log = LoggerFactory.getLogger(TypeCache.class);

  private final Map<String, CacheEntry> entries = new LinkedHashMap<>();
  // Names marked building without a prior registration; abandoning them forgets the name.
  private final Set<String> unregistered = new HashSet<>();
  private final GraphQLCodeRegistry.Builder codeRegistry = GraphQLCodeRegistry.newCodeRegistry();

  public Optional<CacheEntry> get(String name) {
    return Optional.ofNullable(entries.get(name));
  }

  public boolean contains(String name) {
    return entries.containsKey(name);
  }

  /**
   * Records the finished implementation of {@code name}. Replaces a skeleton of the same kind;
   * fails if a different implementation is already built under that name.
   */
  public CacheEntry put(
      String name, NamedTypeDefinition definition, GraphQLNamedType implementation) {
    if (!name.equals(implementation.getName())) {
      throw new InternalConsistencyException(
          "Cannot cache type '" + implementation.getName() + "' under name '" + name + "'");
    }
    CacheEntry existing = entries.get(name);
    if (existing != null) {
      checkSameKind(existing, definition);
      if (existing.isBuilt() && existing.implementation() != implementation) {
        throw new InternalConsistencyException("Type '" + name + "' has already been built");
      }
    }
    CacheEntry entry = new CacheEntry(definition, implementation, CacheEntry.State.BUILT);
    entries.put(name, entry);
    unregistered.remove(name);
    log.debug("Cached {} '{}'", definition.kind(), name);
    return entry;
  }

  /**
   * Registers a skeleton for {@code definition} unless its name is already known.
   *
   * @return true if a new entry was added
   */
  public boolean register(NamedTypeDefinition definition) {
    CacheEntry existing = entries.get(definition.name());
    if (existing != null) {
      checkSameKind(existing, definition);
      return false;
    }
    entries.put(
        definition.name(), CacheEntry.skeleton(definition, CacheEntry.State.REGISTERED));
    log.debug("Registered skeleton for {} '{}'", definition.kind(), definition.name());
    return true;
  }

  /**
   * Marks {@code definition} as under construction and returns the reference that stands in for
   * it until {@link #put} is called.
   */
  public GraphQLTypeReference markBuilding(NamedTypeDefinition definition) {
    CacheEntry existing = entries.get(definition.name());
    if (existing != null) {
      checkSameKind(existing, definition);
      if (existing.state() != CacheEntry.State.REGISTERED) {
        throw new InternalConsistencyException(
            "Type '" + definition.name() + "' is already " + existing.state());
      }
    }
    if (existing == null) {
      unregistered.add(definition.name());
    }
    CacheEntry skeleton = CacheEntry.skeleton(definition, CacheEntry.State.BUILDING);
    entries.put(definition.name(), skeleton);
    return (GraphQLTypeReference) skeleton.implementation();
  }

  /**
   * Undoes {@link #markBuilding} after a failed build: the entry goes back to REGISTERED, or is
   * removed if it was not registered before building started. Does nothing unless the name is
   * being built.
   */
  public void abandon(NamedTypeDefinition definition) {
    String name = definition.name();
    CacheEntry existing = entries.get(name);
    if (existing == null || existing.state() != CacheEntry.State.BUILDING) {
      return;
    }
    if (unregistered.remove(name)) {
      entries.remove(name);
    } else {
      entries.put(name, CacheEntry.skeleton(existing.definition(), CacheEntry.State.REGISTERED));
    }
    log.debug("Abandoned build of {} '{}'", definition.kind(), name);
  }

  /** All entries in registration order. */
  public List<CacheEntry> entries() {
    return List.copyOf(entries.values());
  }

  /** Entries registered by the first pass that have not been built yet, in registration order. */
  public List<CacheEntry> pending() {
    List<CacheEntry> pending = new ArrayList<>();
    for (CacheEntry entry : entries.values()) {
      if (entry.state() == CacheEntry.State.REGISTERED) {
        pending.add(entry);
      }
    }
    return pending;
  }

  /** Implementations of every built entry, in registration order. */
  public List<GraphQLNamedType> builtTypes() {
    List<GraphQLNamedType> types = new ArrayList<>();
    for (CacheEntry entry : entries.values()) {
      if (entry.isBuilt()) {
        types.add(entry.implementation());
      }
    }
    return types;
  }

  public GraphQLCodeRegistry.Builder codeRegistry() {
    return codeRegistry;
  }

  public int size() {
    return entries.size();
  }

  private static void checkSameKind(CacheEntry existing, NamedTypeDefinition definition) {
    if (existing.definition().kind() != definition.kind()) {
      throw new InternalConsistencyException(
          "Type name '"
              + definition.name()
              + "' is used by both "
              + existing.definition().kind()
              + " and "
              + definition.kind());
    }
  }
}
