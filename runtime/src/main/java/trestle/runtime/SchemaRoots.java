package trestle.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import trestle.api.definition.DirectiveDefinition;
import trestle.api.definition.NamedTypeDefinition;
import trestle.api.definition.TypeDefinition;

/**
 * What a schema is assembled from: the root operation types, types that are not reachable from
 * the roots but belong in the schema, and directives.
 */
public record SchemaRoots(
    TypeDefinition query,
    @Nullable TypeDefinition mutation,
    @Nullable TypeDefinition subscription,
    List<NamedTypeDefinition> additionalTypes,
    List<DirectiveDefinition> directives) {

  public SchemaRoots {
    Objects.requireNonNull(query, "query");
    additionalTypes = List.copyOf(additionalTypes);
    directives = List.copyOf(directives);
  }

  public static Builder newRoots(TypeDefinition query) {
    return new Builder(query);
  }

  /** Every definition conversion starts from, roots first. */
  List<NamedTypeDefinition> definitions() {
    List<NamedTypeDefinition> definitions = new ArrayList<>();
    definitions.add(query);
    if (mutation != null) {
      definitions.add(mutation);
    }
    if (subscription != null) {
      definitions.add(subscription);
    }
    definitions.addAll(additionalTypes);
    return definitions;
  }

  public static class Builder {
    private final TypeDefinition query;
    private @Nullable TypeDefinition mutation;
    private @Nullable TypeDefinition subscription;
    private final List<NamedTypeDefinition> additionalTypes = new ArrayList<>();
    private final List<DirectiveDefinition> directives = new ArrayList<>();

    private Builder(TypeDefinition query) {
      this.query = query;
    }

    public Builder mutation(@Nullable TypeDefinition mutation) {
      this.mutation = mutation;
      return this;
    }

    public Builder subscription(@Nullable TypeDefinition subscription) {
      this.subscription = subscription;
      return this;
    }

    public Builder additionalType(NamedTypeDefinition type) {
      this.additionalTypes.add(type);
      return this;
    }

    public Builder directive(DirectiveDefinition directive) {
      this.directives.add(directive);
      return this;
    }

    public SchemaRoots build() {
      return new SchemaRoots(query, mutation, subscription, additionalTypes, directives);
    }
  }
}
