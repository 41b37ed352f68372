package trestle.api.definition;

import graphql.introspection.Introspection.DirectiveLocation;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.jspecify.annotations.Nullable;

public record DirectiveDefinition(
    String name,
    Set<DirectiveLocation> locations,
    List<ArgumentDefinition> arguments,
    @Nullable String description,
    boolean repeatable) {

  public DirectiveDefinition {
    Objects.requireNonNull(name, "name");
    if (locations.isEmpty()) {
      throw new IllegalArgumentException("Directive '" + name + "' declares no locations");
    }
    locations = Set.copyOf(locations);
    arguments = List.copyOf(arguments);
  }
}
