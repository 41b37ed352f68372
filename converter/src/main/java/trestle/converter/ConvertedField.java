package trestle.converter;

import graphql.schema.DataFetcher;
import graphql.schema.GraphQLFieldDefinition;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A converted output field together with its wiring.
 *
 * @param definition the schema field
 * @param resolver produces the field value; for a subscription field it passes each event
 *     through unchanged
 * @param subscriber produces the event stream of a subscription field, null otherwise
 */
public record ConvertedField(
    GraphQLFieldDefinition definition,
    DataFetcher<?> resolver,
    @Nullable DataFetcher<?> subscriber) {

  public ConvertedField {
    Objects.requireNonNull(definition, "definition");
    Objects.requireNonNull(resolver, "resolver");
  }

  public boolean isSubscription() {
    return subscriber != null;
  }

  /** The fetcher the execution engine calls for this field. */
  public DataFetcher<?> activeFetcher() {
    return subscriber != null ? subscriber : resolver;
  }
}
