package trestle.converter;

import graphql.TrivialDataFetcher;
import graphql.schema.DataFetchingEnvironment;

/** Resolves a subscription field to the event it is being executed for. */
public final class SubscriptionEventFetcher implements TrivialDataFetcher<Object> {

  public static final SubscriptionEventFetcher INSTANCE = new SubscriptionEventFetcher();

  private SubscriptionEventFetcher() {}

  @Override
  public Object get(DataFetchingEnvironment environment) {
    return environment.getSource();
  }
}
