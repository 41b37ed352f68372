package trestle.converter;

import graphql.schema.DataFetcher;
import graphql.schema.PropertyDataFetcher;
import java.util.Objects;
import java.util.function.Function;
import trestle.api.scalars.ScalarRegistry;
import trestle.converter.scalars.DefaultScalarRegistry;

/**
 * Settings of a conversion.
 *
 * @param scalarRegistry turns scalar markers into scalar types
 * @param defaultResolverFactory supplies the resolver of a field that declares none, given the
 *     field name
 */
public record ConverterOptions(
    ScalarRegistry scalarRegistry, Function<String, DataFetcher<?>> defaultResolverFactory) {

  public ConverterOptions {
    Objects.requireNonNull(scalarRegistry, "scalarRegistry");
    Objects.requireNonNull(defaultResolverFactory, "defaultResolverFactory");
  }

  public static ConverterOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public static class Builder {
    private ScalarRegistry scalarRegistry = new DefaultScalarRegistry();
    private Function<String, DataFetcher<?>> defaultResolverFactory = PropertyDataFetcher::fetching;

    public Builder scalarRegistry(ScalarRegistry scalarRegistry) {
      this.scalarRegistry = scalarRegistry;
      return this;
    }

    public Builder defaultResolverFactory(
        Function<String, DataFetcher<?>> defaultResolverFactory) {
      this.defaultResolverFactory = defaultResolverFactory;
      return this;
    }

    public ConverterOptions build() {
      return new ConverterOptions(scalarRegistry, defaultResolverFactory);
    }
  }
}
