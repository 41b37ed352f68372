package trestle.api.definition;

import graphql.schema.DataFetcher;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A field of an object, interface or input type.
 *
 * <p>{@code name} is nullable only because definitions come from an external provider; the
 * converter rejects a nameless field. {@code defaultValue} is meaningful on input fields only.
 * When {@code subscription} is set, {@code resolver} is expected to produce the event stream.
 */
public record FieldDefinition(
    @Nullable String name,
    @Nullable String description,
    TypeRef type,
    List<ArgumentDefinition> arguments,
    DefaultValue defaultValue,
    @Nullable String deprecationReason,
    boolean subscription,
    @Nullable DataFetcher<?> resolver) {

  public FieldDefinition {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(defaultValue, "defaultValue");
    arguments = List.copyOf(arguments);
  }

  public static Builder newField(@Nullable String name) {
    return new Builder().name(name);
  }

  public static class Builder {
    private @Nullable String name;
    private @Nullable String description;
    private @Nullable TypeRef type;
    private final List<ArgumentDefinition> arguments = new ArrayList<>();
    private DefaultValue defaultValue = DefaultValue.notProvided();
    private @Nullable String deprecationReason;
    private boolean subscription;
    private @Nullable DataFetcher<?> resolver;

    public Builder name(@Nullable String name) {
      this.name = name;
      return this;
    }

    public Builder description(@Nullable String description) {
      this.description = description;
      return this;
    }

    public Builder type(TypeRef type) {
      this.type = type;
      return this;
    }

    public Builder argument(ArgumentDefinition argument) {
      this.arguments.add(argument);
      return this;
    }

    public Builder defaultValue(DefaultValue defaultValue) {
      this.defaultValue = defaultValue;
      return this;
    }

    public Builder deprecationReason(@Nullable String deprecationReason) {
      this.deprecationReason = deprecationReason;
      return this;
    }

    public Builder subscription(boolean subscription) {
      this.subscription = subscription;
      return this;
    }

    public Builder resolver(@Nullable DataFetcher<?> resolver) {
      this.resolver = resolver;
      return this;
    }

    public FieldDefinition build() {
      if (type == null) {
        throw new IllegalStateException("Field '" + name + "' has no type");
      }
      return new FieldDefinition(
          name,
          description,
          type,
          arguments,
          defaultValue,
          deprecationReason,
          subscription,
          resolver);
    }
  }
}
