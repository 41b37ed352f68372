package trestle.api.definition;

import java.util.Objects;

/**
 * Default of an argument or input field. "No default" and "defaults to null" are distinct
 * states; the converter keeps them apart all the way into the generated schema.
 */
public sealed interface DefaultValue
    permits DefaultValue.NotProvided, DefaultValue.Null, DefaultValue.Value {

  static DefaultValue notProvided() {
    return NotProvided.INSTANCE;
  }

  static DefaultValue nullValue() {
    return Null.INSTANCE;
  }

  static DefaultValue of(Object value) {
    return new Value(value);
  }

  default boolean isProvided() {
    return !(this instanceof NotProvided);
  }

  /** No default was declared. */
  final class NotProvided implements DefaultValue {
    static final NotProvided INSTANCE = new NotProvided();

    private NotProvided() {}

    @Override
    public String toString() {
      return "NotProvided";
    }
  }

  /** The declared default is an explicit null. */
  final class Null implements DefaultValue {
    static final Null INSTANCE = new Null();

    private Null() {}

    @Override
    public String toString() {
      return "Null";
    }
  }

  /** The declared default is a non-null value. */
  record Value(Object value) implements DefaultValue {
    public Value {
      Objects.requireNonNull(value, "value; use DefaultValue.nullValue() for an explicit null");
    }
  }
}
