package trestle.api.exceptions;

/** A definition was handed to a builder, or placed in a position, that does not accept its kind. */
public class WrongKindForBuilderException extends SchemaConversionException {

  public WrongKindForBuilderException(String message) {
    super(message);
  }
}
