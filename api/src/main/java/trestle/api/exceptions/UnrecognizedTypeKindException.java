package trestle.api.exceptions;

/**
 * A type reference carries a tag the converter cannot route. Well-formed definitions never
 * produce this; it points at the definition provider.
 */
public class UnrecognizedTypeKindException extends SchemaConversionException {

  public UnrecognizedTypeKindException(String message) {
    super(message);
  }
}
