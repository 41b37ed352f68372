package trestle.api.exceptions;

/**
 * Base class of the errors that abort a schema build. A build that throws one of these never
 * hands out a partially converted schema.
 */
public abstract class SchemaConversionException extends RuntimeException {

  protected SchemaConversionException(String message) {
    super(message);
  }
}
