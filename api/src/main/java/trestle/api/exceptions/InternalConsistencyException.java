package trestle.api.exceptions;

/** The definition graph or the type cache is in a state the converter cannot accept. */
public class InternalConsistencyException extends SchemaConversionException {

  public InternalConsistencyException(String message) {
    super(message);
  }
}
