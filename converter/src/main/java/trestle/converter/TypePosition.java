package trestle.converter;

/** Where a type reference appears, which decides the kinds it may name. */
public enum TypePosition {
  /** Type of an object or interface field. */
  OUTPUT,
  /** Type of an argument or input field. */
  INPUT
}
