package trestle.api.definition;

/**
 * Closed tag carried by every {@link TypeRef}. The converter switches on this tag instead of
 * probing a reference for capabilities.
 */
public enum TypeKind {
  OBJECT,
  INPUT,
  INTERFACE,
  ENUM,
  SCALAR,
  UNION,
  LIST,
  OPTIONAL;

  /** Returns true for the kinds that name a type, as opposed to wrapping one. */
  public boolean isNamed() {
    return this != LIST && this != OPTIONAL;
  }
}
