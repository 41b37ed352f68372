package trestle.api.exceptions;

/** A union member did not convert to an object type. */
public class UnallowedReturnTypeForUnionException extends SchemaConversionException {

  private final String unionName;
  private final String memberName;

  public UnallowedReturnTypeForUnionException(String unionName, String memberName) {
    super(
        "The type \""
            + memberName
            + "\" cannot be a member of the union \""
            + unionName
            + "\": union members must be object types");
    this.unionName = unionName;
    this.memberName = memberName;
  }

  public String getUnionName() {
    return unionName;
  }

  public String getMemberName() {
    return memberName;
  }
}
