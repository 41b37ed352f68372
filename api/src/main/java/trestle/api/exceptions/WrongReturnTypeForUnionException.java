package trestle.api.exceptions;

import graphql.execution.UnresolvedTypeException;
import graphql.schema.GraphQLUnionType;

/**
 * Raised while executing a query when a value returned for a union field is not an instance of
 * any member. graphql-java reports it as an error of that query only.
 */
public class WrongReturnTypeForUnionException extends UnresolvedTypeException {

  public WrongReturnTypeForUnionException(
      GraphQLUnionType union, String fieldName, String returnType) {
    super(
        "The type \""
            + returnType
            + "\" of the field \""
            + fieldName
            + "\" is not in the list of the types of the union: \""
            + union.getName()
            + "\"",
        union);
  }
}
