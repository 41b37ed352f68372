package trestle.converter;

import graphql.schema.GraphQLList;
import graphql.schema.GraphQLNonNull;
import graphql.schema.GraphQLType;
import java.util.function.Function;
import trestle.api.definition.TypeKind;
import trestle.api.definition.TypeRef;

/**
 * Applies list and non-null modifiers around a resolved named type. The innermost named type is
 * resolved first, then wrapped in a list if the reference is one, then wrapped in non-null unless
 * the reference is optional.
 */
final class ModifierComposer {

  GraphQLType compose(TypeRef ref, Function<TypeRef, GraphQLType> namedTypes) {
    boolean optional = false;
    TypeRef inner = ref;
    while (inner.kind() == TypeKind.OPTIONAL) {
      optional = true;
      inner = ((TypeRef.OptionalRef) inner).of();
    }

    GraphQLType type;
    if (inner.kind() == TypeKind.LIST) {
      type = GraphQLList.list(compose(((TypeRef.ListRef) inner).of(), namedTypes));
    } else {
      type = namedTypes.apply(inner);
    }

    return optional ? type : GraphQLNonNull.nonNull(type);
  }
}
