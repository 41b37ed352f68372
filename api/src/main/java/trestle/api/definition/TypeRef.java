package trestle.api.definition;

import java.util.Objects;
import trestle.api.exceptions.UnrecognizedTypeKindException;
import trestle.api.scalars.BuiltInScalar;
import trestle.api.scalars.CustomScalar;
import trestle.api.scalars.ScalarMarker;

/**
 * Reference to a type from a field, argument or union member. A bare reference is non-null;
 * nullability is opted into with {@link #optional(TypeRef)}.
 *
 * <pre>{@code
 * TypeRef.list(TypeRef.optional(TypeRef.of(user)))   // [User]!
 * TypeRef.optional(TypeRef.list(TypeRef.of(user)))   // [User!]
 * }</pre>
 */
public sealed interface TypeRef
    permits TypeRef.CompositeRef,
        TypeRef.EnumRef,
        TypeRef.ScalarRef,
        TypeRef.UnionRef,
        TypeRef.ListRef,
        TypeRef.OptionalRef {

  TypeKind kind();

  static TypeRef of(NamedTypeDefinition definition) {
    Objects.requireNonNull(definition, "definition");
    if (definition instanceof TypeDefinition composite) {
      return new CompositeRef(composite);
    } else if (definition instanceof EnumDefinition enumDefinition) {
      return new EnumRef(enumDefinition);
    } else if (definition instanceof UnionDefinition union) {
      return new UnionRef(union);
    } else if (definition instanceof CustomScalar scalar) {
      return new ScalarRef(scalar);
    }
    throw new UnrecognizedTypeKindException(
        "Cannot reference " + definition.kind() + " definition '" + definition.name() + "'");
  }

  static TypeRef scalar(ScalarMarker marker) {
    return new ScalarRef(marker);
  }

  static TypeRef string() {
    return new ScalarRef(BuiltInScalar.STRING);
  }

  static TypeRef integer() {
    return new ScalarRef(BuiltInScalar.INT);
  }

  static TypeRef list(TypeRef of) {
    return new ListRef(of);
  }

  static TypeRef optional(TypeRef of) {
    return new OptionalRef(of);
  }

  /** Object, input or interface reference; the tag follows the definition's kind. */
  record CompositeRef(TypeDefinition definition) implements TypeRef {
    public CompositeRef {
      Objects.requireNonNull(definition, "definition");
    }

    @Override
    public TypeKind kind() {
      return definition.kind();
    }
  }

  record EnumRef(EnumDefinition definition) implements TypeRef {
    public EnumRef {
      Objects.requireNonNull(definition, "definition");
    }

    @Override
    public TypeKind kind() {
      return TypeKind.ENUM;
    }
  }

  record ScalarRef(ScalarMarker marker) implements TypeRef {
    public ScalarRef {
      Objects.requireNonNull(marker, "marker");
    }

    @Override
    public TypeKind kind() {
      return TypeKind.SCALAR;
    }
  }

  record UnionRef(UnionDefinition definition) implements TypeRef {
    public UnionRef {
      Objects.requireNonNull(definition, "definition");
    }

    @Override
    public TypeKind kind() {
      return TypeKind.UNION;
    }
  }

  record ListRef(TypeRef of) implements TypeRef {
    public ListRef {
      Objects.requireNonNull(of, "of");
    }

    @Override
    public TypeKind kind() {
      return TypeKind.LIST;
    }
  }

  record OptionalRef(TypeRef of) implements TypeRef {
    public OptionalRef {
      Objects.requireNonNull(of, "of");
    }

    @Override
    public TypeKind kind() {
      return TypeKind.OPTIONAL;
    }
  }
}
