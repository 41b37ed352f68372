package trestle.converter;

import trestle.api.cache.TypeCache;
import trestle.api.definition.ArgumentDefinition;
import trestle.api.definition.DirectiveDefinition;
import trestle.api.definition.FieldDefinition;
import trestle.api.definition.TypeDefinition;
import trestle.api.definition.TypeRef;
import trestle.api.definition.UnionDefinition;
import trestle.api.exceptions.UnrecognizedTypeKindException;
import trestle.api.scalars.CustomScalar;

/**
 * First pass of {@link SchemaTypeConverter#convertAll}: registers a skeleton for every named type
 * reachable from a reference. A name is descended into only when it is newly registered, so the
 * walk visits each definition once even when definitions reference each other.
 */
final class DefinitionWalker {

  private final TypeCache cache;

  DefinitionWalker(TypeCache cache) {
    this.cache = cache;
  }

  void register(TypeRef ref) {
    switch (ref.kind()) {
      case LIST -> register(((TypeRef.ListRef) ref).of());
      case OPTIONAL -> register(((TypeRef.OptionalRef) ref).of());
      case OBJECT, INPUT, INTERFACE -> registerComposite(((TypeRef.CompositeRef) ref).definition());
      case ENUM -> cache.register(((TypeRef.EnumRef) ref).definition());
      case SCALAR -> {
        if (((TypeRef.ScalarRef) ref).marker() instanceof CustomScalar scalar) {
          cache.register(scalar);
        }
      }
      case UNION -> {
        UnionDefinition union = ((TypeRef.UnionRef) ref).definition();
        if (cache.register(union)) {
          union.members().forEach(this::register);
        }
      }
      default -> throw new UnrecognizedTypeKindException("Cannot walk type reference " + ref);
    }
  }

  void register(DirectiveDefinition directive) {
    directive.arguments().forEach(this::registerArgument);
  }

  private void registerComposite(TypeDefinition definition) {
    if (!cache.register(definition)) {
      return;
    }
    for (TypeDefinition iface : definition.interfaces()) {
      register(TypeRef.of(iface));
    }
    for (FieldDefinition field : definition.fields()) {
      register(field.type());
      field.arguments().forEach(this::registerArgument);
    }
  }

  private void registerArgument(ArgumentDefinition argument) {
    register(argument.type());
  }
}
