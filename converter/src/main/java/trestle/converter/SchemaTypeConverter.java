package trestle.converter;

import graphql.schema.GraphQLDirective;
import graphql.schema.GraphQLEnumType;
import graphql.schema.GraphQLInputObjectType;
import graphql.schema.GraphQLInputType;
import graphql.schema.GraphQLInterfaceType;
import graphql.schema.GraphQLNamedType;
import graphql.schema.GraphQLObjectType;
import graphql.schema.GraphQLOutputType;
import graphql.schema.GraphQLScalarType;
import graphql.schema.GraphQLType;
import graphql.schema.GraphQLUnionType;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import trestle.api.cache.CacheEntry;
import trestle.api.cache.TypeCache;
import trestle.api.definition.DirectiveDefinition;
import trestle.api.definition.EnumDefinition;
import trestle.api.definition.FieldDefinition;
import trestle.api.definition.NamedTypeDefinition;
import trestle.api.definition.TypeDefinition;
import trestle.api.definition.TypeKind;
import trestle.api.definition.TypeRef;
import trestle.api.definition.UnionDefinition;
import trestle.api.exceptions.UnrecognizedTypeKindException;
import trestle.api.exceptions.WrongKindForBuilderException;
import trestle.api.scalars.ScalarMarker;

/**
 * Entry point of the conversion. Routes type references to the builder for their kind and
 * exposes each builder's operation.
 *
 * <p>Two ways to drive it:
 *
 * <ul>
 *   <li>{@link #convertAll(Collection)} registers a skeleton for every named type reachable from
 *       the given definitions, then builds them all. After it returns, every reachable name has a
 *       built cache entry.
 *   <li>{@link #convert(TypeRef, TypePosition)} and the {@code from*} methods build on demand.
 * </ul>
 *
 * <p>Either way, a reference to a type that is still being built becomes a
 * {@link graphql.schema.GraphQLTypeReference}; graphql-java swaps it for the built type when the
 * schema is assembled.
 *
 * <p>One converter serves one {@link BuildContext}. It keeps no other state.
 */
public final class SchemaTypeConverter {

  private static final Logger log = LoggerFactory.getLogger(SchemaTypeConverter.class);

  private final BuildContext context;
  private final ModifierComposer modifiers = new ModifierComposer();
  private final DefinitionWalker walker;
  private final CompositeTypeBuilder composites;
  private final EnumTypeBuilder enums;
  private final UnionTypeBuilder unions;
  private final FieldMaterializer fields;
  private final DirectiveBuilder directives;

  public SchemaTypeConverter(BuildContext context) {
    this.context = Objects.requireNonNull(context, "context");
    this.walker = new DefinitionWalker(context.cache());
    this.fields = new FieldMaterializer(this, context);
    this.composites = new CompositeTypeBuilder(context, this, fields);
    this.enums = new EnumTypeBuilder(context);
    this.unions = new UnionTypeBuilder(context, this);
    this.directives = new DirectiveBuilder(fields);
  }

  public SchemaTypeConverter() {
    this(BuildContext.create());
  }

  public BuildContext context() {
    return context;
  }

  public TypeCache cache() {
    return context.cache();
  }

  /**
   * Converts every named type reachable from {@code roots} in two passes: the first registers a
   * skeleton per name, the second builds each registered name.
   *
   * @return the built types of {@code roots}, in the given order
   */
  public List<GraphQLNamedType> convertAll(Collection<? extends NamedTypeDefinition> roots) {
    for (NamedTypeDefinition root : roots) {
      walker.register(TypeRef.of(root));
    }
    List<CacheEntry> pending = cache().pending();
    log.debug("Building {} registered types", pending.size());
    for (CacheEntry entry : pending) {
      if (isStillRegistered(entry.name())) {
        namedType(TypeRef.of(entry.definition()));
      }
    }
    List<GraphQLNamedType> built = new ArrayList<>();
    for (NamedTypeDefinition root : roots) {
      built.add(namedType(TypeRef.of(root)));
    }
    return built;
  }

  /** Registers skeletons for the types a directive's arguments reach, without building them. */
  public void register(DirectiveDefinition directive) {
    walker.register(directive);
  }

  /**
   * Converts a possibly wrapped reference appearing in {@code position}, applying list and
   * non-null modifiers.
   */
  public GraphQLType convert(TypeRef ref, TypePosition position) {
    return modifiers.compose(ref, named -> namedType(named, position));
  }

  public GraphQLOutputType outputType(TypeRef ref) {
    return (GraphQLOutputType) convert(ref, TypePosition.OUTPUT);
  }

  public GraphQLInputType inputType(TypeRef ref) {
    return (GraphQLInputType) convert(ref, TypePosition.INPUT);
  }

  /**
   * Converts a bare named reference. Returns the cached type when the name is built, and the
   * name's skeleton reference while it is being built.
   *
   * @throws UnrecognizedTypeKindException if {@code ref} is a list or optional wrapper
   */
  public GraphQLNamedType namedType(TypeRef ref) {
    return switch (ref.kind()) {
      case OBJECT, INPUT, INTERFACE -> composite(((TypeRef.CompositeRef) ref).definition());
      case ENUM -> fromEnum(((TypeRef.EnumRef) ref).definition());
      case SCALAR -> fromScalar(((TypeRef.ScalarRef) ref).marker());
      case UNION -> {
        UnionDefinition union = ((TypeRef.UnionRef) ref).definition();
        yield skeletonOr(union).orElseGet(() -> unions.fromUnion(union));
      }
      default -> throw new UnrecognizedTypeKindException(
          "Expected a named type reference but got " + ref.kind() + ": " + ref);
    };
  }

  public GraphQLObjectType fromObjectType(TypeDefinition definition) {
    return composites.fromObjectType(definition);
  }

  public GraphQLInputObjectType fromInputObjectType(TypeDefinition definition) {
    return composites.fromInputObjectType(definition);
  }

  public GraphQLInterfaceType fromInterface(TypeDefinition definition) {
    return composites.fromInterface(definition);
  }

  public GraphQLEnumType fromEnum(EnumDefinition definition) {
    return enums.fromEnum(definition);
  }

  public GraphQLScalarType fromScalar(ScalarMarker marker) {
    return context.options().scalarRegistry().resolve(marker, cache());
  }

  public GraphQLUnionType fromUnion(UnionDefinition definition) {
    return unions.fromUnion(definition);
  }

  public ConvertedField fromField(String parentTypeName, FieldDefinition field) {
    return fields.fromField(parentTypeName, field);
  }

  public GraphQLDirective fromDirective(DirectiveDefinition definition) {
    return directives.fromDirective(definition);
  }

  private GraphQLNamedType namedType(TypeRef ref, TypePosition position) {
    checkPosition(ref, position);
    return namedType(ref);
  }

  private GraphQLNamedType composite(TypeDefinition definition) {
    Optional<GraphQLNamedType> skeleton = skeletonOr(definition);
    if (skeleton.isPresent()) {
      return skeleton.get();
    }
    return switch (definition.definitionKind()) {
      case INPUT -> composites.fromInputObjectType(definition);
      case INTERFACE -> composites.fromInterface(definition);
      case OBJECT -> composites.fromObjectType(definition);
    };
  }

  /**
   * Returns the cached implementation of a name that is built or being built, or empty when the
   * name still needs building.
   */
  private Optional<GraphQLNamedType> skeletonOr(NamedTypeDefinition definition) {
    Optional<CacheEntry> cached = cache().get(definition.name());
    if (cached.isEmpty() || cached.get().state() == CacheEntry.State.REGISTERED) {
      return Optional.empty();
    }
    CacheEntry entry = cached.get();
    BuildContext.checkSameKind(entry, definition);
    if (!entry.isBuilt()) {
      log.trace("'{}' is being built, using its type reference", entry.name());
    }
    return Optional.of(entry.implementation());
  }

  private boolean isStillRegistered(String name) {
    return cache()
        .get(name)
        .map(entry -> entry.state() == CacheEntry.State.REGISTERED)
        .orElse(false);
  }

  private static void checkPosition(TypeRef ref, TypePosition position) {
    TypeKind kind = ref.kind();
    boolean allowed =
        switch (kind) {
          case OBJECT, INTERFACE, UNION -> position == TypePosition.OUTPUT;
          case INPUT -> position == TypePosition.INPUT;
          default -> true;
        };
    if (!allowed) {
      throw new WrongKindForBuilderException(
          kind + " type " + describe(ref) + " cannot be used in " + position + " position");
    }
  }

  private static String describe(TypeRef ref) {
    if (ref instanceof TypeRef.CompositeRef composite) {
      return "'" + composite.definition().name() + "'";
    } else if (ref instanceof TypeRef.UnionRef union) {
      return "'" + union.definition().name() + "'";
    }
    return ref.toString();
  }
}
