package trestle.api.definition;

import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import trestle.api.unions.TypeResolverFactory;
import trestle.api.unions.UnionMemberTypeResolver;

/**
 * A union of object types. Members are plain references; each must turn out to be an object type
 * when converted.
 */
public record UnionDefinition(
    String name,
    @Nullable String description,
    List<TypeRef> members,
    TypeResolverFactory typeResolverFactory)
    implements NamedTypeDefinition {

  public UnionDefinition {
    NamedTypeDefinition.requireName(name);
    Objects.requireNonNull(typeResolverFactory, "typeResolverFactory");
    members = List.copyOf(members);
  }

  /** A union whose runtime values are classified by the members' origin classes. */
  public static UnionDefinition of(String name, @Nullable String description, TypeRef... members) {
    return new UnionDefinition(
        name, description, List.of(members), UnionMemberTypeResolver.factory());
  }

  @Override
  public TypeKind kind() {
    return TypeKind.UNION;
  }
}
