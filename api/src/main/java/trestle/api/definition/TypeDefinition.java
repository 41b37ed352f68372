package trestle.api.definition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Definition of a composite type: an object, an input object or an interface.
 *
 * <p>Fields and implemented interfaces may be appended after the definition is created, which is
 * how two definitions come to reference each other:
 *
 * <pre>{@code
 * TypeDefinition author = TypeDefinition.object("Author", Author.class);
 * TypeDefinition book = TypeDefinition.object("Book", Book.class);
 * author.addField(FieldDefinition.newField("books").type(TypeRef.list(TypeRef.of(book))).build());
 * book.addField(FieldDefinition.newField("author").type(TypeRef.of(author)).build());
 * }</pre>
 *
 * <p>The converter only reads definitions; it never appends to them.
 */
public final class TypeDefinition implements NamedTypeDefinition {

  /** The composite kinds a {@link TypeDefinition} can have. */
  public enum Kind {
    OBJECT(TypeKind.OBJECT),
    INPUT(TypeKind.INPUT),
    INTERFACE(TypeKind.INTERFACE);

    private final TypeKind typeKind;

    Kind(TypeKind typeKind) {
      this.typeKind = typeKind;
    }

    public TypeKind typeKind() {
      return typeKind;
    }
  }

  private final String name;
  private final @Nullable String description;
  private final Kind definitionKind;
  private final Class<?> origin;
  private final List<FieldDefinition> fields = new ArrayList<>();
  private final List<TypeDefinition> interfaces = new ArrayList<>();

  public TypeDefinition(
      String name, @Nullable String description, Kind definitionKind, Class<?> origin) {
    this.name = NamedTypeDefinition.requireName(name);
    this.description = description;
    this.definitionKind = Objects.requireNonNull(definitionKind, "definitionKind");
    this.origin = Objects.requireNonNull(origin, "origin");
  }

  public static TypeDefinition object(String name, Class<?> origin) {
    return new TypeDefinition(name, null, Kind.OBJECT, origin);
  }

  public static TypeDefinition input(String name, Class<?> origin) {
    return new TypeDefinition(name, null, Kind.INPUT, origin);
  }

  public static TypeDefinition iface(String name, Class<?> origin) {
    return new TypeDefinition(name, null, Kind.INTERFACE, origin);
  }

  /** Appends a field and returns this definition. */
  public TypeDefinition addField(FieldDefinition field) {
    fields.add(Objects.requireNonNull(field, "field"));
    return this;
  }

  /** Appends an implemented interface and returns this definition. */
  public TypeDefinition addInterface(TypeDefinition iface) {
    interfaces.add(Objects.requireNonNull(iface, "iface"));
    return this;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public @Nullable String description() {
    return description;
  }

  @Override
  public TypeKind kind() {
    return definitionKind.typeKind();
  }

  public Kind definitionKind() {
    return definitionKind;
  }

  /** The native class whose instances this type represents at execution time. */
  public Class<?> origin() {
    return origin;
  }

  public List<FieldDefinition> fields() {
    return Collections.unmodifiableList(fields);
  }

  public List<TypeDefinition> interfaces() {
    return Collections.unmodifiableList(interfaces);
  }

  /** Returns true if this definition lists {@code interfaceName}, directly or transitively. */
  public boolean implementsInterface(String interfaceName) {
    return implementsInterface(interfaceName, new HashSet<>());
  }

  private boolean implementsInterface(String interfaceName, Set<String> visited) {
    if (!visited.add(name)) {
      return false;
    }
    for (TypeDefinition iface : interfaces) {
      if (iface.name().equals(interfaceName) || iface.implementsInterface(interfaceName, visited)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public String toString() {
    return definitionKind + " " + name;
  }
}
