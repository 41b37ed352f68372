package trestle.converter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import graphql.Scalars;
import graphql.schema.GraphQLEnumType;
import graphql.schema.GraphQLFieldDefinition;
import graphql.schema.GraphQLInputObjectType;
import graphql.schema.GraphQLInterfaceType;
import graphql.schema.GraphQLNamedType;
import graphql.schema.GraphQLNonNull;
import graphql.schema.GraphQLObjectType;
import graphql.schema.GraphQLScalarType;
import graphql.schema.GraphQLUnionType;
import java.util.List;
import org.junit.jupiter.api.Test;
import trestle.api.cache.CacheEntry;
import trestle.api.definition.EnumDefinition;
import trestle.api.definition.EnumValueDefinition;
import trestle.api.definition.FieldDefinition;
import trestle.api.definition.TypeDefinition;
import trestle.api.definition.TypeRef;
import trestle.api.definition.UnionDefinition;
import trestle.api.exceptions.InternalConsistencyException;
import trestle.api.exceptions.UnrecognizedTypeKindException;
import trestle.api.exceptions.WrongKindForBuilderException;
import trestle.api.scalars.CustomScalar;

class SchemaTypeConverterTest {

  static class Point {}

  static class Line {}

  private final SchemaTypeConverter converter = new SchemaTypeConverter();

  private static TypeDefinition point() {
    return TypeDefinition.object("Point", Point.class)
        .addField(FieldDefinition.newField("x").type(TypeRef.integer()).build())
        .addField(FieldDefinition.newField("y").type(TypeRef.integer()).build());
  }

  @Test
  void buildsPointWithTwoNonNullIntegerFields() {
    GraphQLObjectType point = converter.fromObjectType(point());

    assertThat(point.getName()).isEqualTo("Point");
    assertThat(point.getFieldDefinitions())
        .extracting(GraphQLFieldDefinition::getName)
        .containsExactly("x", "y");
    for (GraphQLFieldDefinition field : point.getFieldDefinitions()) {
      assertThat(field.getType()).isInstanceOf(GraphQLNonNull.class);
      assertThat(((GraphQLNonNull) field.getType()).getWrappedType())
          .isSameAs(Scalars.GraphQLInt);
    }
    assertThat(converter.cache().size()).isEqualTo(1);
    assertThat(converter.cache().get("Point").orElseThrow().implementation()).isSameAs(point);
  }

  @Test
  void objectReachedThroughTwoPathsIsOneInstance() {
    TypeDefinition point = point();
    TypeDefinition line =
        TypeDefinition.object("Line", Line.class)
            .addField(FieldDefinition.newField("start").type(TypeRef.of(point)).build())
            .addField(
                FieldDefinition.newField("end").type(TypeRef.optional(TypeRef.of(point))).build());

    GraphQLObjectType lineType = converter.fromObjectType(line);

    GraphQLNonNull start = (GraphQLNonNull) lineType.getFieldDefinition("start").getType();
    assertThat(start.getWrappedType()).isSameAs(lineType.getFieldDefinition("end").getType());
    assertThat(converter.fromObjectType(point)).isSameAs(start.getWrappedType());
    assertThat(converter.namedType(TypeRef.of(point))).isSameAs(start.getWrappedType());
  }

  @Test
  void everyKindIsIdempotentByName() {
    TypeDefinition filter =
        TypeDefinition.input("Filter", Object.class)
            .addField(FieldDefinition.newField("term").type(TypeRef.string()).build());
    TypeDefinition node =
        TypeDefinition.iface("Node", Object.class)
            .addField(FieldDefinition.newField("id").type(TypeRef.string()).build());
    EnumDefinition color =
        new EnumDefinition("Color", null, List.of(EnumValueDefinition.of("RED", "red")));
    CustomScalar date = CustomScalar.of("Date", new TestCoercing());
    TypeDefinition point = point();
    UnionDefinition shape = UnionDefinition.of("Shape", null, TypeRef.of(point));

    GraphQLInputObjectType filterType = converter.fromInputObjectType(filter);
    GraphQLInterfaceType nodeType = converter.fromInterface(node);
    GraphQLEnumType colorType = converter.fromEnum(color);
    GraphQLScalarType dateType = converter.fromScalar(date);
    GraphQLUnionType shapeType = converter.fromUnion(shape);
    GraphQLObjectType pointType = converter.fromObjectType(point);

    assertThat(converter.namedType(TypeRef.of(filter))).isSameAs(filterType);
    assertThat(converter.namedType(TypeRef.of(node))).isSameAs(nodeType);
    assertThat(converter.namedType(TypeRef.of(color))).isSameAs(colorType);
    assertThat(converter.namedType(TypeRef.of(date))).isSameAs(dateType);
    assertThat(converter.namedType(TypeRef.of(shape))).isSameAs(shapeType);
    assertThat(converter.namedType(TypeRef.of(point))).isSameAs(pointType);
    assertThat(shapeType.getTypes()).containsExactly(pointType);
    assertThat(converter.cache().size()).isEqualTo(6);
  }

  @Test
  void convertAllRegistersThenBuildsEveryReachableName() {
    EnumDefinition color =
        new EnumDefinition("Color", null, List.of(EnumValueDefinition.of("RED", "red")));
    TypeDefinition point = point();
    TypeDefinition query =
        TypeDefinition.object("Query", Object.class)
            .addField(FieldDefinition.newField("origin").type(TypeRef.of(point)).build())
            .addField(FieldDefinition.newField("color").type(TypeRef.of(color)).build());

    List<GraphQLNamedType> roots = converter.convertAll(List.of(query));

    assertThat(roots).hasSize(1);
    assertThat(roots.get(0).getName()).isEqualTo("Query");
    assertThat(converter.cache().entries())
        .extracting(CacheEntry::name)
        .containsExactly("Query", "Point", "Color");
    assertThat(converter.cache().entries()).allMatch(CacheEntry::isBuilt);
    assertThat(converter.cache().pending()).isEmpty();
  }

  @Test
  void convertAllIsRepeatable() {
    TypeDefinition point = point();

    GraphQLNamedType first = converter.convertAll(List.of(point)).get(0);
    GraphQLNamedType second = converter.convertAll(List.of(point)).get(0);

    assertThat(second).isSameAs(first);
    assertThat(converter.cache().size()).isEqualTo(1);
  }

  @Test
  void wrapperInNamedPositionIsUnrecognized() {
    assertThatThrownBy(() -> converter.namedType(TypeRef.list(TypeRef.string())))
        .isInstanceOf(UnrecognizedTypeKindException.class)
        .hasMessageContaining("LIST");
    assertThatThrownBy(() -> converter.namedType(TypeRef.optional(TypeRef.string())))
        .isInstanceOf(UnrecognizedTypeKindException.class)
        .hasMessageContaining("OPTIONAL");
  }

  @Test
  void objectTypeIsNotAllowedAsInput() {
    assertThatThrownBy(() -> converter.inputType(TypeRef.of(point())))
        .isInstanceOf(WrongKindForBuilderException.class)
        .hasMessageContaining("'Point'")
        .hasMessageContaining("INPUT position");
  }

  @Test
  void inputTypeIsNotAllowedAsOutput() {
    TypeDefinition filter = TypeDefinition.input("Filter", Object.class);

    assertThatThrownBy(() -> converter.outputType(TypeRef.optional(TypeRef.of(filter))))
        .isInstanceOf(WrongKindForBuilderException.class)
        .hasMessageContaining("OUTPUT position");
  }

  @Test
  void nameReusedByAnotherKindIsInconsistent() {
    converter.fromObjectType(point());
    EnumDefinition clash =
        new EnumDefinition("Point", null, List.of(EnumValueDefinition.of("A", "a")));

    assertThatThrownBy(() -> converter.namedType(TypeRef.of(clash)))
        .isInstanceOf(InternalConsistencyException.class)
        .hasMessageContaining("'Point'");
  }

  @Test
  void separateContextsDoNotShareTypes() {
    SchemaTypeConverter other = new SchemaTypeConverter();
    TypeDefinition point = point();

    assertThat(other.fromObjectType(point)).isNotSameAs(converter.fromObjectType(point));
  }

  @Test
  void sharedContextSharesTypes() {
    BuildContext context = BuildContext.create();
    TypeDefinition point = point();

    GraphQLObjectType first = new SchemaTypeConverter(context).fromObjectType(point);
    GraphQLObjectType second = new SchemaTypeConverter(context).fromObjectType(point);

    assertThat(second).isSameAs(first);
  }
}
