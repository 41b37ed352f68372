package trestle.converter;

import static org.assertj.core.api.Assertions.assertThat;

import graphql.introspection.Introspection.DirectiveLocation;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import trestle.api.cache.CacheEntry;
import trestle.api.cache.TypeCache;
import trestle.api.definition.ArgumentDefinition;
import trestle.api.definition.DirectiveDefinition;
import trestle.api.definition.EnumDefinition;
import trestle.api.definition.EnumValueDefinition;
import trestle.api.definition.FieldDefinition;
import trestle.api.definition.TypeDefinition;
import trestle.api.definition.TypeRef;
import trestle.api.definition.UnionDefinition;
import trestle.api.scalars.CustomScalar;

class DefinitionWalkerTest {

  private final TypeCache cache = new TypeCache();
  private final DefinitionWalker walker = new DefinitionWalker(cache);

  @Test
  void registersEveryReachableNameOnce() {
    CustomScalar date = CustomScalar.of("Date", new TestCoercing());
    EnumDefinition status =
        new EnumDefinition("Status", null, List.of(EnumValueDefinition.of("OPEN", "OPEN")));
    TypeDefinition node =
        TypeDefinition.iface("Node", Object.class)
            .addField(FieldDefinition.newField("id").type(TypeRef.string()).build());
    TypeDefinition filter = TypeDefinition.input("Filter", Object.class);
    filter.addField(
        FieldDefinition.newField("and")
            .type(TypeRef.optional(TypeRef.list(TypeRef.of(filter))))
            .build());
    TypeDefinition ticket = TypeDefinition.object("Ticket", Object.class).addInterface(node);
    UnionDefinition result = UnionDefinition.of("Result", null, TypeRef.of(ticket));
    ticket
        .addField(FieldDefinition.newField("id").type(TypeRef.string()).build())
        .addField(FieldDefinition.newField("opened").type(TypeRef.of(date)).build())
        .addField(FieldDefinition.newField("status").type(TypeRef.of(status)).build())
        .addField(
            FieldDefinition.newField("related")
                .type(TypeRef.list(TypeRef.of(result)))
                .argument(ArgumentDefinition.of("filter", TypeRef.of(filter)))
                .build());

    walker.register(TypeRef.of(ticket));

    assertThat(cache.entries())
        .extracting(CacheEntry::name)
        .containsExactly("Ticket", "Node", "Date", "Status", "Result", "Filter");
    assertThat(cache.entries()).allMatch(entry -> entry.state() == CacheEntry.State.REGISTERED);
    assertThat(cache.pending()).hasSize(6);
  }

  @Test
  void builtInScalarsAreNotRegistered() {
    walker.register(TypeRef.list(TypeRef.optional(TypeRef.string())));

    assertThat(cache.size()).isZero();
  }

  @Test
  void directiveArgumentTypesAreRegistered() {
    TypeDefinition scope =
        TypeDefinition.input("Scope", Object.class)
            .addField(FieldDefinition.newField("team").type(TypeRef.string()).build());
    walker.register(
        new DirectiveDefinition(
            "restricted",
            Set.of(DirectiveLocation.FIELD_DEFINITION),
            List.of(ArgumentDefinition.of("scope", TypeRef.of(scope))),
            null,
            false));

    assertThat(cache.contains("Scope")).isTrue();
  }
}
