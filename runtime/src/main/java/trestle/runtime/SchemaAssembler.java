package trestle.runtime;

import graphql.schema.GraphQLDirective;
import graphql.schema.GraphQLNamedType;
import graphql.schema.GraphQLSchema;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import trestle.api.cache.TypeCache;
import trestle.api.definition.DirectiveDefinition;
import trestle.converter.BuildContext;
import trestle.converter.SchemaTypeConverter;

/**
 * Builds executable schemas from definitions.
 *
 * <p>Every schema assembled by one assembler shares its build context, so a type used by two
 * schemas is the same instance in both. Use a fresh assembler for an independent schema.
 */
public final class SchemaAssembler {

  private static final Logger log = LoggerFactory.getLogger(SchemaAssembler.class);

  private final BuildContext context;

  public SchemaAssembler(BuildContext context) {
    this.context = Objects.requireNonNull(context, "context");
  }

  public SchemaAssembler() {
    this(BuildContext.create());
  }

  public BuildContext context() {
    return context;
  }

  public SchemaBuild assemble(SchemaRoots roots) {
    SchemaTypeConverter converter = new SchemaTypeConverter(context);
    for (DirectiveDefinition directive : roots.directives()) {
      converter.register(directive);
    }
    converter.convertAll(roots.definitions());

    GraphQLSchema.Builder builder =
        GraphQLSchema.newSchema().query(converter.fromObjectType(roots.query()));
    if (roots.mutation() != null) {
      builder.mutation(converter.fromObjectType(roots.mutation()));
    }
    if (roots.subscription() != null) {
      builder.subscription(converter.fromObjectType(roots.subscription()));
    }
    for (DirectiveDefinition directive : roots.directives()) {
      GraphQLDirective converted = converter.fromDirective(directive);
      builder.additionalDirective(converted);
    }

    TypeCache cache = context.cache();
    List<GraphQLNamedType> builtTypes = cache.builtTypes();
    for (GraphQLNamedType type : builtTypes) {
      builder.additionalType(type);
    }
    GraphQLSchema schema = builder.codeRegistry(cache.codeRegistry().build()).build();
    log.debug(
        "Assembled schema with query type '{}' and {} cached types",
        roots.query().name(),
        builtTypes.size());
    return new SchemaBuild(schema, cache);
  }
}
