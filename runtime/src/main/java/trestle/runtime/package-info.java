/**
 * Hands converted types to graphql-java.
 *
 * <p>{@link trestle.runtime.SchemaAssembler} converts the root definitions of a schema through
 * one build context and builds a {@link graphql.schema.GraphQLSchema} from the resulting cache,
 * including the data fetchers and type resolvers registered during conversion.
 */
@NullMarked
package trestle.runtime;

import org.jspecify.annotations.NullMarked;
