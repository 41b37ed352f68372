/**
 * Converts a type-definition graph into graphql-java schema types.
 *
 * <p>{@link trestle.converter.SchemaTypeConverter} is the entry point. It routes every
 * {@link trestle.api.definition.TypeRef} by its kind tag to the builder for that kind, and every
 * builder records its result in the build's {@link trestle.api.cache.TypeCache}.
 */
@NullMarked
package trestle.converter;

import org.jspecify.annotations.NullMarked;
