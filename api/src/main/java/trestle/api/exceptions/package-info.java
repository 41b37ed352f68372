/**
 * Errors raised while converting definitions.
 *
 * <p>Everything under {@link trestle.api.exceptions.SchemaConversionException} is fatal to the
 * build. {@link trestle.api.exceptions.WrongReturnTypeForUnionException} is the only error raised
 * at execution time.
 */
@NullMarked
package trestle.api.exceptions;

import org.jspecify.annotations.NullMarked;
