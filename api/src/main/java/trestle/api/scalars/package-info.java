/** Scalar markers and the registry that turns them into graphql-java scalar types. */
@NullMarked
package trestle.api.scalars;

import org.jspecify.annotations.NullMarked;
