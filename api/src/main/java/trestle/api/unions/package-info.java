/** Runtime classification of union values. */
@NullMarked
package trestle.api.unions;

import org.jspecify.annotations.NullMarked;
