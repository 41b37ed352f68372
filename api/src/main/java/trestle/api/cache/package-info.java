/** The per-build registry of named types. */
@NullMarked
package trestle.api.cache;

import org.jspecify.annotations.NullMarked;
