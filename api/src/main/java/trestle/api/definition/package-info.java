/**
 * The type-definition graph the converter reads.
 *
 * <p>Definitions are produced by an external provider and treated as read-only input. Every
 * reference between definitions goes through {@link trestle.api.definition.TypeRef}, whose
 * {@link trestle.api.definition.TypeKind} tag decides how it is converted.
 */
@NullMarked
package trestle.api.definition;

import org.jspecify.annotations.NullMarked;
