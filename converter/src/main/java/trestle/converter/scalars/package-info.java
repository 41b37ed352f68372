@NullMarked
package trestle.converter.scalars;

import org.jspecify.annotations.NullMarked;
