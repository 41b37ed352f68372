package trestle.api.scalars;

/** Identifies a scalar: one of the built-in primitives or a custom scalar definition. */
public sealed interface ScalarMarker permits BuiltInScalar, CustomScalar {}
