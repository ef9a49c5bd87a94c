package cosynth.model;

/**
 * Result of evaluating an expression at compile time. Either a constant of the
 * compile-time world or a reference to hardware storage.
 */
public sealed interface Value permits ConstantValue, StorageObject {}
