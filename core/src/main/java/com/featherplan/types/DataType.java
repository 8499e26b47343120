package com.featherplan.types;

/**
 * Sealed interface for all data types known to the optimizer.
 *
 * <p>Types are resolved by analysis before a plan reaches the optimizer, so
 * every expression reports a concrete type. The optimizer only needs types to
 * compare them (redundant cast removal), to label folded literals and to pick
 * an evaluation path for constant folding.
 *
 * <p>Primitive types are singletons obtained via {@code get()}.
 */
public sealed interface DataType
    permits BooleanType, IntegerType, LongType, DoubleType, StringType,
            NullType, StructType {

    /**
     * Returns a human-readable name for this data type.
     *
     * @return the type name
     */
    String typeName();

    /**
     * Returns the default size in bytes for values of this type.
     *
     * <p>Returns -1 for variable-length types.
     *
     * @return the default size in bytes, or -1 for variable-length types
     */
    default int defaultSize() {
        return -1;
    }

    /**
     * Returns whether values of this type are numbers.
     *
     * @return true for integral and fractional types
     */
    default boolean isNumeric() {
        return false;
    }

    /**
     * Returns whether values of this type are whole numbers.
     *
     * @return true for integer and long
     */
    default boolean isIntegral() {
        return false;
    }
}
