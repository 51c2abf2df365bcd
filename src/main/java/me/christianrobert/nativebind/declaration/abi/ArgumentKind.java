package me.christianrobert.nativebind.declaration.abi;

/**
 * How a single argument or return value is physically passed.
 */
public enum ArgumentKind {
    /**
     * Passed directly in registers or on the stack.
     */
    DIRECT,

    /**
     * Passed directly after sign or zero extension.
     */
    EXTEND,

    /**
     * Passed through a hidden pointer to a caller-owned copy.
     */
    INDIRECT,

    /**
     * Like {@link #INDIRECT}, but the callee may alias the memory.
     */
    INDIRECT_ALIASED,

    /**
     * Not passed at all (empty aggregates).
     */
    IGNORE,

    /**
     * Aggregate split into its elements, each passed separately.
     */
    EXPAND,

    /**
     * Aggregate coerced to a sequence of registers and then expanded.
     */
    COERCE_AND_EXPAND,

    /**
     * Passed in the argument memory block allocated by the caller (32-bit Windows).
     */
    IN_ALLOCA;

    /**
     * Whether the argument is split across several native slots.
     */
    public boolean isExpanded() {
        return this == EXPAND || this == COERCE_AND_EXPAND;
    }
}
