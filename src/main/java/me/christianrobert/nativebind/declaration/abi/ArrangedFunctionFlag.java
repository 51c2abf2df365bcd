package me.christianrobert.nativebind.declaration.abi;

/**
 * Structural flags of a function's ABI arrangement.
 */
public enum ArrangedFunctionFlag {
    IS_VARIADIC,
    IS_CHAIN_CALL,
    IS_NO_RETURN,
    IS_RETURNS_RETAINED,
    IS_NO_CALLER_SAVED_REGISTERS,
    HAS_REG_PARM,
    IS_NO_CF_CHECK,
    /**
     * The function receives arguments through an {@code inalloca} memory block.
     */
    USES_IN_ALLOCA,
    /**
     * The arrangement carries per-parameter ABI info beyond the passing kind.
     */
    HAS_EXTENDED_PARAMETER_INFO
}
