package me.christianrobert.nativebind.declaration.abi;

/**
 * Calling convention as lowered by the native code generator.
 */
public enum LlvmCallingConvention {
    C,
    FAST,
    COLD,
    X86_STD_CALL,
    X86_FAST_CALL,
    X86_THIS_CALL,
    X86_VECTOR_CALL,
    X86_REG_CALL,
    X86_64_SYSV,
    WIN64,
    ARM_AAPCS,
    ARM_AAPCS_VFP,
    AARCH64_VECTOR_CALL,
    SWIFT,
    PRESERVE_MOST,
    PRESERVE_ALL
}
