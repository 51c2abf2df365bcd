package me.christianrobert.nativebind.declaration.abi;

/**
 * Calling convention as spelled in the source (attribute or platform default) and recorded by the front end.
 */
public enum AstCallingConvention {
    C,
    X86_STD_CALL,
    X86_FAST_CALL,
    X86_THIS_CALL,
    X86_VECTOR_CALL,
    X86_PASCAL,
    X86_REG_CALL,
    WIN64,
    X86_64_SYSV,
    AAPCS,
    AAPCS_VFP,
    AARCH64_VECTOR_CALL,
    SWIFT,
    PRESERVE_MOST,
    PRESERVE_ALL,
    INVALID
}
