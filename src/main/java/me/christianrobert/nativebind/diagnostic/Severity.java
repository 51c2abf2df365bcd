package me.christianrobert.nativebind.diagnostic;

/**
 * Severity of a {@link TranslationDiagnostic}.
 */
public enum Severity {
    /**
     * Informational note about a translation decision.
     */
    INFO,

    /**
     * The declaration is emitted, but through a fallback that may matter to consumers of the bindings.
     */
    WARNING,

    /**
     * The declaration cannot be represented and must not be emitted.
     */
    ERROR
}
