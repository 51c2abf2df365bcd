package me.christianrobert.nativebind.diagnostic;

import java.util.Objects;

/**
 * A severity-tagged message describing a decision or defect found while translating a declaration.
 *
 * <p>Diagnostics are attached to the declaration that produced them (see
 * {@code TranslatedDeclaration#getDiagnostics()}). Library-level diagnostics that belong to no
 * declaration live on {@code TranslatedLibrary#getParsingDiagnostics()}.</p>
 */
public final class TranslationDiagnostic {

    private final Severity severity;
    private final String message;

    public TranslationDiagnostic(Severity severity, String message) {
        if (severity == null) {
            throw new IllegalArgumentException("Severity cannot be null");
        }
        if (message == null) {
            throw new IllegalArgumentException("Message cannot be null");
        }
        this.severity = severity;
        this.message = message;
    }

    public static TranslationDiagnostic info(String message) {
        return new TranslationDiagnostic(Severity.INFO, message);
    }

    public static TranslationDiagnostic warning(String message) {
        return new TranslationDiagnostic(Severity.WARNING, message);
    }

    public static TranslationDiagnostic error(String message) {
        return new TranslationDiagnostic(Severity.ERROR, message);
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getMessage() {
        return message;
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TranslationDiagnostic that = (TranslationDiagnostic) o;
        return severity == that.severity && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(severity, message);
    }

    @Override
    public String toString() {
        return severity + ": " + message;
    }
}
