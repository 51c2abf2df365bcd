package me.christianrobert.nativebind.diagnostic.model;

import me.christianrobert.nativebind.diagnostic.Severity;

/**
 * One diagnostic together with the declaration it is attached to.
 */
public class DiagnosticEntry {

    private final String declarationPath;
    private final String declarationKind;
    private final String filePath;
    private final Severity severity;
    private final String message;

    public DiagnosticEntry(String declarationPath, String declarationKind, String filePath, Severity severity, String message) {
        if (severity == null) {
            throw new IllegalArgumentException("Severity cannot be null");
        }
        this.declarationPath = declarationPath;
        this.declarationKind = declarationKind;
        this.filePath = filePath;
        this.severity = severity;
        this.message = message;
    }

    /**
     * Path of the declaration (namespace, enclosing declarations, name), or null for library-level
     * diagnostics reported while parsing.
     */
    public String getDeclarationPath() {
        return declarationPath;
    }

    public String getDeclarationKind() {
        return declarationKind;
    }

    public String getFilePath() {
        return filePath;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        String location = declarationPath != null ? declarationPath : "<library>";
        return severity + " " + location + ": " + message;
    }
}
