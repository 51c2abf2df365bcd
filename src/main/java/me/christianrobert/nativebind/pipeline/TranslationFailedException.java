package me.christianrobert.nativebind.pipeline;

import me.christianrobert.nativebind.diagnostic.model.DiagnosticEntry;

import java.util.List;

/**
 * Thrown by the pipeline when it is configured to fail on Error diagnostics and the verified library
 * still contains some.
 */
public class TranslationFailedException extends RuntimeException {

    private static final int MAX_LISTED_ERRORS = 10;

    private final List<DiagnosticEntry> errors;

    public TranslationFailedException(List<DiagnosticEntry> errors) {
        super(buildMessage(errors));
        this.errors = List.copyOf(errors);
    }

    public List<DiagnosticEntry> getErrors() {
        return errors;
    }

    private static String buildMessage(List<DiagnosticEntry> errors) {
        StringBuilder sb = new StringBuilder("Translation finished with ")
                .append(errors.size())
                .append(" error(s)");
        for (int i = 0; i < errors.size() && i < MAX_LISTED_ERRORS; i++) {
            sb.append("\n  ").append(errors.get(i));
        }
        if (errors.size() > MAX_LISTED_ERRORS) {
            sb.append("\n  ... and ").append(errors.size() - MAX_LISTED_ERRORS).append(" more");
        }
        return sb.toString();
    }
}
