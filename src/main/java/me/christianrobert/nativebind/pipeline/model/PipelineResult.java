package me.christianrobert.nativebind.pipeline.model;

import me.christianrobert.nativebind.declaration.TranslatedLibrary;
import me.christianrobert.nativebind.diagnostic.model.DiagnosticReport;

import java.util.List;

/**
 * Result of running the translation pipeline.
 *
 * <p>A successful run completed every pass; the library may still contain declarations with Error
 * diagnostics ({@link #hasErrorDiagnostics()}), which the emission backend skips. A failed run was aborted
 * because a pass broke the engine contract, and {@link #getLibrary()} holds the input of the failing pass.</p>
 */
public class PipelineResult {

    private final boolean success;
    private final TranslatedLibrary library;
    private final List<String> executedPasses;
    private final DiagnosticReport report;
    private final String errorMessage;

    private PipelineResult(boolean success, TranslatedLibrary library, List<String> executedPasses,
                           DiagnosticReport report, String errorMessage) {
        this.success = success;
        this.library = library;
        this.executedPasses = executedPasses == null ? List.of() : List.copyOf(executedPasses);
        this.report = report;
        this.errorMessage = errorMessage;
    }

    public static PipelineResult success(TranslatedLibrary library, List<String> executedPasses, DiagnosticReport report) {
        return new PipelineResult(true, library, executedPasses, report, null);
    }

    public static PipelineResult failure(TranslatedLibrary library, List<String> executedPasses, String errorMessage) {
        return new PipelineResult(false, library, executedPasses, null, errorMessage);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    public TranslatedLibrary getLibrary() {
        return library;
    }

    /**
     * Names of the passes that ran to completion, in order.
     */
    public List<String> getExecutedPasses() {
        return executedPasses;
    }

    /**
     * Diagnostics of the final library, or null for failed runs.
     */
    public DiagnosticReport getReport() {
        return report;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public int getErrorCount() {
        return report == null ? 0 : report.getErrorCount();
    }

    public int getWarningCount() {
        return report == null ? 0 : report.getWarningCount();
    }

    public boolean hasErrorDiagnostics() {
        return getErrorCount() > 0;
    }

    @Override
    public String toString() {
        if (success) {
            return "PipelineResult{success, passes=" + executedPasses + ", errors=" + getErrorCount() + ", warnings=" + getWarningCount() + "}";
        } else {
            return "PipelineResult{failure, passes=" + executedPasses + ", error='" + errorMessage + "'}";
        }
    }
}
