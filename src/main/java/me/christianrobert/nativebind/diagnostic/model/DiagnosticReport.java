package me.christianrobert.nativebind.diagnostic.model;

import me.christianrobert.nativebind.diagnostic.Severity;

import java.util.List;
import java.util.stream.Collectors;

/**
 * All diagnostics of a translated library in tree order, library-level parsing diagnostics first.
 */
public class DiagnosticReport {

    private final List<DiagnosticEntry> entries;

    public DiagnosticReport(List<DiagnosticEntry> entries) {
        this.entries = entries == null ? List.of() : List.copyOf(entries);
    }

    public List<DiagnosticEntry> getEntries() {
        return entries;
    }

    public List<DiagnosticEntry> getEntries(Severity severity) {
        return entries.stream()
                .filter(entry -> entry.getSeverity() == severity)
                .collect(Collectors.toList());
    }

    public int count(Severity severity) {
        int count = 0;
        for (DiagnosticEntry entry : entries) {
            if (entry.getSeverity() == severity) {
                count++;
            }
        }
        return count;
    }

    public int getErrorCount() {
        return count(Severity.ERROR);
    }

    public int getWarningCount() {
        return count(Severity.WARNING);
    }

    public boolean hasErrors() {
        return getErrorCount() > 0;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public String toString() {
        return "DiagnosticReport{" +
                "entries=" + entries.size() +
                ", errors=" + getErrorCount() +
                ", warnings=" + getWarningCount() +
                '}';
    }
}
