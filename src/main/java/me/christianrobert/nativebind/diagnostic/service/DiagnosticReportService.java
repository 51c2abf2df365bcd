package me.christianrobert.nativebind.diagnostic.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.nativebind.config.service.ConfigService;
import me.christianrobert.nativebind.declaration.TranslatedDeclaration;
import me.christianrobert.nativebind.declaration.TranslatedLibrary;
import me.christianrobert.nativebind.diagnostic.Severity;
import me.christianrobert.nativebind.diagnostic.TranslationDiagnostic;
import me.christianrobert.nativebind.diagnostic.model.DiagnosticEntry;
import me.christianrobert.nativebind.diagnostic.model.DiagnosticReport;
import me.christianrobert.nativebind.transformation.context.TransformationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the diagnostics of a translated library into a {@link DiagnosticReport} and renders it as JSON.
 *
 * <p>Every entry keeps the path of the declaration it was attached to, so tooling can correlate messages
 * with source locations. Declarations moved to {@link TranslatedLibrary#getBrokenDeclarations()} are
 * reported as well.</p>
 *
 * <p>JSON format:</p>
 * <pre>
 * {
 *   "errorCount": 1,
 *   "warningCount": 2,
 *   "diagnostics": [
 *     {"severity": "WARNING", "declaration": "physics::Body.Body_", "kind": "NORMAL_FIELD",
 *      "file": "physics/Body.h", "message": "..."}
 *   ]
 * }
 * </pre>
 */
@ApplicationScoped
public class DiagnosticReportService {

    private static final Logger log = LoggerFactory.getLogger(DiagnosticReportService.class);

    @Inject
    ConfigService configService;

    private final ObjectMapper objectMapper = new ObjectMapper();

    public DiagnosticReport createReport(TranslatedLibrary library) {
        if (library == null) {
            throw new IllegalArgumentException("Library cannot be null");
        }

        boolean includeInfo = configService == null || configService.isEnabled(ConfigService.REPORT_INCLUDE_INFO, true);
        List<DiagnosticEntry> entries = new ArrayList<>();

        for (TranslationDiagnostic diagnostic : library.getParsingDiagnostics()) {
            if (includeInfo || diagnostic.getSeverity() != Severity.INFO) {
                entries.add(new DiagnosticEntry(null, null, null, diagnostic.getSeverity(), diagnostic.getMessage()));
            }
        }

        TransformationContext root = new TransformationContext(library);
        collect(root, library.getDeclarations(), includeInfo, entries);
        collect(root, library.getBrokenDeclarations(), includeInfo, entries);

        DiagnosticReport report = new DiagnosticReport(entries);
        log.debug("Collected {}", report);
        return report;
    }

    private void collect(TransformationContext context, List<TranslatedDeclaration> declarations,
                         boolean includeInfo, List<DiagnosticEntry> sink) {
        for (TranslatedDeclaration declaration : declarations) {
            for (TranslationDiagnostic diagnostic : declaration.getDiagnostics()) {
                if (!includeInfo && diagnostic.getSeverity() == Severity.INFO) {
                    continue;
                }
                sink.add(new DiagnosticEntry(
                        context.describe(declaration),
                        declaration.getKind().name(),
                        declaration.getFile().getFilePath(),
                        diagnostic.getSeverity(),
                        diagnostic.getMessage()));
            }
            collect(context.add(declaration), declaration.getChildren(), includeInfo, sink);
        }
    }

    public String toJson(DiagnosticReport report) {
        if (report == null) {
            throw new IllegalArgumentException("Report cannot be null");
        }

        ObjectNode root = objectMapper.createObjectNode();
        root.put("errorCount", report.getErrorCount());
        root.put("warningCount", report.getWarningCount());

        ArrayNode diagnostics = root.putArray("diagnostics");
        for (DiagnosticEntry entry : report.getEntries()) {
            ObjectNode node = diagnostics.addObject();
            node.put("severity", entry.getSeverity().name());
            node.put("declaration", entry.getDeclarationPath());
            node.put("kind", entry.getDeclarationKind());
            node.put("file", entry.getFilePath());
            node.put("message", entry.getMessage());
        }

        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize diagnostic report", e);
        }
    }

    public String toJson(TranslatedLibrary library) {
        return toJson(createReport(library));
    }
}
