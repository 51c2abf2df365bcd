package me.christianrobert.nativebind.diagnostic.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.christianrobert.nativebind.config.service.ConfigService;
import me.christianrobert.nativebind.declaration.TranslatedLibrary;
import me.christianrobert.nativebind.declaration.TranslatedNormalField;
import me.christianrobert.nativebind.declaration.TranslatedRecord;
import me.christianrobert.nativebind.diagnostic.Severity;
import me.christianrobert.nativebind.diagnostic.TranslationDiagnostic;
import me.christianrobert.nativebind.diagnostic.model.DiagnosticEntry;
import me.christianrobert.nativebind.diagnostic.model.DiagnosticReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static me.christianrobert.nativebind.DeclarationTestFactory.field;
import static me.christianrobert.nativebind.DeclarationTestFactory.record;
import static org.junit.jupiter.api.Assertions.*;

class DiagnosticReportServiceTest {

    private ConfigService configService;
    private DiagnosticReportService reportService;

    @BeforeEach
    void setUp() {
        configService = new ConfigService();
        reportService = new DiagnosticReportService();
        reportService.configService = configService;
    }

    private TranslatedLibrary libraryWithDiagnostics() {
        TranslatedNormalField mass = field("mass", 0);
        mass = mass.withWarning("Field may be misaligned.");
        mass = mass.withDiagnostic(TranslationDiagnostic.info("Offset computed from layout."));

        TranslatedRecord body = record("Body", mass, field("speed", 4)).withNamespace("physics");
        TranslatedRecord broken = record("Broken").withError("Layout could not be computed.");

        return new TranslatedLibrary(List.of(body), null,
                List.of(TranslationDiagnostic.warning("Header 'simd.h' could not be parsed.")),
                List.of(broken));
    }

    @Test
    void reportKeepsAttachmentAndTreeOrder() {
        // When
        DiagnosticReport report = reportService.createReport(libraryWithDiagnostics());

        // Then
        assertEquals(4, report.getEntries().size());

        DiagnosticEntry parsing = report.getEntries().get(0);
        assertNull(parsing.getDeclarationPath());
        assertEquals(Severity.WARNING, parsing.getSeverity());

        DiagnosticEntry misaligned = report.getEntries().get(1);
        assertEquals("physics::Body.mass", misaligned.getDeclarationPath());
        assertEquals("NORMAL_FIELD", misaligned.getDeclarationKind());
        assertEquals("physics/Body.h", misaligned.getFilePath());
        assertEquals("Field may be misaligned.", misaligned.getMessage());

        assertEquals(Severity.INFO, report.getEntries().get(2).getSeverity());

        DiagnosticEntry broken = report.getEntries().get(3);
        assertEquals("Broken", broken.getDeclarationPath());
        assertEquals(Severity.ERROR, broken.getSeverity());

        assertEquals(1, report.getErrorCount());
        assertEquals(2, report.getWarningCount());
        assertTrue(report.hasErrors());
    }

    @Test
    void infoEntriesCanBeExcluded() {
        configService.setConfigValue(ConfigService.REPORT_INCLUDE_INFO, false);

        DiagnosticReport report = reportService.createReport(libraryWithDiagnostics());

        assertEquals(3, report.getEntries().size());
        assertEquals(0, report.count(Severity.INFO));
    }

    @Test
    void jsonContainsCountsAndEntries() throws Exception {
        // When
        String json = reportService.toJson(libraryWithDiagnostics());

        // Then
        JsonNode root = new ObjectMapper().readTree(json);
        assertEquals(1, root.get("errorCount").asInt());
        assertEquals(2, root.get("warningCount").asInt());

        JsonNode diagnostics = root.get("diagnostics");
        assertEquals(4, diagnostics.size());
        assertTrue(diagnostics.get(0).get("declaration").isNull());
        assertEquals("physics::Body.mass", diagnostics.get(1).get("declaration").asText());
        assertEquals("WARNING", diagnostics.get(1).get("severity").asText());
        assertEquals("physics/Body.h", diagnostics.get(1).get("file").asText());
        assertEquals("ERROR", diagnostics.get(3).get("severity").asText());
    }

    @Test
    void emptyLibraryHasEmptyReport() {
        DiagnosticReport report = reportService.createReport(new TranslatedLibrary(List.of(record("Body"))));

        assertTrue(report.isEmpty());
        assertFalse(report.hasErrors());
    }

    @Test
    void nullLibraryIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> reportService.createReport(null));
    }
}
