package me.christianrobert.nativebind.pipeline.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.nativebind.config.service.ConfigService;
import me.christianrobert.nativebind.declaration.TranslatedLibrary;
import me.christianrobert.nativebind.diagnostic.Severity;
import me.christianrobert.nativebind.diagnostic.model.DiagnosticEntry;
import me.christianrobert.nativebind.diagnostic.model.DiagnosticReport;
import me.christianrobert.nativebind.diagnostic.service.DiagnosticReportService;
import me.christianrobert.nativebind.pipeline.TranslationFailedException;
import me.christianrobert.nativebind.pipeline.model.PipelineResult;
import me.christianrobert.nativebind.transformation.TransformationBase;
import me.christianrobert.nativebind.transformation.common.BrokenDeclarationExtractor;
import me.christianrobert.nativebind.transformation.context.TransformationException;
import me.christianrobert.nativebind.verification.TranslationVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Drives a translated library through a sequence of passes and the final verification.
 *
 * <p>Pipeline:
 * <pre>
 * front end library → pass 1 → ... → pass n → [BrokenDeclarationExtractor] → TranslationVerifier → result
 * </pre>
 * Each pass completes both of its phases before the next one starts.</p>
 *
 * <p>Settings ({@link ConfigService}):
 * <ul>
 *   <li>{@code pipeline.disabled-passes}: pass names to skip; the verifier cannot be disabled</li>
 *   <li>{@code pipeline.extract-broken}: move erroring root declarations out of the tree before verification</li>
 *   <li>{@code pipeline.log-diagnostics}: log every Error and Warning of the final library</li>
 *   <li>{@code pipeline.fail-on-errors}: throw {@link TranslationFailedException} when Errors remain</li>
 * </ul>
 */
@ApplicationScoped
public class TranslationPipelineService {

    private static final Logger log = LoggerFactory.getLogger(TranslationPipelineService.class);

    @Inject
    ConfigService configService;

    @Inject
    DiagnosticReportService diagnosticReportService;

    /**
     * Runs only the verification.
     */
    public PipelineResult run(TranslatedLibrary library) {
        return run(library, List.of());
    }

    /**
     * Runs the given passes in order, then verifies the result.
     *
     * @param library Library handed over by the front end
     * @param passes Passes to apply; a {@link TranslationVerifier} among them is moved to the end
     * @return Result holding the verified library and its diagnostics
     * @throws TranslationFailedException if {@code pipeline.fail-on-errors} is set and Errors remain
     */
    public PipelineResult run(TranslatedLibrary library, List<? extends TransformationBase> passes) {
        if (library == null) {
            return PipelineResult.failure(null, List.of(), "Library cannot be null");
        }
        if (passes == null) {
            return PipelineResult.failure(library, List.of(), "Passes cannot be null");
        }

        List<TransformationBase> effectivePasses = planPasses(passes);
        List<String> executed = new ArrayList<>();
        TranslatedLibrary current = library;

        log.info("Running translation pipeline with {} passes over {}", effectivePasses.size(), library);

        for (TransformationBase pass : effectivePasses) {
            log.debug("Running pass {}", pass.getName());
            try {
                TranslatedLibrary next = pass.transform(current);
                if (next == current) {
                    log.debug("Pass {} made no changes", pass.getName());
                }
                current = next;
                executed.add(pass.getName());
            } catch (TransformationException e) {
                log.error("Pass {} failed: {}", pass.getName(), e.getDetailedMessage(), e);
                return PipelineResult.failure(current, executed, e.getDetailedMessage());
            }
        }

        DiagnosticReport report = diagnosticReportService.createReport(current);

        if (configService.isEnabled(ConfigService.LOG_DIAGNOSTICS, true)) {
            logDiagnostics(report);
        }

        if (report.hasErrors()) {
            log.warn("Translation finished with {} errors and {} warnings; erroring declarations will not be emitted",
                    report.getErrorCount(), report.getWarningCount());
            if (configService.isEnabled(ConfigService.FAIL_ON_ERRORS, false)) {
                throw new TranslationFailedException(report.getEntries(Severity.ERROR));
            }
        } else {
            log.info("Translation finished with {} warnings", report.getWarningCount());
        }

        return PipelineResult.success(current, executed, report);
    }

    private List<TransformationBase> planPasses(List<? extends TransformationBase> passes) {
        List<String> disabled = configService.getNames(ConfigService.DISABLED_PASSES);
        List<TransformationBase> planned = new ArrayList<>();
        TransformationBase verifier = null;
        boolean hasExtractor = false;

        for (TransformationBase pass : passes) {
            if (pass instanceof TranslationVerifier) {
                verifier = pass;
            } else if (disabled.contains(pass.getName())) {
                log.info("Skipping disabled pass {}", pass.getName());
            } else {
                hasExtractor |= pass instanceof BrokenDeclarationExtractor;
                planned.add(pass);
            }
        }

        if (!hasExtractor && configService.isEnabled(ConfigService.EXTRACT_BROKEN, false)) {
            planned.add(new BrokenDeclarationExtractor());
        }

        if (verifier != null && disabled.contains(verifier.getName())) {
            log.warn("Pass {} cannot be disabled", verifier.getName());
        }
        planned.add(verifier != null ? verifier : new TranslationVerifier());
        return planned;
    }

    private void logDiagnostics(DiagnosticReport report) {
        for (DiagnosticEntry entry : report.getEntries()) {
            switch (entry.getSeverity()) {
                case ERROR -> log.warn("{}", entry);
                case WARNING -> log.info("{}", entry);
                case INFO -> log.debug("{}", entry);
            }
        }
    }
}
