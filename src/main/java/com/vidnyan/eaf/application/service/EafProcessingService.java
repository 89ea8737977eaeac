package com.vidnyan.eaf.application.service;

import com.vidnyan.eaf.application.port.in.ProcessEafUseCase;
import com.vidnyan.eaf.application.port.out.EafRepository;
import com.vidnyan.eaf.config.EafProperties;
import com.vidnyan.eaf.domain.engine.MergeEngine;
import com.vidnyan.eaf.domain.engine.OverlapStrategy;
import com.vidnyan.eaf.domain.engine.Validation;
import com.vidnyan.eaf.domain.engine.ValidationReport;
import com.vidnyan.eaf.domain.error.EafError;
import com.vidnyan.eaf.domain.error.EafException;
import com.vidnyan.eaf.domain.model.DerivedEaf;
import com.vidnyan.eaf.domain.model.EafDocument;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.function.Supplier;

/**
 * Application service that reads, transforms and writes EAF documents.
 * Implements the primary use case.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EafProcessingService implements ProcessEafUseCase {

    private final EafRepository eafRepository;
    private final EafProperties properties;

    @Override
    public InspectResult inspect(Path input) {
        log.info("Inspecting: {}", input);
        DerivedEaf derived = eafRepository.read(input);
        DocumentSummary summary = DocumentSummary.of(derived);
        log.info("Read {} tiers, {} annotations, {} time slots",
                summary.tierCount(), summary.annotationCount(), summary.timeslotCount());
        return new InspectResult(input, summary);
    }

    @Override
    public OperationResult merge(MergeRequest request) {
        OverlapStrategy strategy = request.strategy() != null
                ? request.strategy()
                : properties.getOverlapStrategy();
        return run("merge", request.output(), () -> {
            if (request.inputs().isEmpty()) {
                throw EafException.of(EafError.NO_DATA);
            }
            // Step 1: read inputs
            log.info("Step 1: Reading {} documents...", request.inputs().size());
            List<EafDocument> documents = request.inputs().stream()
                    .map(eafRepository::read)
                    .map(DerivedEaf::document)
                    .toList();

            // Step 2: merge
            log.info("Step 2: Merging with strategy {}...", strategy);
            return MergeEngine.merge(documents, strategy);
        });
    }

    @Override
    public OperationResult extract(ExtractRequest request) {
        return run("extract", request.output(), () -> {
            log.info("Step 1: Reading {}...", request.input());
            DerivedEaf derived = eafRepository.read(request.input());

            log.info("Step 2: Extracting {}ms-{}ms...", request.startMs(), request.endMs());
            return derived.extract(request.startMs(), request.endMs());
        });
    }

    @Override
    public OperationResult remap(RemapRequest request) {
        return run("remap", request.output(), () -> {
            log.info("Step 1: Reading {}...", request.input());
            DerivedEaf derived = eafRepository.read(request.input());

            log.info("Step 2: Remapping from a{} and ts{}...",
                    request.annotationStart(), request.timeslotStart());
            return derived.remap(request.annotationStart(), request.timeslotStart());
        });
    }

    @Override
    public OperationResult shift(ShiftRequest request) {
        return run("shift", request.output(), () -> {
            log.info("Step 1: Reading {}...", request.input());
            DerivedEaf derived = eafRepository.read(request.input());

            log.info("Step 2: Shifting by {}ms...", request.ms());
            return derived.document()
                    .shift(request.ms(), properties.isAllowNegativeShift())
                    .derive();
        });
    }

    @Override
    public ValidationResult validate(Path input) {
        log.info("Validating: {}", input);
        // Derivation problems become issues, only decoding must succeed
        EafDocument document;
        try {
            document = eafRepository.load(input);
        } catch (EafException e) {
            if (e.getCategory() == EafError.Category.IO) {
                log.error("Failed to read {}: {}", input, e.getMessage());
                throw e;
            }
            log.warn("Document cannot be loaded: {}", e.getMessage());
            return new ValidationResult(input, new ValidationReport(List.of(
                    new ValidationReport.Issue(e.getError(), null, e.getMessage()))));
        }
        ValidationReport report = Validation.validate(document);
        log.info("Validation complete: {} issues", report.issues().size());
        return new ValidationResult(input, report);
    }

    private OperationResult run(String operation, Path output, Supplier<DerivedEaf> body) {
        Instant startTime = Instant.now();
        log.info("Starting {} -> {}", operation, output);
        try {
            DerivedEaf result = body.get();

            log.info("Step 3: Writing {}...", output);
            eafRepository.write(output, result.document());

            long durationMs = Duration.between(startTime, Instant.now()).toMillis();
            DocumentSummary summary = DocumentSummary.of(result);
            log.info("{} complete: {} tiers, {} annotations in {}ms",
                    operation, summary.tierCount(), summary.annotationCount(), durationMs);
            return new OperationResult(output, summary, durationMs);
        } catch (EafException e) {
            log.error("{} failed [{}]: {}", operation, e.getError(), e.getMessage());
            throw e;
        }
    }
}
