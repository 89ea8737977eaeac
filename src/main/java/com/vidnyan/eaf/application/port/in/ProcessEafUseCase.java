package com.vidnyan.eaf.application.port.in;

import com.vidnyan.eaf.domain.engine.OverlapStrategy;
import com.vidnyan.eaf.domain.engine.ValidationReport;
import com.vidnyan.eaf.domain.model.DerivedAnnotation;
import com.vidnyan.eaf.domain.model.DerivedEaf;
import com.vidnyan.eaf.domain.model.Tier;

import java.nio.file.Path;
import java.util.List;

/**
 * Primary use case: process EAF files.
 * Every operation reads its inputs, works on derived documents and, where it
 * produces a document, writes it to the requested output.
 */
public interface ProcessEafUseCase {

    /**
     * Summarise a document.
     */
    InspectResult inspect(Path input);

    /**
     * Merge several documents into one.
     */
    OperationResult merge(MergeRequest request);

    /**
     * Cut a time window out of a document.
     */
    OperationResult extract(ExtractRequest request);

    /**
     * Renumber annotation and time slot IDs.
     */
    OperationResult remap(RemapRequest request);

    /**
     * Shift all time values.
     */
    OperationResult shift(ShiftRequest request);

    /**
     * Check a document for consistency problems.
     */
    ValidationResult validate(Path input);

    record MergeRequest(
        List<Path> inputs,
        Path output,
        OverlapStrategy strategy // null = configured default
    ) {}

    record ExtractRequest(Path input, Path output, long startMs, long endMs) {}

    record RemapRequest(Path input, Path output, int annotationStart, int timeslotStart) {}

    record ShiftRequest(Path input, Path output, long ms) {}

    record InspectResult(Path input, DocumentSummary summary) {}

    record OperationResult(Path output, DocumentSummary summary, long durationMs) {}

    record ValidationResult(Path input, ValidationReport report) {
        public boolean isValid() {
            return report.isValid();
        }
    }

    /**
     * Counts and time range of a derived document.
     */
    record DocumentSummary(
        int tierCount,
        int annotationCount,
        int timeslotCount,
        Long minTime,
        Long maxTime,
        List<TierSummary> tiers
    ) {
        public static DocumentSummary of(DerivedEaf derived) {
            var document = derived.document();
            List<TierSummary> tiers = document.tiers().stream()
                    .map(t -> TierSummary.of(derived, t))
                    .toList();
            return new DocumentSummary(
                    document.tierCount(),
                    document.annotationCount(),
                    document.timeOrder().size(),
                    document.timeOrder().minValue().orElse(null),
                    document.timeOrder().maxValue().orElse(null),
                    tiers
            );
        }
    }

    record TierSummary(
        String id,
        String parentRef,
        String linguisticTypeRef,
        boolean tokenized,
        int annotationCount,
        int tokenCount,
        Long start,
        Long end
    ) {
        public static TierSummary of(DerivedEaf derived, Tier tier) {
            return new TierSummary(
                    tier.id(),
                    tier.parentRef(),
                    tier.linguisticTypeRef(),
                    tier.isTokenized(),
                    tier.size(),
                    tier.annotations().stream().mapToInt(a -> a.value().tokenCount()).sum(),
                    derived.firstAnnotation(tier.id()).map(DerivedAnnotation::start).orElse(null),
                    derived.lastAnnotation(tier.id()).map(DerivedAnnotation::end).orElse(null)
            );
        }

        public boolean main() {
            return parentRef == null;
        }
    }
}
