package com.vidnyan.eaf.domain.engine;

import com.vidnyan.eaf.domain.error.EafError;
import com.vidnyan.eaf.domain.error.EafException;
import com.vidnyan.eaf.domain.index.ReferenceIndex.TimeslotRefs;
import com.vidnyan.eaf.domain.model.Annotation;
import com.vidnyan.eaf.domain.model.DerivedEaf;
import com.vidnyan.eaf.domain.model.EafDocument;
import com.vidnyan.eaf.domain.model.Tier;
import com.vidnyan.eaf.domain.model.TimeOrder;
import lombok.extern.slf4j.Slf4j;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Cuts a time window out of a document.
 * <p>
 * An annotation survives if both time slots of its main annotation have a
 * value inside the window. Partially overlapping annotations are dropped, not
 * truncated. The result is renumbered from a1/ts1 and shifted so the window
 * starts at zero.
 */
@Slf4j
public final class ExtractEngine {

    private ExtractEngine() {
    }

    /**
     * @throws EafException INVALID_TIME_SPAN if {@code startMs > endMs}
     */
    public static DerivedEaf extract(DerivedEaf derived, long startMs, long endMs) {
        if (startMs > endMs) {
            throw EafException.of(EafError.INVALID_TIME_SPAN, startMs, endMs);
        }
        EafDocument document = derived.document();

        TimeOrder window = document.timeOrder().filter(startMs, endMs);
        Set<String> inWindow = new HashSet<>(window.ids());

        List<Tier> tiers = document.tiers().stream()
                .map(tier -> tier.withAnnotations(tier.annotations().stream()
                        .filter(a -> mainSlots(derived, a)
                                .map(refs -> inWindow.contains(refs.start()) && inWindow.contains(refs.end()))
                                .orElse(false))
                        .toList()))
                .toList();

        EafDocument cut = document.toBuilder()
                .timeOrder(window)
                .tiers(tiers)
                .build();

        EafDocument shifted = cut.derive()
                .remap(1, 1)
                .document()
                .shift(-startMs, false);

        log.debug("Extracted {}ms-{}ms: {} of {} annotations, {} of {} time slots",
                startMs, endMs, shifted.annotationCount(), document.annotationCount(),
                window.size(), document.timeOrder().size());
        return shifted.derive();
    }

    private static Optional<TimeslotRefs> mainSlots(DerivedEaf derived, Annotation annotation) {
        String mainId = derived.span(annotation.id())
                .map(d -> d.mainAnnotationId() != null ? d.mainAnnotationId() : d.annotationId())
                .orElse(annotation.id());
        return derived.index().timeslotsOf(mainId);
    }
}
