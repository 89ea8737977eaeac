package com.vidnyan.eaf.domain.engine;

import com.vidnyan.eaf.domain.error.EafError;
import com.vidnyan.eaf.domain.error.EafException;
import com.vidnyan.eaf.domain.index.ReferenceIndex;
import com.vidnyan.eaf.domain.index.ReferenceIndex.TimeslotRefs;
import com.vidnyan.eaf.domain.model.AlignableAnnotation;
import com.vidnyan.eaf.domain.model.Annotation;
import com.vidnyan.eaf.domain.model.Derivation;
import com.vidnyan.eaf.domain.model.DerivedAnnotation;
import com.vidnyan.eaf.domain.model.IndexedEaf;
import com.vidnyan.eaf.domain.model.Tier;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * Resolves every annotation's time span and main annotation.
 * <p>
 * Alignable annotations read their two time slot values. Referred annotations
 * follow parent references to the alignable annotation at the top of the chain
 * and take over its span. Everything is computed from the index into a fresh
 * side table; the document itself is never touched.
 */
@Slf4j
public final class DerivationEngine {

    private DerivationEngine() {
    }

    /**
     * Derive all annotations of an indexed document.
     *
     * @throws EafException MISSING_TIMESLOT_REF, MISSING_MAIN_ANNOTATION or REFERENCE_CYCLE
     */
    public static Derivation derive(IndexedEaf indexed) {
        ReferenceIndex index = indexed.index();

        // Pass 1: spans of alignable annotations
        Map<String, Span> alignableSpans = new HashMap<>();
        for (Tier tier : indexed.document().tiers()) {
            for (Annotation annotation : tier.annotations()) {
                if (annotation instanceof AlignableAnnotation al) {
                    alignableSpans.put(al.id(), resolveSpan(al.id(), index));
                }
            }
        }

        // Pass 2: stamp tiers and resolve referred annotations through the memo
        Map<String, String> mainIds = new HashMap<>();
        Map<String, DerivedAnnotation> derived = new LinkedHashMap<>();
        for (Tier tier : indexed.document().tiers()) {
            for (Annotation annotation : tier.annotations()) {
                String mainId = null;
                Span span;
                if (annotation.isAlignable()) {
                    span = alignableSpans.get(annotation.id());
                } else {
                    mainId = resolveMainId(annotation.id(), index, mainIds);
                    span = alignableSpans.get(mainId);
                }
                derived.put(annotation.id(),
                        new DerivedAnnotation(annotation.id(), tier.id(), span.start(), span.end(), mainId));
            }
        }

        log.debug("Derived {} annotations ({} referred) in {} tiers",
                derived.size(), mainIds.size(), indexed.document().tierCount());
        return new Derivation(derived);
    }

    private static Span resolveSpan(String annotationId, ReferenceIndex index) {
        TimeslotRefs refs = index.timeslotsOf(annotationId)
                .orElseThrow(() -> EafException.of(EafError.MISSING_TIMESLOT_REF, annotationId));
        if (refs.start() == null || refs.end() == null
                || !index.hasTimeslot(refs.start()) || !index.hasTimeslot(refs.end())) {
            throw EafException.of(EafError.MISSING_TIMESLOT_REF, annotationId);
        }
        // Time slot values are optional, unaligned slots give an open bound
        return new Span(
                index.timeslotValue(refs.start()).orElse(null),
                index.timeslotValue(refs.end()).orElse(null)
        );
    }

    /**
     * Follow parent references until an alignable annotation is reached.
     * Every annotation on the walked chain is memoised.
     */
    private static String resolveMainId(String annotationId, ReferenceIndex index, Map<String, String> memo) {
        Set<String> visited = new LinkedHashSet<>();
        String current = annotationId;
        String mainId;

        while (true) {
            String known = memo.get(current);
            if (known != null) {
                mainId = known;
                break;
            }
            if (!visited.add(current)) {
                throw EafException.of(EafError.REFERENCE_CYCLE, String.join(" -> ", visited) + " -> " + current);
            }
            Optional<String> parent = index.parentOf(current);
            if (parent.isPresent()) {
                current = parent.get();
                continue;
            }
            if (!index.hasAnnotation(current)) {
                throw EafException.of(EafError.MISSING_MAIN_ANNOTATION, annotationId, current);
            }
            mainId = current;
            break;
        }

        for (String id : visited) {
            if (!id.equals(mainId)) {
                memo.put(id, mainId);
            }
        }
        return mainId;
    }

    private record Span(Long start, Long end) {}
}
