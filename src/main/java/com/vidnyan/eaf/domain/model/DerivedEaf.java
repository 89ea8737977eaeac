package com.vidnyan.eaf.domain.model;

import com.vidnyan.eaf.domain.engine.ExtractEngine;
import com.vidnyan.eaf.domain.engine.RemapEngine;
import com.vidnyan.eaf.domain.engine.Validation;
import com.vidnyan.eaf.domain.error.EafError;
import com.vidnyan.eaf.domain.error.EafException;
import com.vidnyan.eaf.domain.index.ReferenceIndex;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An indexed document with every annotation's time span and main annotation
 * resolved. Operations that rely on derived values only accept this type.
 */
public record DerivedEaf(IndexedEaf indexed, Derivation derivation) {

    public DerivedEaf {
        Objects.requireNonNull(indexed, "indexed");
        Objects.requireNonNull(derivation, "derivation");
    }

    public EafDocument document() {
        return indexed.document();
    }

    public ReferenceIndex index() {
        return indexed.index();
    }

    public Optional<Tier> getTier(String tierId) {
        return indexed.getTier(tierId);
    }

    public Optional<Annotation> getAnnotation(String annotationId) {
        return indexed.getAnnotation(annotationId);
    }

    public Optional<Tier> mainTier(String tierId) {
        return indexed.mainTier(tierId);
    }

    public Optional<Tier> parentTier(String tierId) {
        return indexed.parentTier(tierId);
    }

    public List<Tier> childTiers(String tierId) {
        return indexed.childTiers(tierId);
    }

    public List<String> tierIds() {
        return indexed.tierIds();
    }

    public List<String> mainTierIds() {
        return indexed.mainTierIds();
    }

    public List<String> refTierIds() {
        return indexed.refTierIds();
    }

    public Existence exists(String id) {
        return indexed.exists(id);
    }

    public Optional<Long> timeslotValue(String timeslotId) {
        return indexed.timeslotValue(timeslotId);
    }

    /**
     * Get the derived values of an annotation.
     */
    public Optional<DerivedAnnotation> span(String annotationId) {
        return derivation.get(annotationId);
    }

    /**
     * Get the main annotation using the memoised main annotation ID.
     */
    public Optional<Annotation> mainAnnotation(String annotationId) {
        return derivation.get(annotationId)
                .map(d -> d.mainAnnotationId() != null ? d.mainAnnotationId() : d.annotationId())
                .flatMap(indexed::getAnnotation);
    }

    /**
     * Derived values of a tier's annotations in tier order.
     */
    public List<DerivedAnnotation> spans(String tierId) {
        Tier tier = getTier(tierId).orElseThrow(() -> EafException.of(EafError.INVALID_TIER_ID, tierId));
        return tier.annotations().stream()
                .map(a -> derivation.get(a.id()))
                .flatMap(Optional::stream)
                .toList();
    }

    public Optional<DerivedAnnotation> firstAnnotation(String tierId) {
        return spans(tierId).stream()
                .filter(DerivedAnnotation::hasSpan)
                .min(Comparator.comparing(DerivedAnnotation::start));
    }

    public Optional<DerivedAnnotation> lastAnnotation(String tierId) {
        return spans(tierId).stream()
                .filter(DerivedAnnotation::hasSpan)
                .max(Comparator.comparing(DerivedAnnotation::end));
    }

    /**
     * Check if annotations in a tier overlap in time.
     */
    public boolean overlaps(String tierId) {
        Tier tier = getTier(tierId).orElseThrow(() -> EafException.of(EafError.INVALID_TIER_ID, tierId));
        return Validation.overlap(tier.annotations(), derivation);
    }

    /**
     * Renumber annotation and time slot IDs. The result is indexed and derived again.
     */
    public DerivedEaf remap(int annotationStart, int timeslotStart) {
        return RemapEngine.remap(this, annotationStart, timeslotStart);
    }

    /**
     * Cut out the annotations fully within [startMs, endMs], shifted to start at zero.
     */
    public DerivedEaf extract(long startMs, long endMs) {
        return ExtractEngine.extract(this, startMs, endMs);
    }
}
