package com.vidnyan.eaf.domain.model;

import com.vidnyan.eaf.domain.engine.DerivationEngine;
import com.vidnyan.eaf.domain.error.EafError;
import com.vidnyan.eaf.domain.error.EafException;
import com.vidnyan.eaf.domain.index.ReferenceIndex;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A document together with a reference index built from exactly that document.
 * Lookups here are safe; time values are not available until {@link #derive()}.
 */
public record IndexedEaf(EafDocument document, ReferenceIndex index) {

    public IndexedEaf {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(index, "index");
    }

    public static IndexedEaf of(EafDocument document) {
        return new IndexedEaf(document, ReferenceIndex.build(document));
    }

    /**
     * Resolve time spans and main annotations for every annotation.
     */
    public DerivedEaf derive() {
        return new DerivedEaf(this, DerivationEngine.derive(this));
    }

    public Optional<Tier> getTier(String tierId) {
        return index.tierPosition(tierId).map(p -> document.tiers().get(p));
    }

    public Optional<Annotation> getAnnotation(String annotationId) {
        return index.positionOf(annotationId)
                .map(p -> document.tiers().get(p.tier()).annotations().get(p.annotation()));
    }

    /**
     * Get the tier an annotation belongs to.
     */
    public Optional<Tier> tierOf(String annotationId) {
        return index.tierOf(annotationId).flatMap(this::getTier);
    }

    /**
     * Walk the parent chain to the alignable annotation at its top.
     * An alignable annotation is its own main annotation. Empty if the
     * annotation or a parent along the chain does not exist.
     *
     * @throws EafException REFERENCE_CYCLE if the chain revisits an annotation
     */
    public Optional<Annotation> mainAnnotation(String annotationId) {
        Set<String> visited = new LinkedHashSet<>();
        String current = annotationId;
        while (true) {
            if (!visited.add(current)) {
                throw EafException.of(EafError.REFERENCE_CYCLE, String.join(" -> ", visited) + " -> " + current);
            }
            Optional<Annotation> annotation = getAnnotation(current);
            if (annotation.isEmpty()) {
                return Optional.empty();
            }
            Optional<String> parent = annotation.get().parentId();
            if (parent.isEmpty()) {
                return annotation;
            }
            current = parent.get();
        }
    }

    /**
     * Walk the tier parent chain to the main tier.
     *
     * @throws EafException TIER_CYCLE if the chain revisits a tier
     */
    public Optional<Tier> mainTier(String tierId) {
        Set<String> visited = new LinkedHashSet<>();
        String current = tierId;
        while (true) {
            if (!visited.add(current)) {
                throw EafException.of(EafError.TIER_CYCLE, String.join(" -> ", visited) + " -> " + current);
            }
            Optional<String> parent = index.parentTierOf(current);
            if (parent.isEmpty()) {
                return getTier(current);
            }
            current = parent.get();
        }
    }

    public Optional<Tier> parentTier(String tierId) {
        return index.parentTierOf(tierId).flatMap(this::getTier);
    }

    /**
     * Get tiers referring directly to a tier.
     */
    public List<Tier> childTiers(String tierId) {
        if (!index.hasTier(tierId)) {
            throw EafException.of(EafError.INVALID_TIER_ID, tierId);
        }
        return index.childTiersOf(tierId).stream()
                .map(this::getTier)
                .flatMap(Optional::stream)
                .toList();
    }

    public List<String> tierIds() {
        return index.tierIds();
    }

    public List<String> mainTierIds() {
        return document.mainTierIds();
    }

    public List<String> refTierIds() {
        return document.refTierIds();
    }

    /**
     * Check what an ID names in this document.
     */
    public Existence exists(String id) {
        return new Existence(index.hasTier(id), index.hasAnnotation(id), index.hasTimeslot(id));
    }

    public Optional<Long> timeslotValue(String timeslotId) {
        return index.timeslotValue(timeslotId);
    }

    public Optional<String> timeslotId(long value) {
        return index.timeslotId(value);
    }

    /**
     * Check if a tier, or with {@code recursive} any tier above it, is tokenized.
     */
    public boolean isTokenized(String tierId, boolean recursive) {
        Tier tier = getTier(tierId).orElseThrow(() -> EafException.of(EafError.INVALID_TIER_ID, tierId));
        if (tier.isTokenized()) {
            return true;
        }
        if (!recursive) {
            return false;
        }
        Set<String> visited = new LinkedHashSet<>();
        visited.add(tierId);
        Optional<String> parent = index.parentTierOf(tierId);
        while (parent.isPresent() && visited.add(parent.get())) {
            Optional<Tier> parentTier = getTier(parent.get());
            if (parentTier.isPresent() && parentTier.get().isTokenized()) {
                return true;
            }
            parent = index.parentTierOf(parent.get());
        }
        return false;
    }
}
