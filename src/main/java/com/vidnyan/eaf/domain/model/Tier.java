package com.vidnyan.eaf.domain.model;

import lombok.Builder;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A tier: an ordered sequence of annotations.
 * Main tier if {@code parentRef} is null (alignable annotations only),
 * referred tier otherwise (referred annotations only).
 * Immutable value object.
 */
@Builder(toBuilder = true)
public record Tier(
    String id,
    String participant,
    String annotator,
    String linguisticTypeRef,
    String defaultLocale,
    String parentRef,
    String extRef,
    String langRef,
    List<Annotation> annotations
) {

    public static final String DEFAULT_LINGUISTIC_TYPE = "default-lt";

    public Tier {
        Objects.requireNonNull(id, "tier id");
        linguisticTypeRef = linguisticTypeRef == null ? DEFAULT_LINGUISTIC_TYPE : linguisticTypeRef;
        annotations = annotations == null ? List.of() : List.copyOf(annotations);
    }

    /**
     * Create a main tier.
     */
    public static Tier main(String id, List<? extends Annotation> annotations) {
        return Tier.builder()
                .id(id)
                .annotations(List.copyOf(annotations))
                .build();
    }

    /**
     * Create a referred tier.
     */
    public static Tier referred(String id, String parentRef, String linguisticTypeRef,
                                List<? extends Annotation> annotations) {
        return Tier.builder()
                .id(id)
                .parentRef(parentRef)
                .linguisticTypeRef(linguisticTypeRef)
                .annotations(List.copyOf(annotations))
                .build();
    }

    public boolean isMain() {
        return parentRef == null;
    }

    public boolean isReferred() {
        return parentRef != null;
    }

    /**
     * A tier is tokenized if any annotation points to a previous annotation.
     */
    public boolean isTokenized() {
        return annotations.stream()
                .anyMatch(a -> a instanceof RefAnnotation ref && ref.previousAnnotation() != null);
    }

    /**
     * Check that every annotation's variant matches the tier kind.
     */
    public boolean typeMatches() {
        return annotations.stream().allMatch(a -> a.isReferred() == isReferred());
    }

    public int size() {
        return annotations.size();
    }

    public boolean isEmpty() {
        return annotations.isEmpty();
    }

    public Optional<Annotation> find(String annotationId) {
        return annotations.stream()
                .filter(a -> a.id().equals(annotationId))
                .findFirst();
    }

    public List<String> values() {
        return annotations.stream().map(Annotation::text).toList();
    }

    /**
     * Same attributes, no annotations.
     */
    public Tier strip() {
        return withAnnotations(List.of());
    }

    public Tier withAnnotations(List<? extends Annotation> newAnnotations) {
        return toBuilder().annotations(List.copyOf(newAnnotations)).build();
    }

    public Tier withId(String newId) {
        return toBuilder().id(newId).build();
    }
}
