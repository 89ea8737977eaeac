package com.vidnyan.eaf.domain.model;

import java.util.Optional;

/**
 * An annotation: either {@link AlignableAnnotation} (two time slot references,
 * main tiers) or {@link RefAnnotation} (parent annotation reference, referred tiers).
 * Both variants are immutable records sharing these accessors.
 */
public interface Annotation {

    String id();

    AnnotationValue value();

    String extRef();

    String langRef();

    String cveRef();

    Annotation withId(String id);

    Annotation withValue(AnnotationValue value);

    boolean isReferred();

    default boolean isAlignable() {
        return !isReferred();
    }

    default String text() {
        return value().text();
    }

    /**
     * Parent annotation ID for referred annotations.
     */
    default Optional<String> parentId() {
        return Optional.empty();
    }

    static AlignableAnnotation alignable(String id, String value, String timeSlotRef1, String timeSlotRef2) {
        return new AlignableAnnotation(id, timeSlotRef1, timeSlotRef2, AnnotationValue.of(value),
                null, null, null);
    }

    static RefAnnotation referred(String id, String value, String annotationRef) {
        return referred(id, value, annotationRef, null);
    }

    static RefAnnotation referred(String id, String value, String annotationRef, String previousAnnotation) {
        return new RefAnnotation(id, annotationRef, previousAnnotation, AnnotationValue.of(value),
                null, null, null);
    }
}
