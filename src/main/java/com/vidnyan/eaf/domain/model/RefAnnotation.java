package com.vidnyan.eaf.domain.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Annotation on a referred tier. Carries no time slots; its span comes from the
 * parent annotation chain. A previous annotation ID marks a token in a
 * tokenized run sharing one parent.
 */
public record RefAnnotation(
    String id,
    String annotationRef,
    String previousAnnotation,
    AnnotationValue value,
    String extRef,
    String langRef,
    String cveRef
) implements Annotation {

    public RefAnnotation {
        Objects.requireNonNull(id, "annotation id");
        Objects.requireNonNull(annotationRef, "annotation ref for " + id);
        value = value == null ? AnnotationValue.of("") : value;
    }

    @Override
    public boolean isReferred() {
        return true;
    }

    @Override
    public Optional<String> parentId() {
        return Optional.of(annotationRef);
    }

    public Optional<String> previous() {
        return Optional.ofNullable(previousAnnotation);
    }

    @Override
    public RefAnnotation withId(String newId) {
        return new RefAnnotation(newId, annotationRef, previousAnnotation, value, extRef, langRef, cveRef);
    }

    @Override
    public RefAnnotation withValue(AnnotationValue newValue) {
        return new RefAnnotation(id, annotationRef, previousAnnotation, newValue, extRef, langRef, cveRef);
    }

    public RefAnnotation withAnnotationRef(String ref) {
        return new RefAnnotation(id, ref, previousAnnotation, value, extRef, langRef, cveRef);
    }

    public RefAnnotation withPreviousAnnotation(String previous) {
        return new RefAnnotation(id, annotationRef, previous, value, extRef, langRef, cveRef);
    }
}
