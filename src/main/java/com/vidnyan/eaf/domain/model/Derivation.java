package com.vidnyan.eaf.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Side table of derived annotation values, keyed by annotation ID.
 * Computed in full before it is attached to a document.
 */
public record Derivation(Map<String, DerivedAnnotation> annotations) {

    public Derivation {
        annotations = Collections.unmodifiableMap(new LinkedHashMap<>(annotations));
    }

    public Optional<DerivedAnnotation> get(String annotationId) {
        return Optional.ofNullable(annotations.get(annotationId));
    }

    public Optional<Long> start(String annotationId) {
        return get(annotationId).map(DerivedAnnotation::start);
    }

    public Optional<Long> end(String annotationId) {
        return get(annotationId).map(DerivedAnnotation::end);
    }

    public int size() {
        return annotations.size();
    }
}
