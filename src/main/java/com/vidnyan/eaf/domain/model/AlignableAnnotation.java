package com.vidnyan.eaf.domain.model;

import java.util.Objects;

/**
 * Time-aligned annotation on a main tier. Its span is defined by two time slot IDs.
 */
public record AlignableAnnotation(
    String id,
    String timeSlotRef1,
    String timeSlotRef2,
    AnnotationValue value,
    String extRef,
    String langRef,
    String cveRef
) implements Annotation {

    public AlignableAnnotation {
        Objects.requireNonNull(id, "annotation id");
        value = value == null ? AnnotationValue.of("") : value;
    }

    @Override
    public boolean isReferred() {
        return false;
    }

    @Override
    public AlignableAnnotation withId(String newId) {
        return new AlignableAnnotation(newId, timeSlotRef1, timeSlotRef2, value, extRef, langRef, cveRef);
    }

    @Override
    public AlignableAnnotation withValue(AnnotationValue newValue) {
        return new AlignableAnnotation(id, timeSlotRef1, timeSlotRef2, newValue, extRef, langRef, cveRef);
    }

    public AlignableAnnotation withTimeSlotRefs(String ref1, String ref2) {
        return new AlignableAnnotation(id, ref1, ref2, value, extRef, langRef, cveRef);
    }

    public boolean hasTimeSlotRefs() {
        return timeSlotRef1 != null && timeSlotRef2 != null;
    }
}
