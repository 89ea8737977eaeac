package com.vidnyan.eaf.domain.model;

/**
 * Values resolved for one annotation by derivation. Never persisted.
 *
 * @param start            resolved start in ms, null if the time slot has no value
 * @param end              resolved end in ms, null if the time slot has no value
 * @param mainAnnotationId alignable annotation at the top of the parent chain,
 *                         null for alignable annotations
 */
public record DerivedAnnotation(
    String annotationId,
    String tierId,
    Long start,
    Long end,
    String mainAnnotationId
) {

    public boolean hasSpan() {
        return start != null && end != null;
    }

    /**
     * Check if the resolved span lies within [windowStart, windowEnd].
     */
    public boolean within(long windowStart, long windowEnd) {
        return hasSpan() && start >= windowStart && end <= windowEnd;
    }
}
