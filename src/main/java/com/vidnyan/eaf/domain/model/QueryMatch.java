package com.vidnyan.eaf.domain.model;

/**
 * Result of a text query.
 *
 * @param position     1-based position of the annotation within its tier
 * @param parentId     parent annotation ID, null for alignable annotations
 */
public record QueryMatch(
    int position,
    String tierId,
    String annotationId,
    String value,
    String parentId
) {}
