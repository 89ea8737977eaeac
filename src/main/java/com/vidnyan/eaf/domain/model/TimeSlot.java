package com.vidnyan.eaf.domain.model;

import java.util.Objects;

/**
 * A time slot: an ID with an optional millisecond value.
 * Immutable value object.
 */
public record TimeSlot(
    String id,
    Long value // null when the slot is unaligned
) {

    public TimeSlot {
        Objects.requireNonNull(id, "time slot id");
    }

    public static TimeSlot of(String id, long value) {
        return new TimeSlot(id, value);
    }

    public static TimeSlot unaligned(String id) {
        return new TimeSlot(id, null);
    }

    public boolean hasValue() {
        return value != null;
    }

    /**
     * Check if the slot has a value within [start, end] (inclusive).
     * Slots without a value are never contained.
     */
    public boolean containedIn(long start, long end) {
        return value != null && value >= start && value <= end;
    }

    public TimeSlot withId(String newId) {
        return new TimeSlot(newId, value);
    }

    public TimeSlot shifted(long ms) {
        return value == null ? this : new TimeSlot(id, value + ms);
    }
}
