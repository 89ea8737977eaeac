package com.vidnyan.eaf.domain.model;

/**
 * Which kinds of object an ID names. IDs are opaque, so one string may name
 * a tier, an annotation and a time slot at the same time.
 */
public record Existence(boolean tier, boolean annotation, boolean timeslot) {

    public boolean any() {
        return tier || annotation || timeslot;
    }
}
