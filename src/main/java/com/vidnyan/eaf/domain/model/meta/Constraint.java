package com.vidnyan.eaf.domain.model.meta;

/**
 * Constraint declaration, one per stereotype in use.
 */
public record Constraint(StereoType stereotype, String description) {

    public static Constraint of(StereoType stereotype) {
        return new Constraint(stereotype, stereotype.description());
    }
}
