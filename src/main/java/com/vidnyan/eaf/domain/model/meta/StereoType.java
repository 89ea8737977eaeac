package com.vidnyan.eaf.domain.model.meta;

import java.util.Arrays;
import java.util.Optional;

/**
 * Structural relationship between a referred tier and its parent.
 */
public enum StereoType {
    INCLUDED_IN("Included_In",
            "Time alignable annotations within the parent annotation's time interval, gaps are allowed"),
    SYMBOLIC_SUBDIVISION("Symbolic_Subdivision",
            "Symbolic subdivision of a parent annotation. Annotations refering to the same parent are ordered"),
    SYMBOLIC_ASSOCIATION("Symbolic_Association",
            "1-1 association with a parent annotation"),
    TIME_SUBDIVISION("Time_Subdivision",
            "Time subdivision of parent annotation's time interval, no time gaps allowed within this interval");

    private final String xmlName;
    private final String description;

    StereoType(String xmlName, String description) {
        this.xmlName = xmlName;
        this.description = description;
    }

    /**
     * Name as written in EAF, e.g. "Symbolic_Subdivision".
     */
    public String xmlName() {
        return xmlName;
    }

    public String description() {
        return description;
    }

    public boolean timeAlignable() {
        return this == INCLUDED_IN || this == TIME_SUBDIVISION;
    }

    public static Optional<StereoType> fromXmlName(String name) {
        return Arrays.stream(values())
                .filter(s -> s.xmlName.equals(name))
                .findFirst();
    }
}
