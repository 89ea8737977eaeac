package com.vidnyan.eaf.domain.model;

/**
 * Annotation value with a millisecond span, used to build documents from plain data.
 */
public record TimedValue(String value, long start, long end) {

    public static TimedValue of(String value, long start, long end) {
        return new TimedValue(value, start, end);
    }
}
