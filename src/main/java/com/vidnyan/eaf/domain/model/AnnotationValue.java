package com.vidnyan.eaf.domain.model;

import java.util.Arrays;
import java.util.List;

/**
 * Text payload of an annotation.
 */
public record AnnotationValue(String text) {

    public AnnotationValue {
        text = text == null ? "" : text;
    }

    public static AnnotationValue of(String text) {
        return new AnnotationValue(text);
    }

    public boolean isEmpty() {
        return text.isEmpty();
    }

    /**
     * Whitespace separated tokens.
     */
    public List<String> tokens() {
        String trimmed = text.strip();
        if (trimmed.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(trimmed.split("\\s+"));
    }

    public int tokenCount() {
        return tokens().size();
    }

    @Override
    public String toString() {
        return text;
    }
}
