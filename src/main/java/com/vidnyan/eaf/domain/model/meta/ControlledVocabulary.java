package com.vidnyan.eaf.domain.model.meta;

import java.util.List;

/**
 * Controlled vocabulary with multilingual entries (EAF 2.8+ layout).
 */
public record ControlledVocabulary(
    String id,
    String extRef,
    List<Description> descriptions,
    List<Entry> entries
) {

    public ControlledVocabulary {
        descriptions = descriptions == null ? List.of() : List.copyOf(descriptions);
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    public record Description(String langRef, String text) {}

    public record Entry(String id, String extRef, List<EntryValue> values) {
        public Entry {
            values = values == null ? List.of() : List.copyOf(values);
        }
    }

    public record EntryValue(String langRef, String description, String value) {}
}
