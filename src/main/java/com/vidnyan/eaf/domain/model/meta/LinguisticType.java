package com.vidnyan.eaf.domain.model.meta;

import lombok.Builder;

/**
 * Linguistic type referenced by tiers. Declares time alignability and the
 * constraint (stereotype) of referred tiers using it.
 */
@Builder
public record LinguisticType(
    String id,
    Boolean timeAlignable,
    StereoType constraint,
    Boolean graphicReferences,
    String controlledVocabularyRef,
    String extRef,
    String lexiconRef
) {

    public static final String DEFAULT_ID = "default-lt";

    /**
     * Linguistic type for a main, alignable tier.
     */
    public static LinguisticType defaultType() {
        return of(DEFAULT_ID, null);
    }

    /**
     * Linguistic type with time alignability derived from the stereotype.
     * A null stereotype means a main tier type.
     */
    public static LinguisticType of(String id, StereoType stereotype) {
        return LinguisticType.builder()
                .id(id)
                .timeAlignable(stereotype == null || stereotype.timeAlignable())
                .constraint(stereotype)
                .graphicReferences(false)
                .build();
    }
}
