package com.vidnyan.eaf.domain.model.meta;

public record Locale(String languageCode, String countryCode, String variant) {

    public static Locale of(String languageCode) {
        return new Locale(languageCode, null, null);
    }
}
