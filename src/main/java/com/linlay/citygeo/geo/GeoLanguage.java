package com.linlay.citygeo.geo;

import java.util.Locale;

public enum GeoLanguage {

    EN("en"),
    ZH("zh-CN,zh");

    private final String acceptLanguage;

    GeoLanguage(String acceptLanguage) {
        this.acceptLanguage = acceptLanguage;
    }

    public String acceptLanguage() {
        return acceptLanguage;
    }

    public static GeoLanguage from(String language) {
        if (language == null) {
            return EN;
        }
        String normalized = language.trim().toLowerCase(Locale.ROOT);
        return normalized.startsWith("zh") ? ZH : EN;
    }
}
