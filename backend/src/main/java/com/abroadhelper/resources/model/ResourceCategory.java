package com.abroadhelper.resources.model;

import java.util.Locale;
import java.util.Optional;

public enum ResourceCategory {
    SCHOLARSHIP,
    VISA,
    JOB,
    UNIVERSITY,
    ACCOMMODATION,
    GENERAL;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<ResourceCategory> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (ResourceCategory category : values()) {
            if (category.name().equals(normalized)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }
}
