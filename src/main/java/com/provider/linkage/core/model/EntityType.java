package com.provider.linkage.core.model;

import java.util.Locale;

/**
 * Registry entity type flag. Only organizations become part of the spine.
 */
public enum EntityType {
    ORGANIZATION("Organization"),
    INDIVIDUAL("Individual");

    private final String label;

    EntityType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Parses the registry's entity type code. NPPES uses "2" for organizations and "1" for
     * individuals; textual labels are accepted as well.
     *
     * @throws IllegalArgumentException if the value is not a known entity type
     */
    public static EntityType fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("entity type is required");
        }
        String trimmed = code.trim();
        switch (trimmed.toUpperCase(Locale.ROOT)) {
            case "2", "ORGANIZATION", "ORG" -> {
                return ORGANIZATION;
            }
            case "1", "INDIVIDUAL", "IND" -> {
                return INDIVIDUAL;
            }
            default -> throw new IllegalArgumentException("Unknown entity type: " + trimmed);
        }
    }
}
