package com.example.neoncollapse.model;

/**
 * Kind of cover an actor is standing behind.
 */
public enum CoverKind {
    NONE("None"),
    HALF("Half"),
    FULL("Full");

    private final String displayName;

    CoverKind(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() { return displayName; }

    /**
     * Parse a cover kind from a string (case-insensitive).
     * Unknown or empty input yields NONE.
     */
    public static CoverKind fromString(String s) {
        if (s == null || s.isEmpty()) return NONE;
        try {
            return CoverKind.valueOf(s.toUpperCase().trim());
        } catch (IllegalArgumentException e) {
            return NONE;
        }
    }
}
