package com.example.neoncollapse.model;

/**
 * Weapon classes.
 *
 * - MELEE: scales with body, blocked by cover
 * - RANGED: scales with reflexes, blocked by cover
 * - TECH: scales with reflexes, ignores the cover damage reduction
 */
public enum WeaponClass {
    MELEE("Melee"),
    RANGED("Ranged"),
    TECH("Tech");

    private final String displayName;

    WeaponClass(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() { return displayName; }

    /**
     * Parse a weapon class from a string (case-insensitive).
     * @return the class, or null if unrecognised
     */
    public static WeaponClass fromString(String s) {
        if (s == null || s.isEmpty()) return null;
        String upper = s.toUpperCase().trim();
        try {
            return WeaponClass.valueOf(upper);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
