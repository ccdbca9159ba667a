package com.example.neoncollapse.combat;

/**
 * Lifecycle state of a combat encounter.
 */
public enum CombatState {

    /** Rosters are being validated and initiative rolled */
    INITIALIZING("Initializing"),

    /** Turns are being taken */
    IN_PROGRESS("In Progress"),

    /** Combat is over; see the encounter's outcome */
    TERMINATED("Terminated");

    private final String displayName;

    CombatState(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
