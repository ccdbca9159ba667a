package com.example.neoncollapse.combat;

/**
 * How a terminated encounter ended, from the player team's point of view.
 */
public enum CombatOutcome {
    VICTORY("Victory"),
    DEFEAT("Defeat"),
    FLED("Fled");

    private final String displayName;

    CombatOutcome(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
