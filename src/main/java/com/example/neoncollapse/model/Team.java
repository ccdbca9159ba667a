package com.example.neoncollapse.model;

/**
 * Side an actor fights for.
 */
public enum Team {
    PLAYER("Player"),
    OPPONENT("Opponent");

    private final String displayName;

    Team(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() { return displayName; }
}
