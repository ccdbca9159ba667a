package com.example.neoncollapse.combat;

/**
 * Thrown when an encounter is constructed from rosters it cannot run with.
 */
public class InvalidEncounterException extends IllegalArgumentException {

    public InvalidEncounterException(String message) {
        super(message);
    }
}
