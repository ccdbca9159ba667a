package com.example.neoncollapse.model;

/**
 * The five core attributes of a combat actor. Each is in the range 1-10 and
 * stays fixed for the duration of an encounter.
 */
public final class Attributes {

    public static final int MIN_VALUE = 1;
    public static final int MAX_VALUE = 10;

    private final int body;
    private final int reflexes;
    private final int intelligence;
    private final int tech;
    private final int cool;

    public Attributes(int body, int reflexes, int intelligence, int tech, int cool) {
        this.body = requireInRange("body", body);
        this.reflexes = requireInRange("reflexes", reflexes);
        this.intelligence = requireInRange("intelligence", intelligence);
        this.tech = requireInRange("tech", tech);
        this.cool = requireInRange("cool", cool);
    }

    public int getBody() { return body; }
    public int getReflexes() { return reflexes; }
    public int getIntelligence() { return intelligence; }
    public int getTech() { return tech; }
    public int getCool() { return cool; }

    private static int requireInRange(String name, int value) {
        if (value < MIN_VALUE || value > MAX_VALUE) {
            throw new IllegalArgumentException(name + " must be between " + MIN_VALUE + " and "
                + MAX_VALUE + ", got " + value);
        }
        return value;
    }

    @Override
    public String toString() {
        return String.format("Attributes[BOD=%d REF=%d INT=%d TECH=%d COOL=%d]",
            body, reflexes, intelligence, tech, cool);
    }
}
