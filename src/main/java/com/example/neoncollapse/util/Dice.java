package com.example.neoncollapse.util;

/**
 * Source of randomness for combat rolls. Every roll in an encounter goes
 * through one Dice instance so a seeded implementation replays an encounter
 * exactly.
 */
public interface Dice {

    /**
     * Roll a uniformly distributed integer.
     *
     * @param minInclusive lowest possible result
     * @param maxInclusive highest possible result
     */
    int rollInt(int minInclusive, int maxInclusive);

    /**
     * Roll a uniformly distributed double in [minInclusive, maxInclusive).
     */
    double rollDouble(double minInclusive, double maxInclusive);

    /**
     * Roll a percentile die (1-100).
     */
    default int rollPercent() {
        return rollInt(1, 100);
    }

    /**
     * Percentile check: succeeds when a d100 roll is at or under the chance.
     */
    default boolean check(int chancePercent) {
        return rollPercent() <= chancePercent;
    }
}
