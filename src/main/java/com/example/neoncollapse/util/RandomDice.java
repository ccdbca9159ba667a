package com.example.neoncollapse.util;

import java.util.Random;

/**
 * Dice backed by java.util.Random. Construct with a seed for reproducible encounters.
 */
public final class RandomDice implements Dice {

    private final Random random;

    public RandomDice() {
        this.random = new Random();
    }

    public RandomDice(long seed) {
        this.random = new Random(seed);
    }

    @Override
    public int rollInt(int minInclusive, int maxInclusive) {
        if (maxInclusive < minInclusive) {
            throw new IllegalArgumentException("bad range: " + minInclusive + ".." + maxInclusive);
        }
        int span = (maxInclusive - minInclusive) + 1;
        return minInclusive + random.nextInt(span);
    }

    @Override
    public double rollDouble(double minInclusive, double maxInclusive) {
        if (maxInclusive < minInclusive) {
            throw new IllegalArgumentException("bad range: " + minInclusive + ".." + maxInclusive);
        }
        return minInclusive + random.nextDouble() * (maxInclusive - minInclusive);
    }
}
