package com.example.neoncollapse.combat;

import com.example.neoncollapse.util.Dice;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.IntConsumer;
import java.util.function.IntPredicate;

/**
 * Initiative order for one encounter.
 *
 * Actors are identified by their index in the arena list passed in.
 * Initiative is rolled once, in arena order, and the order never changes.
 * Ties keep arena order (player roster first). Actors who die later stay in the order
 * and are skipped by {@link #advance}.
 */
public class TurnScheduler {

    /** Actor ids, highest initiative first */
    private final List<Integer> order;

    /** Initiative rolled per actor id */
    private final Map<Integer, Integer> initiatives = new LinkedHashMap<>();

    /** Index into the order for whose turn it is */
    private int cursor = 0;

    /** Current round, starting at 1 */
    private int round = 1;

    public TurnScheduler(List<CombatActor> arena, Dice dice) {
        List<Integer> ids = new ArrayList<>();
        for (int id = 0; id < arena.size(); id++) {
            CombatActor actor = arena.get(id);
            if (!actor.isAlive()) continue;
            initiatives.put(id, actor.rollInitiative(dice));
            ids.add(id);
        }
        if (ids.isEmpty()) {
            throw new IllegalStateException("Turn order needs at least one living actor");
        }
        // List.sort is stable, so equal rolls keep arena order
        ids.sort((a, b) -> Integer.compare(initiatives.get(b), initiatives.get(a)));
        this.order = Collections.unmodifiableList(ids);
    }

    public List<Integer> getOrder() {
        return order;
    }

    public int getInitiative(int actorId) {
        Integer value = initiatives.get(actorId);
        if (value == null) {
            throw new IllegalArgumentException("Actor " + actorId + " is not in the turn order");
        }
        return value;
    }

    public int getCursor() { return cursor; }

    public int getRound() { return round; }

    public int getCurrentActorId() {
        return order.get(cursor);
    }

    /**
     * Move the cursor to the next living actor, wrapping at the end of the order.
     * Each wrap increments the round and notifies {@code onNewRound} before the
     * next actor is selected.
     *
     * @param isAlive liveness test by actor id
     * @param onNewRound called with the new round number on every wrap
     * @return id of the new current actor
     * @throws IllegalStateException if no actor in the order is alive
     */
    public int advance(IntPredicate isAlive, IntConsumer onNewRound) {
        for (int step = 0; step < order.size(); step++) {
            cursor++;
            if (cursor >= order.size()) {
                cursor = 0;
                round++;
                onNewRound.accept(round);
            }
            if (isAlive.test(order.get(cursor))) {
                return order.get(cursor);
            }
        }
        throw new IllegalStateException("No living actor left in the turn order");
    }
}
