package com.example.neoncollapse;

import com.example.neoncollapse.combat.CombatActor;
import com.example.neoncollapse.combat.TurnScheduler;
import com.example.neoncollapse.model.Team;
import com.example.neoncollapse.util.RandomDice;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TurnScheduler initiative ordering and cursor advance.
 */
@DisplayName("TurnScheduler Tests")
public class TurnSchedulerTest {

    private List<CombatActor> arena(int... reflexes) {
        List<CombatActor> actors = new ArrayList<>();
        for (int i = 0; i < reflexes.length; i++) {
            Team team = i % 2 == 0 ? Team.PLAYER : Team.OPPONENT;
            actors.add(TestActors.actor("Actor" + i, team, i, 0, reflexes[i], TestActors.PISTOL));
        }
        return actors;
    }

    @Test
    @DisplayName("Order is by initiative, highest first")
    void orderedByInitiative() {
        // 6*2+1=13, 4*2+1=9, 8*2+1=17
        TurnScheduler scheduler = new TurnScheduler(arena(6, 4, 8), new ScriptedDice().ints(1, 1, 1));

        assertEquals(Arrays.asList(2, 0, 1), scheduler.getOrder());
        assertEquals(17, scheduler.getInitiative(2));
        assertEquals(13, scheduler.getInitiative(0));
        assertEquals(9, scheduler.getInitiative(1));
        assertEquals(2, scheduler.getCurrentActorId());
        assertEquals(1, scheduler.getRound());
    }

    @Test
    @DisplayName("Equal initiative keeps arena order")
    void tiesKeepArenaOrder() {
        // 4*2+7=15, 5*2+5=15, 3*2+9=15
        TurnScheduler scheduler = new TurnScheduler(arena(4, 5, 3), new ScriptedDice().ints(7, 5, 9));
        assertEquals(Arrays.asList(0, 1, 2), scheduler.getOrder());
    }

    @Test
    @DisplayName("Same seed gives the same order every run")
    void deterministicWithSeed() {
        int[] reflexes = { 3, 7, 5, 5, 2, 9, 6, 4 };
        TurnScheduler first = new TurnScheduler(arena(reflexes), new RandomDice(1234L));
        TurnScheduler second = new TurnScheduler(arena(reflexes), new RandomDice(1234L));

        assertEquals(first.getOrder(), second.getOrder());
        for (int id : first.getOrder()) {
            assertEquals(first.getInitiative(id), second.getInitiative(id));
        }
    }

    @Test
    @DisplayName("Actors already down at the start are left out")
    void deadActorsExcluded() {
        List<CombatActor> actors = arena(5, 5, 5);
        actors.get(1).markDefeated();
        TurnScheduler scheduler = new TurnScheduler(actors, new ScriptedDice().ints(5, 5, 5));

        assertEquals(Arrays.asList(0, 2), scheduler.getOrder());
        assertThrows(IllegalArgumentException.class, () -> scheduler.getInitiative(1));
    }

    @Test
    @DisplayName("Advance skips dead actors and wraps into a new round")
    void advanceSkipsDeadAndWraps() {
        List<CombatActor> actors = arena(6, 4, 8);
        TurnScheduler scheduler = new TurnScheduler(actors, new ScriptedDice().ints(1, 1, 1));
        List<Integer> rounds = new ArrayList<>();

        actors.get(0).markDefeated();

        assertEquals(1, scheduler.advance(id -> actors.get(id).isAlive(), rounds::add));
        assertTrue(rounds.isEmpty());

        assertEquals(2, scheduler.advance(id -> actors.get(id).isAlive(), rounds::add));
        assertEquals(Arrays.asList(2), rounds);
        assertEquals(2, scheduler.getRound());
        assertEquals(0, scheduler.getCursor());
    }

    @Test
    @DisplayName("Skipping dead actors past the end of the order still starts a new round")
    void skipPastEndWraps() {
        List<CombatActor> actors = arena(6, 4, 8);
        TurnScheduler scheduler = new TurnScheduler(actors, new ScriptedDice().ints(1, 1, 1));
        List<Integer> rounds = new ArrayList<>();

        // order [2, 0, 1]; everyone after the current actor is down
        actors.get(0).markDefeated();
        actors.get(1).markDefeated();

        assertEquals(2, scheduler.advance(id -> actors.get(id).isAlive(), rounds::add));
        assertEquals(Arrays.asList(2), rounds);
    }

    @Test
    @DisplayName("Advance never returns a dead actor")
    void advanceNeverReturnsDead() {
        List<CombatActor> actors = arena(3, 7, 5, 5, 2, 9);
        TurnScheduler scheduler = new TurnScheduler(actors, new RandomDice(99L));
        actors.get(1).markDefeated();
        actors.get(4).markDefeated();

        for (int i = 0; i < 40; i++) {
            int id = scheduler.advance(x -> actors.get(x).isAlive(), round -> { });
            assertTrue(actors.get(id).isAlive());
        }
    }

    @Test
    @DisplayName("Advance with nobody alive is an error")
    void advanceWithNobodyAlive() {
        List<CombatActor> actors = arena(5, 5);
        TurnScheduler scheduler = new TurnScheduler(actors, new ScriptedDice());
        actors.forEach(CombatActor::markDefeated);

        assertThrows(IllegalStateException.class,
            () -> scheduler.advance(id -> actors.get(id).isAlive(), round -> { }));
    }
}
