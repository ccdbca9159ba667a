package com.example.neoncollapse;

import com.example.neoncollapse.combat.AttackAction;
import com.example.neoncollapse.combat.CombatAction;
import com.example.neoncollapse.combat.CombatActor;
import com.example.neoncollapse.combat.CombatEncounter;
import com.example.neoncollapse.combat.MoveAction;
import com.example.neoncollapse.combat.OpponentController;
import com.example.neoncollapse.model.GridPosition;
import com.example.neoncollapse.model.Team;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the opponent decision procedure.
 */
@DisplayName("OpponentController Tests")
public class OpponentControllerTest {

    private final OpponentController controller = new OpponentController();

    @Test
    @DisplayName("Attacks the closest player in range")
    void attacksClosestTarget() {
        CombatActor far = TestActors.player("Far", 3, 0);
        CombatActor near = TestActors.player("Near", 1, 0);
        CombatActor enemy = TestActors.opponent("Enemy", 0, 0);
        CombatEncounter encounter = new CombatEncounter(Arrays.asList(far, near),
            Collections.singletonList(enemy), new ScriptedDice());

        CombatAction action = controller.decide(encounter, enemy);
        assertTrue(action instanceof AttackAction);
        assertEquals(near.getActorId(), ((AttackAction) action).getTargetId());
    }

    @Test
    @DisplayName("Equal distances go to the earlier roster entry")
    void tieGoesToRosterOrder() {
        CombatActor first = TestActors.player("First", 2, 0);
        CombatActor second = TestActors.player("Second", 0, 2);
        CombatActor enemy = TestActors.opponent("Enemy", 0, 0);
        CombatEncounter encounter = new CombatEncounter(Arrays.asList(first, second),
            Collections.singletonList(enemy), new ScriptedDice());

        AttackAction action = (AttackAction) controller.decide(encounter, enemy);
        assertEquals(first.getActorId(), action.getTargetId());
    }

    @Test
    @DisplayName("Out of range, steps toward the closest player on both axes")
    void stepsTowardClosestPlayer() {
        CombatActor player = TestActors.player("Runner", 5, 3);
        CombatActor enemy = TestActors.actor("Blade", Team.OPPONENT, 0, 0, 4, TestActors.KATANA);
        CombatEncounter encounter = new CombatEncounter(Collections.singletonList(player),
            Collections.singletonList(enemy), new ScriptedDice());

        CombatAction action = controller.decide(encounter, enemy);
        assertTrue(action instanceof MoveAction);
        assertEquals(1, ((MoveAction) action).getDx());
        assertEquals(1, ((MoveAction) action).getDy());
    }

    @Test
    @DisplayName("Falls back to a single-axis step when the diagonal is blocked")
    void singleAxisFallback() {
        CombatActor player = TestActors.player("Runner", 5, 5);
        CombatActor enemy = TestActors.actor("Blade", Team.OPPONENT, 0, 0, 4, TestActors.KATANA);
        CombatActor blocker = TestActors.actor("Wall", Team.OPPONENT, 1, 1, 4, TestActors.KATANA);
        CombatEncounter encounter = new CombatEncounter(Collections.singletonList(player),
            Arrays.asList(enemy, blocker), new ScriptedDice());

        MoveAction action = (MoveAction) controller.decide(encounter, enemy);
        assertEquals(1, action.getDx());
        assertEquals(0, action.getDy());
    }

    @Test
    @DisplayName("Without AP there is nothing to do")
    void noApNoAction() {
        CombatActor player = TestActors.player("Target", 1, 0);
        CombatActor enemy = TestActors.opponent("Enemy", 0, 0);
        CombatEncounter encounter = new CombatEncounter(Collections.singletonList(player),
            Collections.singletonList(enemy), new ScriptedDice());

        enemy.spendAp(enemy.getAp());
        assertNull(controller.decide(encounter, enemy));
    }

    @Test
    @DisplayName("An opponent turn attacks, spends the rest on movement and hands over")
    void opponentTurnEndsWhenApRunsOut() {
        CombatActor player = TestActors.player("Player", 0, 0);
        CombatActor enemy = TestActors.opponent("Enemy", 5, 0);
        // initiative: player 12+1, enemy 8+10; then hit roll 5, crit roll 50
        ScriptedDice dice = new ScriptedDice().ints(1, 10, 5, 50);
        CombatEncounter encounter = new CombatEncounter(Collections.singletonList(player),
            Collections.singletonList(enemy), dice);

        assertTrue(encounter.isOpponentTurn());
        assertTrue(encounter.runOpponentTurn());

        // 25 + 8 = 33 x 1.25 = 41.25 - 13.5 armor = 27.75
        assertEquals(150 - 28, player.getHp());
        assertEquals(new GridPosition(4, 0), enemy.getPosition());
        assertEquals(0, enemy.getAp());
        assertTrue(encounter.isPlayerTurn());
        assertEquals(player.getActorId(), encounter.getCurrentActorId());
    }

    @Test
    @DisplayName("An opponent that cannot act holds position and ends its turn")
    void opponentHoldsWhenStuck() {
        CombatActor player = TestActors.player("Player", 3, 0);
        CombatActor enemy = TestActors.actor("Blade", Team.OPPONENT, 0, 0, 4, TestActors.KATANA);
        CombatEncounter encounter = new CombatEncounter(Collections.singletonList(player),
            Collections.singletonList(enemy), new ScriptedDice().ints(1, 10));

        assertTrue(encounter.isOpponentTurn());
        encounter.runOpponentTurn();

        // two steps to (2,0), then adjacent with 1 AP: too little to attack, no free tile toward the player
        assertEquals(new GridPosition(2, 0), enemy.getPosition());
        assertTrue(encounter.isPlayerTurn());
        assertTrue(encounter.getCombatLog().stream().anyMatch(line -> line.contains("Blade holds position")));
    }

    @Test
    @DisplayName("runOpponentTurn does nothing on a player turn")
    void noOpOnPlayerTurn() {
        CombatActor player = TestActors.player("Player", 0, 0);
        CombatActor enemy = TestActors.opponent("Enemy", 5, 0);
        CombatEncounter encounter = new CombatEncounter(Collections.singletonList(player),
            Collections.singletonList(enemy), new ScriptedDice().ints(10, 1));

        assertTrue(encounter.isPlayerTurn());
        assertFalse(encounter.runOpponentTurn());
        assertEquals(3, player.getAp());
    }
}
