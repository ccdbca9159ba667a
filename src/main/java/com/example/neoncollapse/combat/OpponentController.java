package com.example.neoncollapse.combat;

import com.example.neoncollapse.config.CombatRules;
import com.example.neoncollapse.model.GridPosition;

import java.util.ArrayList;
import java.util.List;

/**
 * Decision procedure for opponent-team actors: attack the closest target in
 * range if AP allows, otherwise step toward the closest living player-team actor.
 *
 * Distances are Manhattan; ties go to the earlier roster entry.
 */
public class OpponentController {

    /**
     * Choose the next action for an opponent actor.
     *
     * @return the action to perform, or null if the actor can do nothing useful
     */
    public CombatAction decide(CombatEncounter encounter, CombatActor actor) {
        CombatRules rules = encounter.getRules();

        List<Integer> targets = encounter.getValidTargets(actor.getActorId());
        if (!targets.isEmpty() && actor.hasAp(rules.getApAttack())) {
            return new AttackAction(closest(encounter, actor, targets));
        }

        if (actor.hasAp(rules.getApMove())) {
            List<Integer> livingPlayers = new ArrayList<>();
            for (CombatActor candidate : encounter.getActors()) {
                if (candidate.isAlive() && candidate.isHostileTo(actor)) {
                    livingPlayers.add(candidate.getActorId());
                }
            }
            if (livingPlayers.isEmpty()) {
                return null;
            }
            CombatActor quarry = encounter.getActor(closest(encounter, actor, livingPlayers));
            return stepToward(encounter, actor, quarry);
        }

        return null;
    }

    /**
     * Pick the id with the smallest distance from the actor; earlier ids win ties.
     */
    int closest(CombatEncounter encounter, CombatActor actor, List<Integer> candidateIds) {
        int bestId = candidateIds.get(0);
        int bestDistance = Integer.MAX_VALUE;
        for (int id : candidateIds) {
            int distance = actor.getPosition().distanceTo(encounter.getActor(id).getPosition());
            if (distance < bestDistance) {
                bestDistance = distance;
                bestId = id;
            }
        }
        return bestId;
    }

    /**
     * One step toward the quarry, moving on both axes at once. If that tile is
     * blocked, try each axis alone.
     */
    private CombatAction stepToward(CombatEncounter encounter, CombatActor actor, CombatActor quarry) {
        GridPosition from = actor.getPosition();
        int sx = Integer.signum(quarry.getPosition().getX() - from.getX());
        int sy = Integer.signum(quarry.getPosition().getY() - from.getY());

        List<GridPosition> validMoves = encounter.getValidMoves(actor.getActorId());
        int[][] steps = { { sx, sy }, { sx, 0 }, { 0, sy } };
        for (int[] step : steps) {
            if (step[0] == 0 && step[1] == 0) continue;
            if (validMoves.contains(from.offset(step[0], step[1]))) {
                return new MoveAction(step[0], step[1]);
            }
        }
        return null;
    }
}
