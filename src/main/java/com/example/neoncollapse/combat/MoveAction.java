package com.example.neoncollapse.combat;

import com.example.neoncollapse.config.CombatRules;
import com.example.neoncollapse.model.GridPosition;

/**
 * Move by an offset to one of the actor's valid destination tiles.
 */
public class MoveAction implements CombatAction {

    private final int dx;
    private final int dy;

    public MoveAction(int dx, int dy) {
        this.dx = dx;
        this.dy = dy;
    }

    public int getDx() { return dx; }

    public int getDy() { return dy; }

    @Override
    public String getName() {
        return "move";
    }

    @Override
    public int getApCost(CombatRules rules) {
        return rules.getApMove();
    }

    @Override
    public String checkAllowed(CombatActor actor, CombatEncounter encounter) {
        GridPosition destination = actor.getPosition().offset(dx, dy);
        if (!encounter.getValidMoves(actor.getActorId()).contains(destination)) {
            return actor.getName() + " cannot move to " + destination;
        }
        return null;
    }

    @Override
    public CombatResult execute(CombatActor actor, CombatEncounter encounter) {
        return encounter.moveActor(actor, actor.getPosition().offset(dx, dy), getApCost(encounter.getRules()));
    }

    @Override
    public String toString() {
        return "Move(" + dx + ", " + dy + ")";
    }
}
