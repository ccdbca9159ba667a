package com.example.neoncollapse.combat;

import com.example.neoncollapse.config.CombatRules;

/**
 * End the active actor's turn and hand over to the next living actor.
 */
public class EndTurnAction implements CombatAction {

    @Override
    public String getName() {
        return "end turn";
    }

    @Override
    public int getApCost(CombatRules rules) {
        return 0;
    }

    @Override
    public String checkAllowed(CombatActor actor, CombatEncounter encounter) {
        return null;
    }

    @Override
    public CombatResult execute(CombatActor actor, CombatEncounter encounter) {
        String message = actor.getName() + " ends their turn";
        encounter.nextTurn();
        return CombatResult.turnEnded(actor.getActorId(), message);
    }

    @Override
    public String toString() {
        return "EndTurn";
    }
}
