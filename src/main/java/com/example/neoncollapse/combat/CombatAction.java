package com.example.neoncollapse.combat;

import com.example.neoncollapse.config.CombatRules;

/**
 * An action the active actor can take on its turn.
 * The encounter checks AP and legality before calling {@link #execute}.
 */
public interface CombatAction {

    /**
     * Get the name of this action, for logs.
     */
    String getName();

    /**
     * AP this action costs under the given rules.
     */
    int getApCost(CombatRules rules);

    /**
     * Check whether the actor may take this action right now, AP aside.
     *
     * @return null if allowed, otherwise the reason it is refused
     */
    String checkAllowed(CombatActor actor, CombatEncounter encounter);

    /**
     * Carry out the action. Only called after {@link #checkAllowed} passed and
     * the actor can afford {@link #getApCost}.
     */
    CombatResult execute(CombatActor actor, CombatEncounter encounter);
}
