package com.example.neoncollapse.combat;

import com.example.neoncollapse.config.CombatRules;

/**
 * Attack one hostile actor in weapon range.
 */
public class AttackAction implements CombatAction {

    private final int targetId;

    public AttackAction(int targetId) {
        this.targetId = targetId;
    }

    public int getTargetId() { return targetId; }

    @Override
    public String getName() {
        return "attack";
    }

    @Override
    public int getApCost(CombatRules rules) {
        return rules.getApAttack();
    }

    @Override
    public String checkAllowed(CombatActor actor, CombatEncounter encounter) {
        if (!encounter.getValidTargets(actor.getActorId()).contains(targetId)) {
            return "Target #" + targetId + " is not a valid target for " + actor.getName();
        }
        return null;
    }

    @Override
    public CombatResult execute(CombatActor actor, CombatEncounter encounter) {
        return encounter.resolveAttack(actor, encounter.getActor(targetId), getApCost(encounter.getRules()));
    }

    @Override
    public String toString() {
        return "Attack(" + targetId + ")";
    }
}
