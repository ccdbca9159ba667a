package com.example.neoncollapse.combat;

import com.example.neoncollapse.config.CombatRules;
import com.example.neoncollapse.model.CoverKind;

/**
 * Take half or full cover on the current tile, or leave cover with {@link CoverKind#NONE}.
 * Leaving cover is free.
 */
public class TakeCoverAction implements CombatAction {

    private final CoverKind kind;

    public TakeCoverAction(CoverKind kind) {
        this.kind = kind != null ? kind : CoverKind.NONE;
    }

    public CoverKind getKind() { return kind; }

    @Override
    public String getName() {
        return kind == CoverKind.NONE ? "leave cover" : "take cover";
    }

    @Override
    public int getApCost(CombatRules rules) {
        return kind == CoverKind.NONE ? 0 : rules.getApTakeCover();
    }

    @Override
    public String checkAllowed(CombatActor actor, CombatEncounter encounter) {
        if (actor.getCoverKind() != kind) {
            return null;
        }
        return kind == CoverKind.NONE
            ? actor.getName() + " is not in cover"
            : actor.getName() + " is already in " + kind.getDisplayName().toLowerCase() + " cover";
    }

    @Override
    public CombatResult execute(CombatActor actor, CombatEncounter encounter) {
        actor.spendAp(getApCost(encounter.getRules()));
        actor.setCover(kind);
        String message = kind == CoverKind.NONE
            ? actor.getName() + " leaves cover"
            : actor.getName() + " takes " + kind.getDisplayName().toLowerCase() + " cover";
        encounter.logEvent(message);
        return CombatResult.cover(actor.getActorId(), message);
    }

    @Override
    public String toString() {
        return "TakeCover(" + kind + ")";
    }
}
