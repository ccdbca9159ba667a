package com.example.neoncollapse.combat;

/**
 * Result of a submitted action or escape attempt.
 * Refused requests come back as NOT_ALLOWED with a reason and change nothing.
 */
public class CombatResult {

    /** Marker for results without an actor or target */
    public static final int NO_ACTOR = -1;

    private final ResultType type;
    private final int actorId;
    private final int targetId;
    private final int damage;
    private final String message;

    /** Hit chance and roll, for attacks and escape attempts */
    private int chance;
    private int roll;

    public enum ResultType {
        HIT,            // Attack hit
        CRITICAL_HIT,   // Attack hit with the crit multiplier
        MISS,           // Attack missed
        KILLED,         // Attack dropped the target to 0 HP
        MOVED,          // Actor changed tiles
        COVER,          // Actor took or left cover
        TURN_ENDED,     // Actor ended its turn
        ESCAPED,        // Player team fled
        ESCAPE_FAILED,  // Escape roll failed
        NOT_ALLOWED     // Request refused, no state changed
    }

    private CombatResult(ResultType type, int actorId, int targetId, int damage, String message) {
        this.type = type;
        this.actorId = actorId;
        this.targetId = targetId;
        this.damage = damage;
        this.message = message;
    }

    // Static factory methods

    public static CombatResult hit(int actorId, int targetId, int damage, boolean critical, String message) {
        return new CombatResult(critical ? ResultType.CRITICAL_HIT : ResultType.HIT,
            actorId, targetId, damage, message);
    }

    public static CombatResult killed(int actorId, int targetId, int damage, String message) {
        return new CombatResult(ResultType.KILLED, actorId, targetId, damage, message);
    }

    public static CombatResult miss(int actorId, int targetId, String message) {
        return new CombatResult(ResultType.MISS, actorId, targetId, 0, message);
    }

    public static CombatResult moved(int actorId, String message) {
        return new CombatResult(ResultType.MOVED, actorId, NO_ACTOR, 0, message);
    }

    public static CombatResult cover(int actorId, String message) {
        return new CombatResult(ResultType.COVER, actorId, NO_ACTOR, 0, message);
    }

    public static CombatResult turnEnded(int actorId, String message) {
        return new CombatResult(ResultType.TURN_ENDED, actorId, NO_ACTOR, 0, message);
    }

    public static CombatResult escaped(String message) {
        return new CombatResult(ResultType.ESCAPED, NO_ACTOR, NO_ACTOR, 0, message);
    }

    public static CombatResult escapeFailed(int damagedActorId, int damage, String message) {
        return new CombatResult(ResultType.ESCAPE_FAILED, damagedActorId, NO_ACTOR, damage, message);
    }

    public static CombatResult notAllowed(String reason) {
        return new CombatResult(ResultType.NOT_ALLOWED, NO_ACTOR, NO_ACTOR, 0, reason);
    }

    // Getters

    public ResultType getType() { return type; }
    public int getActorId() { return actorId; }
    public int getTargetId() { return targetId; }
    public int getDamage() { return damage; }
    public String getMessage() { return message; }

    public int getChance() { return chance; }
    CombatResult setChance(int chance) { this.chance = chance; return this; }

    public int getRoll() { return roll; }
    CombatResult setRoll(int roll) { this.roll = roll; return this; }

    public boolean isAllowed() { return type != ResultType.NOT_ALLOWED; }
    public boolean isNotAllowed() { return type == ResultType.NOT_ALLOWED; }
    public boolean isHit() {
        return type == ResultType.HIT || type == ResultType.CRITICAL_HIT || type == ResultType.KILLED;
    }
    public boolean isMiss() { return type == ResultType.MISS; }
    public boolean isEscaped() { return type == ResultType.ESCAPED; }

    @Override
    public String toString() {
        return String.format("CombatResult[%s actor=%d target=%d damage=%d: %s]",
            type, actorId, targetId, damage, message);
    }
}
