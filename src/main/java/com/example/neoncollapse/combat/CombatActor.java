package com.example.neoncollapse.combat;

import com.example.neoncollapse.config.CombatRules;
import com.example.neoncollapse.model.Attributes;
import com.example.neoncollapse.model.CoverKind;
import com.example.neoncollapse.model.GridPosition;
import com.example.neoncollapse.model.Team;
import com.example.neoncollapse.model.Weapon;
import com.example.neoncollapse.util.Dice;

/**
 * A character or enemy taking part in an encounter.
 * Holds attributes, resource pools, position and per-turn flags, and exposes
 * the derived combat numbers (initiative, dodge, crit, morale modifier).
 *
 * Actors never log; the owning encounter records what happens to them.
 */
public class CombatActor {

    /** Id assigned when the actor is enrolled in an encounter (-1 until then) */
    private int actorId = -1;

    private final String name;
    private final Team team;
    private GridPosition position;

    private final Attributes attributes;
    private final Weapon weapon;
    private final CombatRules rules;

    private int hp;
    private final int maxHp;
    /** Armor rating (0-100) */
    private final int armor;
    /** Morale (0-100), starts full */
    private int morale = MAX_MORALE;

    private int ap;
    private final int maxAp;

    private boolean alive = true;
    private boolean hasActed = false;
    private boolean hasMoved = false;
    private CoverKind coverKind = CoverKind.NONE;

    public static final int MAX_MORALE = 100;
    public static final int MAX_ARMOR = 100;

    public CombatActor(String name, Team team, GridPosition position, Attributes attributes,
                       int maxHp, int armor, Weapon weapon) {
        this(name, team, position, attributes, maxHp, armor, weapon, CombatRules.defaults());
    }

    public CombatActor(String name, Team team, GridPosition position, Attributes attributes,
                       int maxHp, int armor, Weapon weapon, CombatRules rules) {
        if (name == null || name.isEmpty()) throw new IllegalArgumentException("Actor name is required");
        if (team == null) throw new IllegalArgumentException("Team is required for " + name);
        if (position == null) throw new IllegalArgumentException("Position is required for " + name);
        if (attributes == null) throw new IllegalArgumentException("Attributes are required for " + name);
        if (weapon == null) throw new IllegalArgumentException("Weapon is required for " + name);
        if (rules == null) throw new IllegalArgumentException("Rules are required for " + name);
        if (maxHp <= 0) throw new IllegalArgumentException("Max HP of " + name + " must be positive");
        if (armor < 0 || armor > MAX_ARMOR) {
            throw new IllegalArgumentException("Armor of " + name + " must be within 0-" + MAX_ARMOR);
        }
        this.name = name;
        this.team = team;
        this.position = position;
        this.attributes = attributes;
        this.maxHp = maxHp;
        this.hp = maxHp;
        this.armor = armor;
        this.weapon = weapon;
        this.rules = rules;
        this.maxAp = rules.getMaxActionPoints();
        this.ap = maxAp;
    }

    // Identification

    public int getActorId() { return actorId; }

    boolean isEnrolled() { return actorId >= 0; }

    void enroll(int id) {
        if (isEnrolled()) {
            throw new IllegalStateException(name + " is already enrolled as actor " + actorId);
        }
        this.actorId = id;
    }

    public String getName() { return name; }

    public Team getTeam() { return team; }

    public boolean isPlayerTeam() { return team == Team.PLAYER; }

    public boolean isHostileTo(CombatActor other) {
        return team != other.team;
    }

    public GridPosition getPosition() { return position; }

    public Attributes getAttributes() { return attributes; }

    public Weapon getWeapon() { return weapon; }

    /** Rules the derived numbers are computed under */
    public CombatRules getRules() { return rules; }

    // Derived combat numbers

    /**
     * Roll initiative: (reflexes x 2) + d10.
     */
    public int rollInitiative(Dice dice) {
        return attributes.getReflexes() * 2 + dice.rollInt(1, 10);
    }

    /**
     * Dodge chance percentage: reflexes x 3, capped.
     */
    public int getDodgeChance() {
        return Math.min(rules.getDodgeCap(), attributes.getReflexes() * 3);
    }

    /**
     * Crit chance percentage: cool x 2.
     */
    public int getCritChance() {
        return attributes.getCool() * 2;
    }

    /**
     * Outgoing damage multiplier: 0.75 at morale 0, 1.0 at 50, 1.25 at 100.
     */
    public double getMoraleModifier() {
        return 1.0 + ((morale - 50) / 200.0);
    }

    public int getMovementRange() {
        return rules.getBaseMovementRange() + attributes.getReflexes() / 4;
    }

    // HP

    public int getHp() { return hp; }

    public int getMaxHp() { return maxHp; }

    public double getHpPercentage() {
        return (hp * 100.0) / maxHp;
    }

    public boolean isAlive() { return alive; }

    /**
     * Subtract HP, flooring at 0. A single hit of 30%+ of max HP costs heavy
     * morale, 15%+ costs light morale.
     *
     * @return the HP actually removed
     */
    public int applyDamage(int amount) {
        if (!alive || amount <= 0) return 0;
        int applied = Math.min(amount, hp);
        hp -= applied;

        // 30% and 15% thresholds in integer arithmetic
        if (amount * 10L >= maxHp * 3L) {
            loseMorale(rules.getMoraleLossHeavy());
        } else if (amount * 20L >= maxHp * 3L) {
            loseMorale(rules.getMoraleLossLight());
        }

        if (hp == 0) {
            alive = false;
        }
        return applied;
    }

    /**
     * Force HP to 0 and remove the actor from play. The actor stays in its roster.
     */
    public void markDefeated() {
        hp = 0;
        alive = false;
        ap = 0;
    }

    // Armor and morale

    public int getArmor() { return armor; }

    public int getMorale() { return morale; }

    public void setMorale(int morale) {
        this.morale = Math.max(0, Math.min(MAX_MORALE, morale));
    }

    public void loseMorale(int amount) {
        setMorale(morale - amount);
    }

    // Action points

    public int getAp() { return ap; }

    public int getMaxAp() { return maxAp; }

    public boolean hasAp(int cost) {
        return ap >= cost;
    }

    /**
     * Spend AP if enough remain.
     * @return false (and nothing spent) if the actor cannot afford the cost
     */
    public boolean spendAp(int cost) {
        if (cost < 0 || ap < cost) return false;
        ap -= cost;
        return true;
    }

    public void refillAp() {
        ap = maxAp;
    }

    // Turn flags

    public boolean hasActed() { return hasActed; }

    public boolean hasMoved() { return hasMoved; }

    public void startTurn() {
        refillAp();
        hasActed = false;
        hasMoved = false;
    }

    public void endTurn() {
        hasActed = true;
    }

    // Position and cover

    /**
     * Move to a new tile. Cover belongs to the old tile and is lost.
     */
    void moveTo(GridPosition destination) {
        this.position = destination;
        this.hasMoved = true;
        this.coverKind = CoverKind.NONE;
    }

    public boolean isInCover() {
        return coverKind != CoverKind.NONE;
    }

    public CoverKind getCoverKind() { return coverKind; }

    public void setCover(CoverKind kind) {
        this.coverKind = kind != null ? kind : CoverKind.NONE;
    }

    @Override
    public String toString() {
        return String.format("CombatActor[#%d %s (%s) HP=%d/%d AP=%d/%d at %s]",
            actorId, name, team.getDisplayName(), hp, maxHp, ap, maxAp, position);
    }
}
