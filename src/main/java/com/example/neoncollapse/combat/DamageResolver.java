package com.example.neoncollapse.combat;

import com.example.neoncollapse.config.CombatRules;
import com.example.neoncollapse.model.CoverKind;
import com.example.neoncollapse.model.Weapon;
import com.example.neoncollapse.util.Dice;

/**
 * Hit and damage formulas for an attacker/defender pair.
 *
 * Hit chance: weapon accuracy - defender dodge - cover penalty, clamped to 5-95.
 *
 * Damage: (weapon damage x variance + stat bonus) x crit x morale
 *         - effective armor x reduction multiplier, then x cover factor
 *         (non-tech weapons only), floored at 1.
 *
 * Stat bonus is body x 3 for melee weapons and reflexes x 2 otherwise.
 */
public class DamageResolver {

    public static final int MIN_HIT_CHANCE = 5;
    public static final int MAX_HIT_CHANCE = 95;

    /** Every successful hit deals at least this much */
    public static final int MIN_DAMAGE = 1;

    private final CombatRules rules;
    private final Dice dice;

    public DamageResolver(CombatRules rules, Dice dice) {
        this.rules = rules;
        this.dice = dice;
    }

    /**
     * Calculate the percentage chance for the attacker to hit the defender.
     *
     * @return hit chance, always within 5-95
     */
    public int calculateHitChance(CombatActor attacker, CombatActor defender) {
        int hit = attacker.getWeapon().getAccuracy() - defender.getDodgeChance();
        if (defender.isInCover()) {
            hit -= defender.getCoverKind() == CoverKind.HALF
                ? rules.getCoverHalfPenalty()
                : rules.getCoverFullPenalty();
        }
        return clampHitChance(hit);
    }

    public int clampHitChance(int raw) {
        return Math.max(MIN_HIT_CHANCE, Math.min(MAX_HIT_CHANCE, raw));
    }

    /**
     * Stat bonus added to the weapon's base damage.
     */
    public int calculateStatBonus(CombatActor attacker) {
        if (attacker.getWeapon().isMelee()) {
            return attacker.getAttributes().getBody() * 3;
        }
        return attacker.getAttributes().getReflexes() * 2;
    }

    /**
     * Damage formula with the random parts supplied by the caller.
     *
     * @param variance base damage multiplier (normally 0.85-1.15)
     * @param critical whether the crit multiplier applies
     * @return final damage, at least 1
     */
    public int calculateDamage(CombatActor attacker, CombatActor defender, double variance, boolean critical) {
        Weapon weapon = attacker.getWeapon();

        double base = weapon.getDamage() * variance;
        double critMultiplier = critical ? weapon.getCritMultiplier() : 1.0;
        double total = (base + calculateStatBonus(attacker)) * critMultiplier * attacker.getMoraleModifier();

        double effectiveArmor = defender.getArmor() * (1.0 - weapon.getArmorPenetration());
        total -= effectiveArmor * rules.getArmorReductionMultiplier();

        if (defender.isInCover() && !weapon.isTech()) {
            total *= defender.getCoverKind() == CoverKind.HALF
                ? rules.getCoverHalfDamageFactor()
                : rules.getCoverFullDamageFactor();
        }

        return (int) Math.max(MIN_DAMAGE, Math.round(total));
    }

    /**
     * Roll damage for a hit that has already landed: variance first, then the crit check.
     */
    public AttackRoll rollDamage(CombatActor attacker, CombatActor defender, int hitChance, int hitRoll) {
        double variance = dice.rollDouble(rules.getDamageVarianceMin(), rules.getDamageVarianceMax());
        boolean critical = dice.check(attacker.getCritChance());
        int damage = calculateDamage(attacker, defender, variance, critical);
        return AttackRoll.hit(hitChance, hitRoll, damage, critical);
    }

    /**
     * Resolve a full attack: hit roll, then damage on a hit. Does not mutate either actor.
     */
    public AttackRoll resolve(CombatActor attacker, CombatActor defender) {
        int hitChance = calculateHitChance(attacker, defender);
        int roll = dice.rollPercent();
        if (roll > hitChance) {
            return AttackRoll.miss(hitChance, roll);
        }
        return rollDamage(attacker, defender, hitChance, roll);
    }
}
