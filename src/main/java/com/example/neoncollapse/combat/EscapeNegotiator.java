package com.example.neoncollapse.combat;

import com.example.neoncollapse.config.CombatRules;
import com.example.neoncollapse.util.Dice;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Decides when the player team may try to flee, and rolls the attempt.
 *
 * From the minimum round onward escape opens when any of these hold for the player team:
 * average HP of the living below 50%, at least one member down, or living
 * opponents at least twice the living players.
 *
 * Success chance is fixed when an ally is sacrificed, otherwise
 * base + leader reflexes x 2, clamped to 5-95.
 */
public class EscapeNegotiator {

    private final CombatRules rules;
    private final Dice dice;

    public EscapeNegotiator(CombatRules rules, Dice dice) {
        this.rules = rules;
        this.dice = dice;
    }

    /**
     * Evaluate whether escape is available at the start of the given round.
     */
    public boolean isEscapeAvailable(int round, List<CombatActor> playerTeam, List<CombatActor> opponentTeam) {
        if (round < rules.getEscapeMinRound()) {
            return false;
        }

        List<CombatActor> livingPlayers = playerTeam.stream()
            .filter(CombatActor::isAlive)
            .collect(Collectors.toList());
        if (livingPlayers.isEmpty()) {
            return false;
        }
        long livingOpponents = opponentTeam.stream().filter(CombatActor::isAlive).count();

        double avgHpPct = livingPlayers.stream()
            .mapToDouble(CombatActor::getHpPercentage)
            .average()
            .orElse(0.0);

        boolean lowHp = avgHpPct < 50.0;
        boolean casualties = livingPlayers.size() < playerTeam.size();
        boolean outnumbered = livingOpponents >= livingPlayers.size() * 2L;

        return lowHp || casualties || outnumbered;
    }

    /**
     * Success chance for an attempt.
     *
     * @param leader the actor whose reflexes set the unassisted chance
     * @param withSacrifice whether an ally stays behind
     */
    public int calculateEscapeChance(CombatActor leader, boolean withSacrifice) {
        if (withSacrifice) {
            return rules.getEscapeSacrificeChance();
        }
        int chance = rules.getEscapeBaseChance() + leader.getAttributes().getReflexes() * 2;
        return Math.max(DamageResolver.MIN_HIT_CHANCE, Math.min(DamageResolver.MAX_HIT_CHANCE, chance));
    }

    /**
     * HP the leader loses when an unassisted attempt fails.
     */
    public int calculateFailurePenalty(CombatActor leader) {
        return (int) (leader.getMaxHp() * rules.getEscapeFailureDamageFraction());
    }

    /**
     * Roll d100 against the chance.
     *
     * @return the roll (success when roll &lt;= chance)
     */
    public int roll() {
        return dice.rollPercent();
    }

    public int getMoralePenalty() {
        return rules.getEscapeMoralePenalty();
    }
}
