package com.example.neoncollapse.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Numeric rules of the combat engine: action costs, caps, cover modifiers,
 * damage variance, grid size and escape tuning.
 *
 * Defaults match the shipped /data/combat.yaml. Any subset of keys can be
 * overridden from a YAML document with a top-level {@code combat:} map.
 */
public final class CombatRules {

    private static final Logger logger = LoggerFactory.getLogger(CombatRules.class);

    /** Resource path of the bundled rules file */
    public static final String DEFAULT_RESOURCE = "/data/combat.yaml";

    /** Every key understood under the {@code combat:} map */
    public static final Set<String> KNOWN_KEYS = Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(
        "max_action_points", "ap_move", "ap_attack", "ap_take_cover", "base_movement_range",
        "dodge_cap", "cover_half_penalty", "cover_full_penalty",
        "cover_half_damage_factor", "cover_full_damage_factor",
        "damage_variance_min", "damage_variance_max", "armor_reduction_multiplier",
        "grid_width", "grid_height",
        "escape_min_round", "escape_sacrifice_chance", "escape_base_chance",
        "escape_failure_damage_fraction", "escape_morale_penalty",
        "morale_loss_heavy", "morale_loss_light")));

    private final int maxActionPoints;
    private final int apMove;
    private final int apAttack;
    private final int apTakeCover;
    private final int baseMovementRange;
    private final int dodgeCap;
    private final int coverHalfPenalty;
    private final int coverFullPenalty;
    private final double coverHalfDamageFactor;
    private final double coverFullDamageFactor;
    private final double damageVarianceMin;
    private final double damageVarianceMax;
    private final double armorReductionMultiplier;
    private final int gridWidth;
    private final int gridHeight;
    private final int escapeMinRound;
    private final int escapeSacrificeChance;
    private final int escapeBaseChance;
    private final double escapeFailureDamageFraction;
    private final int escapeMoralePenalty;
    private final int moraleLossHeavy;
    private final int moraleLossLight;

    private CombatRules(Map<String, ?> values) {
        for (String key : values.keySet()) {
            if (!KNOWN_KEYS.contains(key)) {
                logger.warn("[CombatRules] Ignoring unknown key: {}", key);
            }
        }
        this.maxActionPoints = intValue(values, "max_action_points", 3);
        this.apMove = intValue(values, "ap_move", 1);
        this.apAttack = intValue(values, "ap_attack", 2);
        this.apTakeCover = intValue(values, "ap_take_cover", 1);
        this.baseMovementRange = intValue(values, "base_movement_range", 4);
        this.dodgeCap = intValue(values, "dodge_cap", 20);
        this.coverHalfPenalty = intValue(values, "cover_half_penalty", 25);
        this.coverFullPenalty = intValue(values, "cover_full_penalty", 40);
        this.coverHalfDamageFactor = doubleValue(values, "cover_half_damage_factor", 0.75);
        this.coverFullDamageFactor = doubleValue(values, "cover_full_damage_factor", 0.60);
        this.damageVarianceMin = doubleValue(values, "damage_variance_min", 0.85);
        this.damageVarianceMax = doubleValue(values, "damage_variance_max", 1.15);
        this.armorReductionMultiplier = doubleValue(values, "armor_reduction_multiplier", 1.0);
        this.gridWidth = intValue(values, "grid_width", 20);
        this.gridHeight = intValue(values, "grid_height", 15);
        this.escapeMinRound = intValue(values, "escape_min_round", 3);
        this.escapeSacrificeChance = intValue(values, "escape_sacrifice_chance", 93);
        this.escapeBaseChance = intValue(values, "escape_base_chance", 45);
        this.escapeFailureDamageFraction = doubleValue(values, "escape_failure_damage_fraction", 0.2);
        this.escapeMoralePenalty = intValue(values, "escape_morale_penalty", 20);
        this.moraleLossHeavy = intValue(values, "morale_loss_heavy", 20);
        this.moraleLossLight = intValue(values, "morale_loss_light", 10);

        if (maxActionPoints <= 0 || apMove < 0 || apAttack < 0 || apTakeCover < 0) {
            throw new IllegalStateException("Action point settings must be non-negative with a positive maximum");
        }
        if (gridWidth <= 0 || gridHeight <= 0) {
            throw new IllegalStateException("Grid dimensions must be positive");
        }
        if (damageVarianceMax < damageVarianceMin) {
            throw new IllegalStateException("damage_variance_max must not be below damage_variance_min");
        }
    }

    /**
     * Rules with every value at its default.
     */
    public static CombatRules defaults() {
        return new CombatRules(Collections.emptyMap());
    }

    /**
     * Rules with the given keys overridden. Unknown keys are ignored.
     */
    public static CombatRules fromMap(Map<String, ?> overrides) {
        if (overrides == null) return defaults();
        return new CombatRules(overrides);
    }

    /**
     * Load rules from a classpath YAML resource. A missing resource yields the defaults.
     *
     * @throws IllegalStateException if the document cannot be parsed
     */
    public static CombatRules fromYamlResource(String resourcePath) {
        try (InputStream is = CombatRules.class.getResourceAsStream(resourcePath)) {
            if (is == null) {
                logger.warn("[CombatRules] Resource not found: {}, using defaults", resourcePath);
                return defaults();
            }
            return fromYaml(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read combat rules from " + resourcePath, e);
        }
    }

    /**
     * Load rules from a YAML stream.
     *
     * @throws IllegalStateException if the document is malformed
     */
    public static CombatRules fromYaml(InputStream in) {
        Map<String, Object> data;
        try {
            data = new Yaml().load(in);
        } catch (YAMLException | ClassCastException e) {
            throw new IllegalStateException("Malformed combat rules document", e);
        }
        if (data == null || !data.containsKey("combat")) {
            logger.warn("[CombatRules] No 'combat' section found, using defaults");
            return defaults();
        }
        Object section = data.get("combat");
        if (!(section instanceof Map)) {
            throw new IllegalStateException("'combat' section must be a map");
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> values = (Map<String, Object>) section;
        CombatRules rules = new CombatRules(values);
        logger.debug("[CombatRules] Loaded {} overrides", values.size());
        return rules;
    }

    private static int intValue(Map<String, ?> values, String key, int fallback) {
        Object raw = values.get(key);
        if (raw == null) return fallback;
        if (raw instanceof Number) return ((Number) raw).intValue();
        try {
            return Integer.parseInt(raw.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Combat rule '" + key + "' is not an integer: " + raw, e);
        }
    }

    private static double doubleValue(Map<String, ?> values, String key, double fallback) {
        Object raw = values.get(key);
        if (raw == null) return fallback;
        if (raw instanceof Number) return ((Number) raw).doubleValue();
        try {
            return Double.parseDouble(raw.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Combat rule '" + key + "' is not a number: " + raw, e);
        }
    }

    // Action points

    public int getMaxActionPoints() { return maxActionPoints; }
    public int getApMove() { return apMove; }
    public int getApAttack() { return apAttack; }
    public int getApTakeCover() { return apTakeCover; }

    // Movement and grid

    public int getBaseMovementRange() { return baseMovementRange; }
    public int getGridWidth() { return gridWidth; }
    public int getGridHeight() { return gridHeight; }

    // Hit and damage

    public int getDodgeCap() { return dodgeCap; }
    public int getCoverHalfPenalty() { return coverHalfPenalty; }
    public int getCoverFullPenalty() { return coverFullPenalty; }
    public double getCoverHalfDamageFactor() { return coverHalfDamageFactor; }
    public double getCoverFullDamageFactor() { return coverFullDamageFactor; }
    public double getDamageVarianceMin() { return damageVarianceMin; }
    public double getDamageVarianceMax() { return damageVarianceMax; }
    public double getArmorReductionMultiplier() { return armorReductionMultiplier; }

    // Escape

    public int getEscapeMinRound() { return escapeMinRound; }
    public int getEscapeSacrificeChance() { return escapeSacrificeChance; }
    public int getEscapeBaseChance() { return escapeBaseChance; }
    public double getEscapeFailureDamageFraction() { return escapeFailureDamageFraction; }
    public int getEscapeMoralePenalty() { return escapeMoralePenalty; }

    // Morale

    public int getMoraleLossHeavy() { return moraleLossHeavy; }
    public int getMoraleLossLight() { return moraleLossLight; }

    public boolean isInBounds(int x, int y) {
        return x >= 0 && x < gridWidth && y >= 0 && y < gridHeight;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CombatRules)) return false;
        CombatRules other = (CombatRules) o;
        return maxActionPoints == other.maxActionPoints
            && apMove == other.apMove
            && apAttack == other.apAttack
            && apTakeCover == other.apTakeCover
            && baseMovementRange == other.baseMovementRange
            && dodgeCap == other.dodgeCap
            && coverHalfPenalty == other.coverHalfPenalty
            && coverFullPenalty == other.coverFullPenalty
            && Double.compare(coverHalfDamageFactor, other.coverHalfDamageFactor) == 0
            && Double.compare(coverFullDamageFactor, other.coverFullDamageFactor) == 0
            && Double.compare(damageVarianceMin, other.damageVarianceMin) == 0
            && Double.compare(damageVarianceMax, other.damageVarianceMax) == 0
            && Double.compare(armorReductionMultiplier, other.armorReductionMultiplier) == 0
            && gridWidth == other.gridWidth
            && gridHeight == other.gridHeight
            && escapeMinRound == other.escapeMinRound
            && escapeSacrificeChance == other.escapeSacrificeChance
            && escapeBaseChance == other.escapeBaseChance
            && Double.compare(escapeFailureDamageFraction, other.escapeFailureDamageFraction) == 0
            && escapeMoralePenalty == other.escapeMoralePenalty
            && moraleLossHeavy == other.moraleLossHeavy
            && moraleLossLight == other.moraleLossLight;
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxActionPoints, apMove, apAttack, apTakeCover, baseMovementRange,
            dodgeCap, coverHalfPenalty, coverFullPenalty, coverHalfDamageFactor, coverFullDamageFactor,
            damageVarianceMin, damageVarianceMax, armorReductionMultiplier, gridWidth, gridHeight,
            escapeMinRound, escapeSacrificeChance, escapeBaseChance, escapeFailureDamageFraction,
            escapeMoralePenalty, moraleLossHeavy, moraleLossLight);
    }
}
