package com.example.neoncollapse.model;

/**
 * An equipped weapon. Immutable; several actors may share one instance.
 */
public final class Weapon {

    private final String id;
    private final String name;
    private final int damage;
    private final int accuracy;
    private final int range;
    /** Fraction of the defender's armor ignored (0.0-1.0) */
    private final double armorPenetration;
    private final double critMultiplier;
    private final WeaponClass weaponClass;

    public Weapon(String id, String name, int damage, int accuracy, int range,
                  double armorPenetration, double critMultiplier, WeaponClass weaponClass) {
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("Weapon id is required");
        }
        if (weaponClass == null) {
            throw new IllegalArgumentException("Weapon class is required for " + id);
        }
        if (damage < 0 || range < 0) {
            throw new IllegalArgumentException("Weapon " + id + " has negative damage or range");
        }
        if (armorPenetration < 0.0 || armorPenetration > 1.0) {
            throw new IllegalArgumentException("Armor penetration of " + id + " must be within 0.0-1.0");
        }
        if (critMultiplier < 1.0) {
            throw new IllegalArgumentException("Crit multiplier of " + id + " must be at least 1.0");
        }
        this.id = id;
        this.name = name != null ? name : id;
        this.damage = damage;
        this.accuracy = accuracy;
        this.range = range;
        this.armorPenetration = armorPenetration;
        this.critMultiplier = critMultiplier;
        this.weaponClass = weaponClass;
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public int getDamage() { return damage; }
    public int getAccuracy() { return accuracy; }
    public int getRange() { return range; }
    public double getArmorPenetration() { return armorPenetration; }
    public double getCritMultiplier() { return critMultiplier; }
    public WeaponClass getWeaponClass() { return weaponClass; }

    public boolean isMelee() { return weaponClass == WeaponClass.MELEE; }

    public boolean isTech() { return weaponClass == WeaponClass.TECH; }

    @Override
    public String toString() {
        return String.format("Weapon[%s dmg=%d acc=%d rng=%d pen=%.2f crit=x%.1f %s]",
            id, damage, accuracy, range, armorPenetration, critMultiplier, weaponClass);
    }
}
