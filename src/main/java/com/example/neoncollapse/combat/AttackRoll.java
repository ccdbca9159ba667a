package com.example.neoncollapse.combat;

/**
 * Outcome of one attack resolution: the hit check and, on a hit, the damage.
 */
public final class AttackRoll {

    private final int hitChance;
    private final int roll;
    private final boolean hit;
    private final boolean critical;
    private final int damage;

    private AttackRoll(int hitChance, int roll, boolean hit, boolean critical, int damage) {
        this.hitChance = hitChance;
        this.roll = roll;
        this.hit = hit;
        this.critical = critical;
        this.damage = damage;
    }

    static AttackRoll miss(int hitChance, int roll) {
        return new AttackRoll(hitChance, roll, false, false, 0);
    }

    static AttackRoll hit(int hitChance, int roll, int damage, boolean critical) {
        return new AttackRoll(hitChance, roll, true, critical, damage);
    }

    public int getHitChance() { return hitChance; }
    public int getRoll() { return roll; }
    public boolean isHit() { return hit; }
    public boolean isCritical() { return critical; }
    public int getDamage() { return damage; }

    @Override
    public String toString() {
        return hit
            ? String.format("AttackRoll[hit %d<=%d, damage=%d%s]", roll, hitChance, damage, critical ? ", crit" : "")
            : String.format("AttackRoll[miss %d>%d]", roll, hitChance);
    }
}
