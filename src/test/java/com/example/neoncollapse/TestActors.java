package com.example.neoncollapse;

import com.example.neoncollapse.combat.CombatActor;
import com.example.neoncollapse.config.CombatRules;
import com.example.neoncollapse.model.Attributes;
import com.example.neoncollapse.model.GridPosition;
import com.example.neoncollapse.model.Team;
import com.example.neoncollapse.model.Weapon;
import com.example.neoncollapse.model.WeaponClass;

/**
 * Shared actor and weapon fixtures for combat tests.
 */
public final class TestActors {

    public static final Weapon PISTOL =
        new Weapon("pistol", "Pistol", 25, 90, 10, 0.1, 2.0, WeaponClass.RANGED);
    public static final Weapon KATANA =
        new Weapon("katana", "Katana", 35, 95, 1, 0.2, 2.5, WeaponClass.MELEE);
    public static final Weapon MONOWIRE =
        new Weapon("monowire", "Monowire", 28, 80, 3, 0.3, 2.0, WeaponClass.TECH);

    private TestActors() {}

    public static Attributes attrs(int body, int reflexes, int cool) {
        return new Attributes(body, reflexes, 4, 4, cool);
    }

    public static CombatActor player(String name, int x, int y) {
        return new CombatActor(name, Team.PLAYER, new GridPosition(x, y), attrs(5, 6, 5), 150, 15, PISTOL);
    }

    public static CombatActor opponent(String name, int x, int y) {
        return new CombatActor(name, Team.OPPONENT, new GridPosition(x, y), attrs(4, 4, 3), 80, 15, PISTOL);
    }

    public static CombatActor actor(String name, Team team, int x, int y, int reflexes, Weapon weapon) {
        return new CombatActor(name, team, new GridPosition(x, y), attrs(5, reflexes, 5), 100, 0, weapon);
    }

    public static CombatActor actor(String name, Team team, int x, int y, int reflexes, Weapon weapon,
                                    CombatRules rules) {
        return new CombatActor(name, team, new GridPosition(x, y), attrs(5, reflexes, 5), 100, 0, weapon, rules);
    }
}
