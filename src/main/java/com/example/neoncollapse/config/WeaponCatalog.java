package com.example.neoncollapse.config;

import com.example.neoncollapse.model.Weapon;
import com.example.neoncollapse.model.WeaponClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Named weapon definitions, loaded from a YAML resource with a top-level
 * {@code weapons:} list.
 */
public final class WeaponCatalog {

    private static final Logger logger = LoggerFactory.getLogger(WeaponCatalog.class);

    public static final String DEFAULT_RESOURCE = "/data/weapons.yaml";

    private final Map<String, Weapon> weapons;

    private WeaponCatalog(Map<String, Weapon> weapons) {
        this.weapons = Collections.unmodifiableMap(weapons);
    }

    /**
     * Load the catalog from a classpath resource. A missing resource yields an empty catalog.
     */
    public static WeaponCatalog fromYamlResource(String resourcePath) {
        try (InputStream is = WeaponCatalog.class.getResourceAsStream(resourcePath)) {
            if (is == null) {
                logger.warn("[WeaponCatalog] Resource not found: {}", resourcePath);
                return new WeaponCatalog(new LinkedHashMap<>());
            }
            return fromYaml(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read weapons from " + resourcePath, e);
        }
    }

    /**
     * Load the catalog from a YAML stream.
     *
     * @throws IllegalStateException if the document or an entry is malformed
     */
    public static WeaponCatalog fromYaml(InputStream in) {
        Map<String, Object> data;
        try {
            data = new Yaml().load(in);
        } catch (YAMLException | ClassCastException e) {
            throw new IllegalStateException("Malformed weapon document", e);
        }
        Map<String, Weapon> weapons = new LinkedHashMap<>();
        if (data == null || !data.containsKey("weapons")) {
            logger.warn("[WeaponCatalog] No 'weapons' section found");
            return new WeaponCatalog(weapons);
        }

        Object section = data.get("weapons");
        if (!(section instanceof List)) {
            throw new IllegalStateException("'weapons' section must be a list");
        }
        for (Object item : (List<?>) section) {
            if (!(item instanceof Map)) {
                throw new IllegalStateException("Weapon entry must be a map: " + item);
            }
            @SuppressWarnings("unchecked")
            Map<String, Object> entry = (Map<String, Object>) item;
            Weapon weapon = parseWeapon(entry);
            if (weapons.put(weapon.getId(), weapon) != null) {
                throw new IllegalStateException("Duplicate weapon id: " + weapon.getId());
            }
        }
        logger.debug("[WeaponCatalog] Loaded {} weapons", weapons.size());
        return new WeaponCatalog(weapons);
    }

    private static Weapon parseWeapon(Map<String, Object> entry) {
        String id = str(entry.get("id"));
        WeaponClass weaponClass = WeaponClass.fromString(str(entry.get("type")));
        if (weaponClass == null) {
            throw new IllegalStateException("Weapon " + id + " has unknown type: " + entry.get("type"));
        }
        try {
            return new Weapon(
                id,
                str(entry.get("name")),
                parseInt(entry.get("damage")),
                parseInt(entry.get("accuracy")),
                parseInt(entry.get("range")),
                parseDouble(entry.get("armor_pen")),
                entry.containsKey("crit_multiplier") ? parseDouble(entry.get("crit_multiplier")) : 1.0,
                weaponClass);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid weapon entry " + id + ": " + e.getMessage(), e);
        }
    }

    private static String str(Object o) {
        return o == null ? null : o.toString();
    }

    private static int parseInt(Object o) {
        if (o == null) return 0;
        if (o instanceof Number) return ((Number) o).intValue();
        return Integer.parseInt(o.toString().trim());
    }

    private static double parseDouble(Object o) {
        if (o == null) return 0.0;
        if (o instanceof Number) return ((Number) o).doubleValue();
        return Double.parseDouble(o.toString().trim());
    }

    /**
     * Look up a weapon by id.
     *
     * @throws IllegalArgumentException if no such weapon exists
     */
    public Weapon get(String id) {
        Weapon weapon = weapons.get(id);
        if (weapon == null) {
            throw new IllegalArgumentException("Unknown weapon: " + id);
        }
        return weapon;
    }

    public boolean contains(String id) {
        return weapons.containsKey(id);
    }

    public Collection<Weapon> getAll() {
        return weapons.values();
    }

    public int size() {
        return weapons.size();
    }
}
