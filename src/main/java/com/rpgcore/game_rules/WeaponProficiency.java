package com.rpgcore.game_rules;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Владение оружием по списку персонажа: точное имя, категории "simple weapons" /
 * "martial weapons" или вхождение ("longswords" покрывает "longsword")
 */
public final class WeaponProficiency {

    public static final Set<String> SIMPLE_WEAPONS = Set.of(
        "club", "dagger", "greatclub", "handaxe", "javelin", "light hammer", "mace",
        "quarterstaff", "sickle", "spear", "light crossbow", "dart", "shortbow", "sling");

    public static final Set<String> MARTIAL_WEAPONS = Set.of(
        "battleaxe", "flail", "glaive", "greataxe", "greatsword", "halberd", "lance",
        "longsword", "maul", "morningstar", "pike", "rapier", "scimitar", "shortsword",
        "trident", "war pick", "warhammer", "whip", "blowgun", "hand crossbow",
        "heavy crossbow", "longbow", "net");

    private WeaponProficiency() {
    }

    public static boolean isProficient(String weaponName, List<String> proficiencies) {
        if (weaponName == null || proficiencies == null || proficiencies.isEmpty()) {
            return false;
        }
        String weapon = baseName(weaponName);
        for (String raw : proficiencies) {
            if (raw == null || raw.isBlank()) {
                continue;
            }
            String prof = raw.trim().toLowerCase(Locale.ROOT);
            if (prof.equals(weapon)
                || prof.equals("simple weapons") && SIMPLE_WEAPONS.contains(weapon)
                || prof.equals("martial weapons") && MARTIAL_WEAPONS.contains(weapon)) {
                return true;
            }
            if (!prof.endsWith(" weapons") && (prof.contains(weapon) || weapon.contains(prof))) {
                return true;
            }
        }
        return false;
    }

    /** "Longsword +1" → "longsword" */
    static String baseName(String weaponName) {
        return weaponName.toLowerCase(Locale.ROOT).replaceAll("\\s*\\+\\d+\\s*$", "").trim();
    }
}
