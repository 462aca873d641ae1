package com.rpgcore.game_state;

/**
 * Шесть характеристик D&D 5e
 */
public enum Ability {
    STRENGTH("strength", "STR"),
    DEXTERITY("dexterity", "DEX"),
    CONSTITUTION("constitution", "CON"),
    INTELLIGENCE("intelligence", "INT"),
    WISDOM("wisdom", "WIS"),
    CHARISMA("charisma", "CHA");

    private final String value;
    private final String shortName;

    Ability(String value, String shortName) {
        this.value = value;
        this.shortName = shortName;
    }

    public String getValue() {
        return value;
    }

    public String getShortName() {
        return shortName;
    }

    /**
     * Принимает полное имя ("dexterity") или сокращение ("dex"), регистр не важен
     */
    public static Ability fromString(String value) {
        Ability ability = find(value);
        if (ability == null) {
            throw new IllegalArgumentException("Unknown ability: " + value);
        }
        return ability;
    }

    public static Ability find(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase();
        for (Ability ability : values()) {
            if (ability.value.equals(normalized) || ability.shortName.equalsIgnoreCase(normalized)) {
                return ability;
            }
        }
        return null;
    }
}
