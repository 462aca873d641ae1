package com.rpgcore.game_state;

/**
 * Отношение NPC к игроку
 */
public enum Disposition {
    HOSTILE("hostile"),
    NEUTRAL("neutral"),
    FRIENDLY("friendly");

    private final String value;

    Disposition(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Disposition fromString(String value) {
        for (Disposition disposition : values()) {
            if (disposition.value.equalsIgnoreCase(value)) {
                return disposition;
            }
        }
        throw new IllegalArgumentException("Unknown disposition: " + value);
    }
}
