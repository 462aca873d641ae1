package com.rpgcore.game_state;

public enum EncounterStatus {
    ACTIVE("active"),
    COMPLETED("completed");

    private final String value;

    EncounterStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
