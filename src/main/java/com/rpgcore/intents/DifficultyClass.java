package com.rpgcore.intents;

/**
 * Таблица сложностей проверок (DC)
 */
public enum DifficultyClass {
    VERY_EASY("very_easy", 5),
    EASY("easy", 10),
    MEDIUM("medium", 15),
    HARD("hard", 20),
    VERY_HARD("very_hard", 25),
    NEARLY_IMPOSSIBLE("nearly_impossible", 30);

    private final String label;
    private final int dc;

    DifficultyClass(String label, int dc) {
        this.label = label;
        this.dc = dc;
    }

    public String getLabel() { return label; }
    public int getDc() { return dc; }

    public static DifficultyClass find(String label) {
        if (label == null) {
            return null;
        }
        String normalized = label.trim().toLowerCase().replace(' ', '_').replace('-', '_');
        for (DifficultyClass difficulty : values()) {
            if (difficulty.label.equals(normalized)) {
                return difficulty;
            }
        }
        return null;
    }
}
