package com.rpgcore.intents;

/**
 * Дополнительные источники урона, которые классификатор может заявить для атаки.
 * Каждый проверяется резолвером по умениям и состояниям персонажа.
 */
public enum ExtraDamageSource {
    SNEAK_ATTACK("Sneak Attack"),
    DIVINE_SMITE("Divine Smite"),
    ELDRITCH_SMITE("Eldritch Smite"),
    COLOSSUS_SLAYER("Colossus Slayer"),
    DREAD_AMBUSHER("Dread Ambusher"),
    GREAT_WEAPON_MASTER("Great Weapon Master"),
    RAGE("Rage"),
    HUNTERS_MARK("Hunter's Mark"),
    HEX("Hex");

    private final String label;

    ExtraDamageSource(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Ищет источник по метке без учёта регистра и апострофов ("hunters mark", "GWM"); null если не найден
     */
    public static ExtraDamageSource find(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = normalize(raw);
        if (normalized.equals("gwm")) {
            return GREAT_WEAPON_MASTER;
        }
        for (ExtraDamageSource source : values()) {
            String label = normalize(source.label);
            if (normalized.equals(label) || normalized.startsWith(label + " ")
                || normalized.equals(source.name().toLowerCase().replace('_', ' '))) {
                return source;
            }
        }
        return null;
    }

    private static String normalize(String raw) {
        return raw.toLowerCase().replace("'", "").replace('_', ' ').replace('-', ' ').trim().replaceAll("\\s+", " ");
    }
}
