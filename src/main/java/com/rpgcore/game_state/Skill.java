package com.rpgcore.game_state;

/**
 * Навыки SRD и их базовые характеристики
 */
public enum Skill {
    ACROBATICS("acrobatics", Ability.DEXTERITY),
    ANIMAL_HANDLING("animal handling", Ability.WISDOM),
    ARCANA("arcana", Ability.INTELLIGENCE),
    ATHLETICS("athletics", Ability.STRENGTH),
    DECEPTION("deception", Ability.CHARISMA),
    HISTORY("history", Ability.INTELLIGENCE),
    INSIGHT("insight", Ability.WISDOM),
    INTIMIDATION("intimidation", Ability.CHARISMA),
    INVESTIGATION("investigation", Ability.INTELLIGENCE),
    MEDICINE("medicine", Ability.WISDOM),
    NATURE("nature", Ability.INTELLIGENCE),
    PERCEPTION("perception", Ability.WISDOM),
    PERFORMANCE("performance", Ability.CHARISMA),
    PERSUASION("persuasion", Ability.CHARISMA),
    RELIGION("religion", Ability.INTELLIGENCE),
    SLEIGHT_OF_HAND("sleight of hand", Ability.DEXTERITY),
    STEALTH("stealth", Ability.DEXTERITY),
    SURVIVAL("survival", Ability.WISDOM);

    private final String value;
    private final Ability ability;

    Skill(String value, Ability ability) {
        this.value = value;
        this.ability = ability;
    }

    public String getValue() {
        return value;
    }

    public Ability getAbility() {
        return ability;
    }

    public String getDisplayName() {
        StringBuilder sb = new StringBuilder();
        for (String word : value.split(" ")) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(word.equals("of") ? word : java.lang.Character.toUpperCase(word.charAt(0)) + word.substring(1));
        }
        return sb.toString();
    }

    /**
     * "Sleight of Hand", "sleight_of_hand" и "sleight-of-hand" дают один и тот же навык.
     * Возвращает null для неизвестного навыка.
     */
    public static Skill find(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase().replace('_', ' ').replace('-', ' ');
        for (Skill skill : values()) {
            if (skill.value.equals(normalized)) {
                return skill;
            }
        }
        return null;
    }

    public static Skill fromString(String value) {
        Skill skill = find(value);
        if (skill == null) {
            throw new IllegalArgumentException("Unknown skill: " + value);
        }
        return skill;
    }
}
