package com.rpgcore.game_state;

/**
 * Классы персонажей D&D 5e
 */
public enum CharacterClass {
    BARBARIAN("barbarian", 12, null),
    BARD("bard", 8, Ability.CHARISMA),
    CLERIC("cleric", 8, Ability.WISDOM),
    DRUID("druid", 8, Ability.WISDOM),
    FIGHTER("fighter", 10, null),
    MONK("monk", 8, Ability.WISDOM),
    PALADIN("paladin", 10, Ability.CHARISMA),
    RANGER("ranger", 10, Ability.WISDOM),
    ROGUE("rogue", 8, null),
    SORCERER("sorcerer", 6, Ability.CHARISMA),
    WARLOCK("warlock", 8, Ability.CHARISMA),
    WIZARD("wizard", 6, Ability.INTELLIGENCE);

    private final String value;
    private final int hitDie;
    private final Ability spellcastingAbility;

    CharacterClass(String value, int hitDie, Ability spellcastingAbility) {
        this.value = value;
        this.hitDie = hitDie;
        this.spellcastingAbility = spellcastingAbility;
    }

    public String getValue() {
        return value;
    }

    public int getHitDie() {
        return hitDie;
    }

    /**
     * null для классов без заклинаний
     */
    public Ability getSpellcastingAbility() {
        return spellcastingAbility;
    }

    public static CharacterClass fromString(String value) {
        for (CharacterClass cc : CharacterClass.values()) {
            if (cc.value.equalsIgnoreCase(value)) {
                return cc;
            }
        }
        throw new IllegalArgumentException("Unknown character class: " + value);
    }
}
