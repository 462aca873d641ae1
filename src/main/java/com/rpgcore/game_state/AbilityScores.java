package com.rpgcore.game_state;

/**
 * Характеристики персонажа D&D 5e
 */
public class AbilityScores {
    public static final int MAX_SCORE = 30;

    private int strength = 10;
    private int dexterity = 10;
    private int constitution = 10;
    private int intelligence = 10;
    private int wisdom = 10;
    private int charisma = 10;

    public AbilityScores() {
    }

    public AbilityScores(int strength, int dexterity, int constitution,
                        int intelligence, int wisdom, int charisma) {
        this.strength = strength;
        this.dexterity = dexterity;
        this.constitution = constitution;
        this.intelligence = intelligence;
        this.wisdom = wisdom;
        this.charisma = charisma;
    }

    public AbilityScores copy() {
        return new AbilityScores(strength, dexterity, constitution, intelligence, wisdom, charisma);
    }

    public static int modifierFor(int score) {
        return Math.floorDiv(score - 10, 2);
    }

    public int getModifier(Ability ability) {
        return modifierFor(getScore(ability));
    }

    public int getScore(Ability ability) {
        return switch (ability) {
            case STRENGTH -> strength;
            case DEXTERITY -> dexterity;
            case CONSTITUTION -> constitution;
            case INTELLIGENCE -> intelligence;
            case WISDOM -> wisdom;
            case CHARISMA -> charisma;
        };
    }

    public void setScore(Ability ability, int score) {
        switch (ability) {
            case STRENGTH -> strength = score;
            case DEXTERITY -> dexterity = score;
            case CONSTITUTION -> constitution = score;
            case INTELLIGENCE -> intelligence = score;
            case WISDOM -> wisdom = score;
            case CHARISMA -> charisma = score;
        }
    }

    /**
     * Постоянный бонус к характеристике (Primal Champion и т.п.), не выше 30
     */
    public void addBonus(Ability ability, int bonus) {
        setScore(ability, Math.min(MAX_SCORE, getScore(ability) + bonus));
    }

    // Getters and Setters
    public int getStrength() { return strength; }
    public void setStrength(int strength) { this.strength = strength; }

    public int getDexterity() { return dexterity; }
    public void setDexterity(int dexterity) { this.dexterity = dexterity; }

    public int getConstitution() { return constitution; }
    public void setConstitution(int constitution) { this.constitution = constitution; }

    public int getIntelligence() { return intelligence; }
    public void setIntelligence(int intelligence) { this.intelligence = intelligence; }

    public int getWisdom() { return wisdom; }
    public void setWisdom(int wisdom) { this.wisdom = wisdom; }

    public int getCharisma() { return charisma; }
    public void setCharisma(int charisma) { this.charisma = charisma; }
}
