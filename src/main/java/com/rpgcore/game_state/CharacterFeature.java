package com.rpgcore.game_state;

/**
 * Классовое или расовое умение персонажа
 */
public class CharacterFeature {
    private String name;
    private int level;
    private GameplayEffect effect;
    private String chosenOption;

    public CharacterFeature(String name, int level) {
        this(name, level, null, null);
    }

    public CharacterFeature(String name, int level, GameplayEffect effect) {
        this(name, level, effect, null);
    }

    public CharacterFeature(String name, int level, GameplayEffect effect, String chosenOption) {
        this.name = name;
        this.level = level;
        this.effect = effect;
        this.chosenOption = chosenOption;
    }

    public boolean isNamed(String other) {
        return name != null && other != null && name.equalsIgnoreCase(other.trim());
    }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public int getLevel() { return level; }
    public void setLevel(int level) { this.level = level; }

    public GameplayEffect getEffect() { return effect; }
    public void setEffect(GameplayEffect effect) { this.effect = effect; }

    public String getChosenOption() { return chosenOption; }
    public void setChosenOption(String chosenOption) { this.chosenOption = chosenOption; }
}
