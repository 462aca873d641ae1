package com.rpgcore.game_state;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Персонаж игрока D&D 5e. Производные боевые значения здесь не хранятся:
 * их каждый раз пересчитывает EffectAggregator.
 */
public class Character {
    /** Опыт, необходимый для каждого уровня (индекс 0 = уровень 1) */
    public static final int[] XP_THRESHOLDS = {
        0, 300, 900, 2700, 6500, 14000, 23000, 34000, 48000, 64000,
        85000, 100000, 120000, 140000, 165000, 195000, 225000, 265000, 305000, 355000
    };

    private String id;
    private String name;
    private CharacterClass characterClass;
    private int level = 1;
    private int xp = 0;
    private int pendingLevel = 0;
    private AbilityScores abilityScores;
    private int currentHitPoints;
    private int maxHitPoints;
    private int baseArmorClass = 10;
    private int baseSpeed = 30;
    private Ability spellcastingAbility;
    private Set<Ability> savingThrowProficiencies = new LinkedHashSet<>();
    private Set<Skill> skillProficiencies = new LinkedHashSet<>();
    private List<String> weaponProficiencies = new ArrayList<>();
    private List<CharacterFeature> features = new ArrayList<>();
    private Set<Condition> conditions = new LinkedHashSet<>();
    private List<CombatAbility> abilities = new ArrayList<>();
    private List<String> inventory = new ArrayList<>();
    private int gold = 0;
    private Map<String, Integer> spellSlotsUsed = new HashMap<>();

    // для десериализации
    private Character() {
        this.abilityScores = new AbilityScores();
    }

    public Character(String id, String name, CharacterClass characterClass) {
        this(id, name, characterClass, 1, new AbilityScores());
    }

    public Character(String id, String name, CharacterClass characterClass,
                     int level, AbilityScores abilityScores) {
        this.id = id;
        this.name = name;
        this.characterClass = characterClass;
        this.level = level;
        this.abilityScores = abilityScores;
        initializeHitPoints();
    }

    private void initializeHitPoints() {
        int hitDie = characterClass != null ? characterClass.getHitDie() : 8;
        int conMod = abilityScores.getModifier(Ability.CONSTITUTION);
        // Максимум на первом уровне, затем среднее значение кости
        int perLevel = hitDie / 2 + 1 + conMod;
        maxHitPoints = Math.max(1, hitDie + conMod + (level - 1) * Math.max(1, perLevel));
        currentHitPoints = maxHitPoints;
    }

    /**
     * Глубокая копия для пакетного применения изменений хода
     */
    public Character copy() {
        Character copy = new Character(id, name, characterClass, level, abilityScores.copy());
        copy.xp = xp;
        copy.pendingLevel = pendingLevel;
        copy.currentHitPoints = currentHitPoints;
        copy.maxHitPoints = maxHitPoints;
        copy.baseArmorClass = baseArmorClass;
        copy.baseSpeed = baseSpeed;
        copy.spellcastingAbility = spellcastingAbility;
        copy.savingThrowProficiencies = new LinkedHashSet<>(savingThrowProficiencies);
        copy.skillProficiencies = new LinkedHashSet<>(skillProficiencies);
        copy.weaponProficiencies = new ArrayList<>(weaponProficiencies);
        copy.features = new ArrayList<>();
        for (CharacterFeature f : features) {
            copy.features.add(new CharacterFeature(f.getName(), f.getLevel(), f.getEffect(), f.getChosenOption()));
        }
        copy.conditions = new LinkedHashSet<>(conditions);
        copy.abilities = new ArrayList<>(abilities);
        copy.inventory = new ArrayList<>(inventory);
        copy.gold = gold;
        copy.spellSlotsUsed = new HashMap<>(spellSlotsUsed);
        return copy;
    }

    /**
     * Переносит состояние из рабочей копии после успешного применения пакета
     */
    public void restoreFrom(Character other) {
        this.level = other.level;
        this.xp = other.xp;
        this.pendingLevel = other.pendingLevel;
        this.abilityScores = other.abilityScores;
        this.currentHitPoints = other.currentHitPoints;
        this.maxHitPoints = other.maxHitPoints;
        this.baseArmorClass = other.baseArmorClass;
        this.baseSpeed = other.baseSpeed;
        this.spellcastingAbility = other.spellcastingAbility;
        this.savingThrowProficiencies = other.savingThrowProficiencies;
        this.skillProficiencies = other.skillProficiencies;
        this.weaponProficiencies = other.weaponProficiencies;
        this.features = other.features;
        this.conditions = other.conditions;
        this.abilities = other.abilities;
        this.inventory = other.inventory;
        this.gold = other.gold;
        this.spellSlotsUsed = other.spellSlotsUsed;
    }

    public int getProficiencyBonus() {
        return 2 + (level - 1) / 4;
    }

    public int applyHpDelta(int delta) {
        long raw = (long) currentHitPoints + delta;
        currentHitPoints = (int) Math.max(0, Math.min(maxHitPoints, raw));
        return currentHitPoints;
    }

    public Ability getEffectiveSpellcastingAbility() {
        if (spellcastingAbility != null) {
            return spellcastingAbility;
        }
        if (characterClass != null && characterClass.getSpellcastingAbility() != null) {
            return characterClass.getSpellcastingAbility();
        }
        return Ability.INTELLIGENCE;
    }

    public CharacterFeature findFeature(String featureName) {
        return features.stream()
            .filter(f -> f.isNamed(featureName))
            .findFirst()
            .orElse(null);
    }

    public boolean hasFeature(String featureName) {
        return findFeature(featureName) != null;
    }

    /**
     * Поиск способности по id или имени; имя сравнивается без учёта регистра,
     * в обе стороны по вхождению ("sword" найдёт "Longsword")
     */
    public CombatAbility findAbility(String nameOrId) {
        if (nameOrId == null || nameOrId.isBlank()) {
            return null;
        }
        String needle = nameOrId.trim().toLowerCase();
        for (CombatAbility ability : abilities) {
            if (needle.equals(ability.getId()) || needle.equals(ability.getName().toLowerCase())) {
                return ability;
            }
        }
        for (CombatAbility ability : abilities) {
            String name = ability.getName().toLowerCase();
            if (name.contains(needle) || needle.contains(name)) {
                return ability;
            }
        }
        return null;
    }

    public void addCondition(Condition condition) {
        conditions.add(condition);
    }

    public void removeCondition(Condition condition) {
        conditions.remove(condition);
    }

    public boolean hasCondition(Condition condition) {
        return conditions.contains(condition);
    }

    /**
     * Начисляет опыт и отмечает ожидающее повышение уровня. Возвращает новый уровень по опыту.
     */
    public int gainXp(int amount) {
        if (amount <= 0) {
            return levelForXp(xp);
        }
        xp += amount;
        int earned = levelForXp(xp);
        if (earned > level && earned > pendingLevel) {
            pendingLevel = earned;
        }
        return earned;
    }

    public static int levelForXp(int xp) {
        int result = 1;
        for (int i = 1; i < XP_THRESHOLDS.length; i++) {
            if (xp >= XP_THRESHOLDS[i]) {
                result = i + 1;
            } else {
                break;
            }
        }
        return result;
    }

    // Getters and Setters
    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public CharacterClass getCharacterClass() { return characterClass; }
    public void setCharacterClass(CharacterClass characterClass) { this.characterClass = characterClass; }

    public int getLevel() { return level; }
    public void setLevel(int level) { this.level = level; }

    public int getXp() { return xp; }
    public void setXp(int xp) { this.xp = xp; }

    public int getPendingLevel() { return pendingLevel; }
    public void setPendingLevel(int pendingLevel) { this.pendingLevel = pendingLevel; }

    public AbilityScores getAbilityScores() { return abilityScores; }
    public void setAbilityScores(AbilityScores abilityScores) { this.abilityScores = abilityScores; }

    public int getCurrentHitPoints() { return currentHitPoints; }
    public void setCurrentHitPoints(int currentHitPoints) { this.currentHitPoints = currentHitPoints; }

    public int getMaxHitPoints() { return maxHitPoints; }
    public void setMaxHitPoints(int maxHitPoints) { this.maxHitPoints = maxHitPoints; }

    public int getBaseArmorClass() { return baseArmorClass; }
    public void setBaseArmorClass(int baseArmorClass) { this.baseArmorClass = baseArmorClass; }

    public int getBaseSpeed() { return baseSpeed; }
    public void setBaseSpeed(int baseSpeed) { this.baseSpeed = baseSpeed; }

    public Ability getSpellcastingAbility() { return spellcastingAbility; }
    public void setSpellcastingAbility(Ability spellcastingAbility) { this.spellcastingAbility = spellcastingAbility; }

    public Set<Ability> getSavingThrowProficiencies() { return savingThrowProficiencies; }
    public void setSavingThrowProficiencies(Set<Ability> savingThrowProficiencies) { this.savingThrowProficiencies = savingThrowProficiencies; }

    public Set<Skill> getSkillProficiencies() { return skillProficiencies; }
    public void setSkillProficiencies(Set<Skill> skillProficiencies) { this.skillProficiencies = skillProficiencies; }

    public List<String> getWeaponProficiencies() { return weaponProficiencies; }
    public void setWeaponProficiencies(List<String> weaponProficiencies) { this.weaponProficiencies = weaponProficiencies; }

    public List<CharacterFeature> getFeatures() { return features; }
    public void setFeatures(List<CharacterFeature> features) { this.features = features; }

    public Set<Condition> getConditions() { return conditions; }
    public void setConditions(Set<Condition> conditions) { this.conditions = conditions; }

    public List<CombatAbility> getAbilities() { return abilities; }
    public void setAbilities(List<CombatAbility> abilities) { this.abilities = abilities; }

    public List<String> getInventory() { return inventory; }
    public void setInventory(List<String> inventory) { this.inventory = inventory; }

    public int getGold() { return gold; }
    public void setGold(int gold) { this.gold = gold; }

    public Map<String, Integer> getSpellSlotsUsed() { return spellSlotsUsed; }
    public void setSpellSlotsUsed(Map<String, Integer> spellSlotsUsed) { this.spellSlotsUsed = spellSlotsUsed; }
}
