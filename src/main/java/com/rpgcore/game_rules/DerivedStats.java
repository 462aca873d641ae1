package com.rpgcore.game_rules;

import com.rpgcore.game_state.Ability;
import com.rpgcore.game_state.AbilityScores;
import com.rpgcore.game_state.Character;
import com.rpgcore.game_state.Condition;
import com.rpgcore.game_state.Skill;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Живые боевые значения персонажа после свёртки эффектов.
 * Создаётся только EffectAggregator и не переиспользуется после смены состояний.
 */
public class DerivedStats {
    private final Character character;
    final AbilityScores abilityScores;
    private final Set<Condition> activeConditions;

    int armorClass;
    int speed;
    int numAttacks = 1;
    int meleeAttackBonus;
    int rangedAttackBonus;
    int spellAttackBonus;
    int meleeDamageBonus;
    int rangedDamageBonus;
    int critBonusDice;
    int sneakAttackDice;
    int minCheckRoll;
    int expertiseSlots;
    int healPool;
    boolean evasion;
    boolean initiativeAdvantage;
    boolean halfProficiency;
    String acFormula;
    final Map<String, Integer> resourcePools = new LinkedHashMap<>();
    final Set<String> resistances = new LinkedHashSet<>();
    final Set<String> immunities = new LinkedHashSet<>();
    final Set<String> bonusSaveProficiencies = new LinkedHashSet<>();
    final Set<Skill> skillProficiencies = new LinkedHashSet<>();
    final Set<Ability> saveAdvantages = new LinkedHashSet<>();
    final Set<String> bonusDamage = new LinkedHashSet<>();
    final Set<String> customEffects = new LinkedHashSet<>();
    final Set<String> appliedFeatures = new LinkedHashSet<>();
    final List<String> skippedContributions = new ArrayList<>();

    DerivedStats(Character character) {
        this.character = character;
        this.abilityScores = character.getAbilityScores().copy();
        this.activeConditions = Collections.unmodifiableSet(new LinkedHashSet<>(character.getConditions()));
        this.armorClass = character.getBaseArmorClass();
        this.speed = character.getBaseSpeed();
        this.skillProficiencies.addAll(character.getSkillProficiencies());
    }

    public int getModifier(Ability ability) {
        return abilityScores.getModifier(ability);
    }

    public int getProficiencyBonus() {
        return character.getProficiencyBonus();
    }

    public boolean isSkillProficient(Skill skill) {
        return skillProficiencies.contains(skill);
    }

    public boolean isSaveProficient(Ability ability) {
        return character.getSavingThrowProficiencies().contains(ability)
            || bonusSaveProficiencies.contains("all")
            || bonusSaveProficiencies.contains(ability.getValue());
    }

    public boolean hasCondition(Condition condition) {
        return activeConditions.contains(condition);
    }

    public boolean isConcentratingOn(String effectName) {
        return activeConditions.stream().anyMatch(c -> c.isConcentratingOn(effectName));
    }

    public boolean isFeatureApplied(String featureName) {
        return appliedFeatures.stream().anyMatch(name -> name.equalsIgnoreCase(featureName));
    }

    public int getAttackBonus(boolean melee) {
        return melee ? meleeAttackBonus : rangedAttackBonus;
    }

    public int getDamageBonus(boolean melee) {
        return melee ? meleeDamageBonus : rangedDamageBonus;
    }

    public Character getCharacter() { return character; }
    public AbilityScores getAbilityScores() { return abilityScores.copy(); }
    public Set<Condition> getActiveConditions() { return activeConditions; }
    public int getLevel() { return character.getLevel(); }

    public int getArmorClass() { return armorClass; }
    public int getSpeed() { return speed; }
    public int getNumAttacks() { return numAttacks; }
    public int getMeleeAttackBonus() { return meleeAttackBonus; }
    public int getRangedAttackBonus() { return rangedAttackBonus; }
    public int getSpellAttackBonus() { return spellAttackBonus; }
    public int getMeleeDamageBonus() { return meleeDamageBonus; }
    public int getRangedDamageBonus() { return rangedDamageBonus; }
    public int getCritBonusDice() { return critBonusDice; }
    public int getSneakAttackDice() { return sneakAttackDice; }
    public int getMinCheckRoll() { return minCheckRoll; }
    public int getExpertiseSlots() { return expertiseSlots; }
    public int getHealPool() { return healPool; }
    public boolean hasEvasion() { return evasion; }
    public boolean hasInitiativeAdvantage() { return initiativeAdvantage; }
    public boolean hasHalfProficiency() { return halfProficiency; }
    public String getAcFormula() { return acFormula; }

    public Map<String, Integer> getResourcePools() { return Collections.unmodifiableMap(resourcePools); }
    public Set<String> getResistances() { return Collections.unmodifiableSet(resistances); }
    public Set<String> getImmunities() { return Collections.unmodifiableSet(immunities); }
    public Set<String> getBonusSaveProficiencies() { return Collections.unmodifiableSet(bonusSaveProficiencies); }
    public Set<Skill> getSkillProficiencies() { return Collections.unmodifiableSet(skillProficiencies); }
    public Set<Ability> getSaveAdvantages() { return Collections.unmodifiableSet(saveAdvantages); }
    public List<String> getBonusDamage() { return List.copyOf(bonusDamage); }
    public Set<String> getCustomEffects() { return Collections.unmodifiableSet(customEffects); }
    public Set<String> getAppliedFeatures() { return Collections.unmodifiableSet(appliedFeatures); }
    public List<String> getSkippedContributions() { return Collections.unmodifiableList(skippedContributions); }
}
