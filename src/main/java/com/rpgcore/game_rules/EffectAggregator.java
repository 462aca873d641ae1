package com.rpgcore.game_rules;

import com.rpgcore.game_state.Ability;
import com.rpgcore.game_state.AbilityScores;
import com.rpgcore.game_state.Character;
import com.rpgcore.game_state.CharacterFeature;
import com.rpgcore.game_state.EffectContribution;
import com.rpgcore.game_state.EffectKind;
import com.rpgcore.game_state.GameplayEffect;
import com.rpgcore.game_state.Skill;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Свёртка эффектов умений в боевые значения персонажа.
 * <p>
 * Чистая функция: каждый вызов начинает с базовых значений персонажа и заново
 * применяет все умения, чьё условие "always" или активно. Правило слияния
 * задаётся видом вклада ({@link EffectKind.MergeRule}). Бонус урона от модификатора
 * характеристики вычисляется сразу по текущим значениям, поэтому зависит от порядка
 * умений, если в том же проходе есть STAT_BONUS. Формула КД вычисляется в конце прохода.
 * <p>
 * Некорректный вклад пропускается и попадает в {@link DerivedStats#getSkippedContributions()}.
 */
@Component
public class EffectAggregator {
    private static final Logger log = LoggerFactory.getLogger(EffectAggregator.class);
    private static final Pattern BONUS_DAMAGE_PATTERN = Pattern.compile("^(\\d+d\\d+)(?:\\s+(.+))?$",
        Pattern.CASE_INSENSITIVE);

    public DerivedStats aggregate(Character character) {
        DerivedStats stats = new DerivedStats(character);
        int acBonus = 0;
        int speedBonus = 0;
        AcFormula formula = null;

        for (CharacterFeature feature : character.getFeatures()) {
            GameplayEffect effect = feature.getEffect();
            if (effect == null || !effect.getCondition().isSatisfiedBy(stats.getActiveConditions())) {
                continue;
            }
            stats.appliedFeatures.add(feature.getName());

            for (EffectContribution contribution : effect.getContributions()) {
                try {
                    switch (contribution.getKind()) {
                        case AC_BONUS -> acBonus += contribution.getAmount();
                        case SPEED_BONUS -> speedBonus += contribution.getAmount();
                        case AC_FORMULA -> {
                            formula = AcFormula.parse(contribution.getText());
                            stats.acFormula = contribution.getText();
                        }
                        default -> apply(stats, contribution);
                    }
                } catch (RuntimeException e) {
                    String reason = feature.getName() + " [" + contribution + "]: " + e.getMessage();
                    stats.skippedContributions.add(reason);
                    log.warn("Пропущен некорректный эффект {}", reason);
                }
            }
        }

        int baseAc = character.getBaseArmorClass();
        if (formula != null) {
            baseAc = Math.max(baseAc, formula.evaluate(stats.abilityScores));
        }
        stats.armorClass = baseAc + acBonus;
        stats.speed = character.getBaseSpeed() + speedBonus;
        return stats;
    }

    private void apply(DerivedStats stats, EffectContribution c) {
        int amount = c.getAmount();
        int level = stats.getLevel();
        switch (c.getKind()) {
            case NUM_ATTACKS -> stats.numAttacks = Math.max(stats.numAttacks, requirePositive(amount));
            case MIN_CHECK_ROLL -> stats.minCheckRoll = Math.max(stats.minCheckRoll, requireRange(amount, 1, 20));
            case CRIT_BONUS_DICE -> stats.critBonusDice = Math.max(stats.critBonusDice, requireNonNegative(amount));
            case SNEAK_ATTACK_DICE -> stats.sneakAttackDice = Math.max(stats.sneakAttackDice, requireNonNegative(amount));
            case HEAL_POOL_PER_LEVEL -> stats.healPool = Math.max(stats.healPool, requireNonNegative(amount) * level);
            case RESOURCE_POOL -> {
                String name = requireText(c.getText());
                stats.resourcePools.merge(name, requireNonNegative(amount) * level, Math::max);
            }
            case ATTACK_BONUS -> {
                stats.meleeAttackBonus += amount;
                stats.rangedAttackBonus += amount;
                stats.spellAttackBonus += amount;
            }
            case MELEE_ATTACK_BONUS -> stats.meleeAttackBonus += amount;
            case RANGED_ATTACK_BONUS -> stats.rangedAttackBonus += amount;
            case SPELL_ATTACK_BONUS -> stats.spellAttackBonus += amount;
            case MELEE_DAMAGE_BONUS -> stats.meleeDamageBonus += amount;
            case RANGED_DAMAGE_BONUS -> stats.rangedDamageBonus += amount;
            case EXPERTISE_SLOTS -> stats.expertiseSlots += amount;
            case STAT_BONUS -> stats.abilityScores.addBonus(requireAbility(c.getAbility()), amount);
            case ABILITY_DAMAGE_BONUS -> {
                int modifier = stats.abilityScores.getModifier(requireAbility(c.getAbility()));
                stats.meleeDamageBonus += modifier;
                stats.rangedDamageBonus += modifier;
            }
            case RESISTANCES -> stats.resistances.addAll(lowercase(c.getValues()));
            case IMMUNITIES -> stats.immunities.addAll(lowercase(c.getValues()));
            case SAVE_PROFICIENCIES -> stats.bonusSaveProficiencies.addAll(saveProficiencies(c.getValues()));
            case SKILL_PROFICIENCIES -> stats.skillProficiencies.addAll(skills(c.getValues()));
            case SAVE_ADVANTAGE -> stats.saveAdvantages.addAll(abilities(c.getValues()));
            case BONUS_DAMAGE -> stats.bonusDamage.addAll(bonusDamage(c.getValues()));
            case CUSTOM -> stats.customEffects.addAll(c.getValues());
            case EVASION -> stats.evasion = true;
            case INITIATIVE_ADVANTAGE -> stats.initiativeAdvantage = true;
            case HALF_PROFICIENCY -> stats.halfProficiency = true;
            case AC_BONUS, SPEED_BONUS, AC_FORMULA ->
                throw new IllegalStateException("Handled by aggregate(): " + c.getKind());
        }
    }

    private static int requirePositive(int value) {
        if (value < 1) {
            throw new IllegalArgumentException("expected a positive value, got " + value);
        }
        return value;
    }

    private static int requireNonNegative(int value) {
        if (value < 0) {
            throw new IllegalArgumentException("expected a non-negative value, got " + value);
        }
        return value;
    }

    private static int requireRange(int value, int min, int max) {
        if (value < min || value > max) {
            throw new IllegalArgumentException("expected " + min + ".." + max + ", got " + value);
        }
        return value;
    }

    private static String requireText(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("missing name");
        }
        return text.trim();
    }

    private static Ability requireAbility(Ability ability) {
        if (ability == null) {
            throw new IllegalArgumentException("missing ability");
        }
        return ability;
    }

    private static List<String> lowercase(List<String> values) {
        List<String> result = new ArrayList<>();
        for (String value : values) {
            result.add(requireText(value).toLowerCase());
        }
        return result;
    }

    private static List<String> saveProficiencies(List<String> values) {
        List<String> result = new ArrayList<>();
        for (String value : lowercase(values)) {
            result.add(value.equals("all") ? value : Ability.fromString(value).getValue());
        }
        return result;
    }

    private static List<Skill> skills(List<String> values) {
        List<Skill> result = new ArrayList<>();
        for (String value : values) {
            result.add(Skill.fromString(value));
        }
        return result;
    }

    private static List<Ability> abilities(List<String> values) {
        List<Ability> result = new ArrayList<>();
        for (String value : values) {
            result.add(Ability.fromString(value));
        }
        return result;
    }

    private static List<String> bonusDamage(List<String> values) {
        List<String> result = new ArrayList<>();
        for (String value : values) {
            String trimmed = requireText(value);
            if (!BONUS_DAMAGE_PATTERN.matcher(trimmed).matches() || !DiceRoller.isValid(trimmed.split("\\s+")[0])) {
                throw new IllegalArgumentException("bad damage expression '" + value + "'");
            }
            result.add(trimmed);
        }
        return result;
    }

    /**
     * Формула КД без доспеха: "10 + dex + con". Слагаемые: числа или характеристики.
     */
    static class AcFormula {
        private final int constant;
        private final List<Ability> abilities;

        private AcFormula(int constant, List<Ability> abilities) {
            this.constant = constant;
            this.abilities = abilities;
        }

        static AcFormula parse(String formula) {
            if (formula == null || formula.isBlank()) {
                throw new IllegalArgumentException("empty AC formula");
            }
            int constant = 0;
            List<Ability> abilities = new ArrayList<>();
            for (String rawTerm : formula.split("\\+")) {
                String term = rawTerm.trim();
                if (term.matches("\\d+")) {
                    constant += Integer.parseInt(term);
                } else {
                    Ability ability = Ability.find(term);
                    if (ability == null) {
                        throw new IllegalArgumentException("unparseable AC formula '" + formula + "'");
                    }
                    abilities.add(ability);
                }
            }
            return new AcFormula(constant, abilities);
        }

        int evaluate(AbilityScores scores) {
            int total = constant;
            for (Ability ability : abilities) {
                total += scores.getModifier(ability);
            }
            return total;
        }
    }
}
