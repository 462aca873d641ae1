package com.rpgcore.game_state;

/**
 * Закрытый набор видов вклада эффекта. Каждый вид сливается по своему правилу.
 */
public enum EffectKind {
    // ─── Ёмкости: берётся максимум ───
    NUM_ATTACKS("numAttacks", MergeRule.MAX),
    MIN_CHECK_ROLL("minCheckRoll", MergeRule.MAX),
    CRIT_BONUS_DICE("critBonusDice", MergeRule.MAX),
    SNEAK_ATTACK_DICE("sneakAttackDice", MergeRule.MAX),
    HEAL_POOL_PER_LEVEL("healPoolPerLevel", MergeRule.MAX),
    RESOURCE_POOL("resourcePool", MergeRule.MAX),

    // ─── Бонусы: суммируются ───
    ATTACK_BONUS("attackBonus", MergeRule.SUM),
    MELEE_ATTACK_BONUS("meleeAttackBonus", MergeRule.SUM),
    RANGED_ATTACK_BONUS("rangedAttackBonus", MergeRule.SUM),
    SPELL_ATTACK_BONUS("spellAttackBonus", MergeRule.SUM),
    MELEE_DAMAGE_BONUS("meleeDamageBonus", MergeRule.SUM),
    RANGED_DAMAGE_BONUS("rangedDamageBonus", MergeRule.SUM),
    AC_BONUS("acBonus", MergeRule.SUM),
    SPEED_BONUS("speedBonus", MergeRule.SUM),
    EXPERTISE_SLOTS("expertiseSlots", MergeRule.SUM),
    STAT_BONUS("statBonuses", MergeRule.SUM),

    // ─── Множества: объединение без повторов ───
    RESISTANCES("resistances", MergeRule.UNION),
    IMMUNITIES("immunities", MergeRule.UNION),
    SAVE_PROFICIENCIES("saveProficiencies", MergeRule.UNION),
    SKILL_PROFICIENCIES("skillProficiencies", MergeRule.UNION),
    SAVE_ADVANTAGE("saveAdvantage", MergeRule.UNION),
    BONUS_DAMAGE("bonusDamage", MergeRule.UNION),
    CUSTOM("custom", MergeRule.UNION),

    // ─── Флаги: логическое ИЛИ ───
    EVASION("evasion", MergeRule.OR),
    INITIATIVE_ADVANTAGE("initiativeAdvantage", MergeRule.OR),
    HALF_PROFICIENCY("halfProficiency", MergeRule.OR),

    AC_FORMULA("acFormula", MergeRule.LAST_WRITER),
    ABILITY_DAMAGE_BONUS("abilityDamageBonus", MergeRule.ABILITY_LINKED);

    public enum MergeRule {
        MAX, SUM, UNION, OR, LAST_WRITER, ABILITY_LINKED
    }

    private final String jsonKey;
    private final MergeRule mergeRule;

    EffectKind(String jsonKey, MergeRule mergeRule) {
        this.jsonKey = jsonKey;
        this.mergeRule = mergeRule;
    }

    public String getJsonKey() {
        return jsonKey;
    }

    public MergeRule getMergeRule() {
        return mergeRule;
    }

    /**
     * null, если ключ не распознан
     */
    public static EffectKind fromJsonKey(String key) {
        for (EffectKind kind : values()) {
            if (kind.jsonKey.equals(key)) {
                return kind;
            }
        }
        return null;
    }
}
