package com.rpgcore.game_state;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Один типизированный вклад эффекта. Какие поля заполнены, определяется видом:
 * числовые виды используют amount, множества используют values, формула КД и CUSTOM хранятся в text,
 * у STAT_BONUS и ABILITY_DAMAGE_BONUS есть ability.
 */
public class EffectContribution {
    private final EffectKind kind;
    private final int amount;
    private final String text;
    private final List<String> values;
    private final Ability ability;

    private EffectContribution(EffectKind kind, int amount, String text, List<String> values, Ability ability) {
        this.kind = kind;
        this.amount = amount;
        this.text = text;
        this.values = values;
        this.ability = ability;
    }

    public static EffectContribution amount(EffectKind kind, int amount) {
        return new EffectContribution(kind, amount, null, Collections.emptyList(), null);
    }

    public static EffectContribution flag(EffectKind kind) {
        return new EffectContribution(kind, 1, null, Collections.emptyList(), null);
    }

    public static EffectContribution values(EffectKind kind, Collection<String> values) {
        return new EffectContribution(kind, 0, null,
            Collections.unmodifiableList(new ArrayList<>(values)), null);
    }

    public static EffectContribution acFormula(String formula) {
        return new EffectContribution(EffectKind.AC_FORMULA, 0, formula, Collections.emptyList(), null);
    }

    public static EffectContribution bonusDamage(String damage) {
        return values(EffectKind.BONUS_DAMAGE, List.of(damage));
    }

    public static EffectContribution statBonus(Ability ability, int amount) {
        return new EffectContribution(EffectKind.STAT_BONUS, amount, null, Collections.emptyList(), ability);
    }

    public static EffectContribution abilityDamageBonus(Ability ability) {
        return new EffectContribution(EffectKind.ABILITY_DAMAGE_BONUS, 0, null, Collections.emptyList(), ability);
    }

    /**
     * Пул ресурса: text содержит имя пула (Ki, Sorcery Points), amount задаёт прирост за уровень
     */
    public static EffectContribution resourcePool(String name, int perLevel) {
        return new EffectContribution(EffectKind.RESOURCE_POOL, perLevel, name, Collections.emptyList(), null);
    }

    public static EffectContribution custom(String name, String payload) {
        String value = payload == null || payload.isEmpty() ? name : name + ": " + payload;
        return new EffectContribution(EffectKind.CUSTOM, 0, name, List.of(value), null);
    }

    public EffectKind getKind() { return kind; }
    public int getAmount() { return amount; }
    public String getText() { return text; }
    public List<String> getValues() { return values; }
    public Ability getAbility() { return ability; }

    @Override
    public String toString() {
        return kind.getJsonKey() + "=" + (text != null ? text : values.isEmpty() ? amount : values);
    }
}
