package com.rpgcore.service;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.rpgcore.game_state.Ability;
import com.rpgcore.game_state.Condition;
import com.rpgcore.game_state.EffectContribution;
import com.rpgcore.game_state.EffectKind;
import com.rpgcore.game_state.GameplayEffect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Плоский JSON эффекта умения ↔ {@link GameplayEffect}.
 * <pre>
 * {"condition": "raging", "meleeDamageBonus": 2, "resistances": ["bludgeoning"],
 *  "statBonuses": {"strength": 2}, "resourcePool": {"ki": 1}, "acFormula": "10 + dex + con"}
 * </pre>
 * Ключи проверяются при загрузке: неизвестный ключ становится CUSTOM-вкладом,
 * значение неверного типа отбрасывается с предупреждением.
 */
final class GameplayEffectJson {
    private static final Logger log = LoggerFactory.getLogger(GameplayEffectJson.class);
    private static final String CONDITION_KEY = "condition";

    private GameplayEffectJson() {
    }

    static GameplayEffect fromJson(JsonObject json) {
        Condition condition = Condition.ALWAYS;
        List<EffectContribution> contributions = new ArrayList<>();
        for (Map.Entry<String, JsonElement> entry : json.entrySet()) {
            String key = entry.getKey();
            JsonElement value = entry.getValue();
            if (value == null || value.isJsonNull()) {
                continue;
            }
            if (CONDITION_KEY.equals(key)) {
                condition = value.isJsonPrimitive() ? Condition.parse(value.getAsString()) : Condition.ALWAYS;
                continue;
            }
            EffectKind kind = EffectKind.fromJsonKey(key);
            if (kind == null) {
                log.warn("Неизвестный ключ эффекта '{}', сохранён как custom", key);
                contributions.add(EffectContribution.custom(key, value.isJsonPrimitive() ? value.getAsString() : value.toString()));
                continue;
            }
            try {
                read(kind, value, contributions);
            } catch (RuntimeException e) {
                log.warn("Некорректное значение эффекта {}={}: {}", key, value, e.getMessage());
            }
        }
        return new GameplayEffect(condition, contributions);
    }

    private static void read(EffectKind kind, JsonElement value, List<EffectContribution> out) {
        switch (kind) {
            case RESOURCE_POOL -> {
                for (Map.Entry<String, JsonElement> pool : value.getAsJsonObject().entrySet()) {
                    out.add(EffectContribution.resourcePool(pool.getKey(), number(pool.getValue())));
                }
            }
            case STAT_BONUS -> {
                for (Map.Entry<String, JsonElement> bonus : value.getAsJsonObject().entrySet()) {
                    out.add(EffectContribution.statBonus(Ability.fromString(bonus.getKey()), number(bonus.getValue())));
                }
            }
            case CUSTOM -> {
                for (Map.Entry<String, JsonElement> custom : value.getAsJsonObject().entrySet()) {
                    out.add(EffectContribution.custom(custom.getKey(), custom.getValue().getAsString()));
                }
            }
            case AC_FORMULA -> out.add(EffectContribution.acFormula(value.getAsJsonPrimitive().getAsString()));
            case ABILITY_DAMAGE_BONUS -> out.add(EffectContribution.abilityDamageBonus(
                Ability.fromString(value.getAsJsonPrimitive().getAsString())));
            default -> {
                switch (kind.getMergeRule()) {
                    case MAX, SUM -> out.add(EffectContribution.amount(kind, number(value)));
                    case OR -> {
                        if (value.getAsJsonPrimitive().getAsBoolean()) {
                            out.add(EffectContribution.flag(kind));
                        }
                    }
                    case UNION -> out.add(EffectContribution.values(kind, strings(value)));
                    default -> throw new IllegalStateException("unexpected merge rule " + kind.getMergeRule());
                }
            }
        }
    }

    static JsonObject toJson(GameplayEffect effect) {
        JsonObject json = new JsonObject();
        if (effect.getCondition() != null && effect.getCondition() != Condition.ALWAYS) {
            json.addProperty(CONDITION_KEY, effect.getCondition().toString());
        }
        for (EffectContribution c : effect.getContributions()) {
            String key = c.getKind().getJsonKey();
            switch (c.getKind()) {
                case RESOURCE_POOL -> object(json, key).addProperty(c.getText(), c.getAmount());
                case STAT_BONUS -> object(json, key).addProperty(c.getAbility().getValue(), c.getAmount());
                case CUSTOM -> {
                    for (String entry : c.getValues()) {
                        int split = entry.indexOf(": ");
                        String name = split < 0 ? entry : entry.substring(0, split);
                        String payload = split < 0 ? "" : entry.substring(split + 2);
                        object(json, key).addProperty(name, payload);
                    }
                }
                case AC_FORMULA -> json.addProperty(key, c.getText());
                case ABILITY_DAMAGE_BONUS -> json.addProperty(key, c.getAbility().getValue());
                default -> {
                    switch (c.getKind().getMergeRule()) {
                        case MAX -> json.addProperty(key, Math.max(c.getAmount(), intOr(json, key, Integer.MIN_VALUE)));
                        case SUM -> json.addProperty(key, c.getAmount() + intOr(json, key, 0));
                        case OR -> json.addProperty(key, true);
                        case UNION -> {
                            JsonArray array = json.has(key) ? json.getAsJsonArray(key) : new JsonArray();
                            for (String v : c.getValues()) {
                                JsonPrimitive item = new JsonPrimitive(v);
                                if (!array.contains(item)) {
                                    array.add(item);
                                }
                            }
                            json.add(key, array);
                        }
                        default -> throw new IllegalStateException("unexpected merge rule " + c.getKind().getMergeRule());
                    }
                }
            }
        }
        return json;
    }

    private static JsonObject object(JsonObject parent, String key) {
        if (!parent.has(key)) {
            parent.add(key, new JsonObject());
        }
        return parent.getAsJsonObject(key);
    }

    private static int intOr(JsonObject json, String key, int fallback) {
        return json.has(key) ? json.get(key).getAsInt() : fallback;
    }

    private static int number(JsonElement value) {
        JsonPrimitive primitive = value.getAsJsonPrimitive();
        if (!primitive.isNumber()) {
            throw new IllegalArgumentException("expected a number, got " + value);
        }
        return primitive.getAsInt();
    }

    private static List<String> strings(JsonElement value) {
        List<String> result = new ArrayList<>();
        if (value.isJsonPrimitive()) {
            result.add(value.getAsString());
            return result;
        }
        for (JsonElement element : value.getAsJsonArray()) {
            result.add(element.getAsString());
        }
        return result;
    }
}
