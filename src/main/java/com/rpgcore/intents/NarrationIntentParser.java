package com.rpgcore.intents;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.rpgcore.encounter.NpcUpdate;
import com.rpgcore.game_state.CombatAbility;
import com.rpgcore.game_state.Condition;
import com.rpgcore.game_state.Disposition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Разбирает вызовы инструментов рассказчика в список {@link NarrationIntent}.
 * <p>
 * create_npc, update_npc и update_game_state превращаются в намерения; справочные
 * инструменты (query_srd и т.п.) состояние не меняют и пропускаются.
 */
@Component
public class NarrationIntentParser {
    private static final Logger log = LoggerFactory.getLogger(NarrationIntentParser.class);

    public List<NarrationIntent> parse(String response) throws IntentParseException {
        JsonElement element = ToolCallJson.extract(response);
        List<JsonObject> calls = new ArrayList<>();
        if (element.isJsonArray()) {
            for (JsonElement call : element.getAsJsonArray()) {
                if (!call.isJsonObject()) {
                    throw new IntentParseException("Ожидался вызов инструмента: " + call);
                }
                calls.add(call.getAsJsonObject());
            }
        } else if (element.isJsonObject()) {
            calls.add(element.getAsJsonObject());
        } else {
            throw new IntentParseException("Ожидался вызов инструмента: " + response);
        }

        List<NarrationIntent> intents = new ArrayList<>();
        for (JsonObject call : calls) {
            intents.addAll(parseCall(call));
        }
        return intents;
    }

    public List<NarrationIntent> parseCall(JsonObject call) throws IntentParseException {
        String tool = ToolCallJson.toolName(call);
        JsonObject args = ToolCallJson.arguments(call);
        List<NarrationIntent> intents = new ArrayList<>();
        switch (tool) {
            case "create_npc" -> intents.add(createNpc(args));
            case "update_npc" -> intents.add(updateNpc(args));
            case "update_game_state" -> {
                for (JsonObject npc : ToolCallJson.objects(args, "npcs_to_create")) {
                    intents.add(createNpc(npc));
                }
                PlayerStateDelta delta = playerDelta(args);
                if (!delta.isEmpty()) {
                    intents.add(delta);
                }
            }
            default -> log.debug("Инструмент {} не меняет состояние, пропущен", tool);
        }
        return intents;
    }

    private CreateNpcIntent createNpc(JsonObject args) throws IntentParseException {
        String name = ToolCallJson.requireString(args, "name");
        String slug = ToolCallJson.string(args, "slug");
        if (slug == null || slug.isBlank()) {
            slug = name.toLowerCase().trim().replaceAll("[^a-z0-9]+", "-").replaceAll("(^-|-$)", "");
        }
        Integer count = ToolCallJson.integer(args, "count");
        return new CreateNpcIntent(name, slug, disposition(ToolCallJson.string(args, "disposition")),
            count == null ? 1 : count);
    }

    private UpdateNpcIntent updateNpc(JsonObject args) throws IntentParseException {
        String id = ToolCallJson.requireString(args, "id");
        NpcUpdate update = new NpcUpdate()
            .hpDelta(ToolCallJson.integer(args, "hp_delta"))
            .removeFromScene(ToolCallJson.bool(args, "remove_from_scene"));
        for (String condition : ToolCallJson.strings(args, "conditions_added")) {
            update.addCondition(Condition.parse(condition));
        }
        for (String condition : ToolCallJson.strings(args, "conditions_removed")) {
            update.removeCondition(Condition.parse(condition));
        }
        return new UpdateNpcIntent(id, update);
    }

    private PlayerStateDelta playerDelta(JsonObject args) throws IntentParseException {
        PlayerStateDelta delta = new PlayerStateDelta();
        delta.setHpDelta(orZero(ToolCallJson.integer(args, "hp_delta")));
        delta.setGoldDelta(orZero(ToolCallJson.integer(args, "gold_delta")));
        delta.setXpGained(Math.max(0, orZero(ToolCallJson.integer(args, "xp_gained"))));
        delta.setItemsGained(ToolCallJson.strings(args, "items_gained"));
        delta.setItemsLost(ToolCallJson.strings(args, "items_lost"));
        delta.setConditionsAdded(conditions(ToolCallJson.strings(args, "conditions_added")));
        delta.setConditionsRemoved(conditions(ToolCallJson.strings(args, "conditions_removed")));
        delta.setLocationChanged(ToolCallJson.string(args, "location_changed"));
        delta.setSceneUpdate(ToolCallJson.string(args, "scene_update"));

        List<CombatAbility> weapons = new ArrayList<>();
        for (JsonObject weapon : ToolCallJson.objects(args, "weapons_gained")) {
            weapons.add(weapon(weapon));
        }
        delta.setWeaponsGained(weapons);

        Map<String, String> choices = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> entry : ToolCallJson.entries(args, "feature_choice_updates").entrySet()) {
            if (entry.getValue().isJsonPrimitive()) {
                choices.put(entry.getKey(), entry.getValue().getAsString());
            }
        }
        delta.setFeatureChoiceUpdates(choices);

        Map<String, Integer> slots = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> entry : ToolCallJson.entries(args, "spell_slots_used").entrySet()) {
            JsonElement value = entry.getValue();
            if (!value.isJsonPrimitive() || !value.getAsJsonPrimitive().isNumber()) {
                throw new IntentParseException("spell_slots_used." + entry.getKey() + " должно быть числом");
            }
            slots.put(entry.getKey(), value.getAsInt());
        }
        delta.setSpellSlotsUsed(slots);
        return delta;
    }

    private CombatAbility weapon(JsonObject args) throws IntentParseException {
        String name = ToolCallJson.requireString(args, "name");
        String dice = ToolCallJson.requireString(args, "dice");
        String stat = ToolCallJson.string(args, "stat");
        CombatAbility.WeaponStat weaponStat;
        try {
            weaponStat = stat == null ? CombatAbility.WeaponStat.STR
                : CombatAbility.WeaponStat.valueOf(stat.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IntentParseException("Неизвестная характеристика оружия: " + stat, e);
        }
        String damageType = ToolCallJson.string(args, "damage_type");
        CombatAbility weapon = CombatAbility.weapon(name, weaponStat, dice,
            damageType == null ? "bludgeoning" : damageType);
        weapon.setWeaponBonus(orZero(ToolCallJson.integer(args, "bonus")));
        return weapon;
    }

    private static Disposition disposition(String raw) throws IntentParseException {
        if (raw == null || raw.isBlank()) {
            return Disposition.HOSTILE;
        }
        try {
            return Disposition.fromString(raw.trim());
        } catch (IllegalArgumentException e) {
            throw new IntentParseException("Неизвестное отношение NPC: " + raw, e);
        }
    }

    private static List<Condition> conditions(List<String> raw) {
        List<Condition> conditions = new ArrayList<>();
        for (String value : raw) {
            conditions.add(Condition.parse(value));
        }
        return conditions;
    }

    private static int orZero(Integer value) {
        return value == null ? 0 : value;
    }
}
