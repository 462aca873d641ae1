package com.rpgcore.intents;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.rpgcore.game_state.Ability;
import com.rpgcore.game_state.Skill;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Превращает вызов инструмента классификатора действий в {@link ActionIntent}.
 * <p>
 * Инструменты: resolve_attack, resolve_skill_check, resolve_saving_throw,
 * mark_impossible, mark_no_check. Неизвестный инструмент даёт NoCheck с его именем.
 * DC может быть числом или меткой сложности ("hard" = 20), по умолчанию "medium".
 */
@Component
public class ActionIntentParser {
    private static final Logger log = LoggerFactory.getLogger(ActionIntentParser.class);

    public ActionIntent parse(String response) throws IntentParseException {
        JsonElement element = ToolCallJson.extract(response);
        if (element.isJsonArray()) {
            if (element.getAsJsonArray().isEmpty() || !element.getAsJsonArray().get(0).isJsonObject()) {
                throw new IntentParseException("Ожидался вызов инструмента: " + response);
            }
            // классификатор вызывает ровно один инструмент, остальные игнорируются
            element = element.getAsJsonArray().get(0);
        }
        if (!element.isJsonObject()) {
            throw new IntentParseException("Ожидался вызов инструмента: " + response);
        }
        return parseCall(element.getAsJsonObject());
    }

    public ActionIntent parseCall(JsonObject call) throws IntentParseException {
        String tool = ToolCallJson.toolName(call);
        JsonObject args = ToolCallJson.arguments(call);
        log.debug("Классификатор выбрал {} с аргументами {}", tool, args);

        switch (tool) {
            case "resolve_attack":
                return new AttackIntent(
                    ToolCallJson.requireString(args, "weapon"),
                    ToolCallJson.string(args, "target"),
                    extraDamage(ToolCallJson.strings(args, "extra_damage_sources")));
            case "resolve_skill_check": {
                String skillName = ToolCallJson.requireString(args, "skill");
                Skill skill = Skill.find(skillName);
                if (skill == null) {
                    return new ImpossibleIntent("Unknown skill: \"" + skillName + "\"");
                }
                return new SkillCheckIntent(skill, dc(args));
            }
            case "resolve_saving_throw": {
                String abilityName = ToolCallJson.requireString(args, "ability");
                Ability ability = Ability.find(abilityName);
                if (ability == null) {
                    throw new IntentParseException("Неизвестная характеристика для спасброска: " + abilityName);
                }
                return new SavingThrowIntent(ability, dc(args), ToolCallJson.string(args, "source"));
            }
            case "mark_impossible":
                return new ImpossibleIntent(reason(args, "This action is not possible."));
            case "mark_no_check":
                return new NoCheckIntent(reason(args, "No roll needed."));
            default:
                log.warn("Неизвестный инструмент классификатора: {}", tool);
                return new NoCheckIntent("Unknown intent '" + tool + "'; no roll made.");
        }
    }

    static int dc(JsonObject args) throws IntentParseException {
        if (!args.has("dc") || args.get("dc").isJsonNull()) {
            return DifficultyClass.MEDIUM.getDc();
        }
        JsonElement value = args.get("dc");
        if (value.isJsonPrimitive() && value.getAsJsonPrimitive().isNumber()) {
            return value.getAsInt();
        }
        String label = value.isJsonPrimitive() ? value.getAsString() : value.toString();
        if (label.trim().matches("\\d+")) {
            return Integer.parseInt(label.trim());
        }
        DifficultyClass difficulty = DifficultyClass.find(label);
        if (difficulty == null) {
            log.debug("Неизвестная метка сложности '{}', используется medium", label);
            return DifficultyClass.MEDIUM.getDc();
        }
        return difficulty.getDc();
    }

    private static List<ExtraDamageRequest> extraDamage(List<String> raw) {
        List<ExtraDamageRequest> requests = new ArrayList<>();
        for (String source : raw) {
            ExtraDamageRequest request = ExtraDamageRequest.parse(source);
            if (request == null) {
                log.debug("Источник доп. урона '{}' не распознан и пропущен", source);
            } else {
                requests.add(request);
            }
        }
        return requests;
    }

    private static String reason(JsonObject args, String fallback) {
        String reason = ToolCallJson.string(args, "reason");
        return reason == null || reason.isBlank() ? fallback : reason.trim();
    }
}
