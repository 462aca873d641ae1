package com.rpgcore.service;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonDeserializer;
import com.google.gson.JsonNull;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializer;
import com.rpgcore.game_state.Character;
import com.rpgcore.game_state.Condition;
import com.rpgcore.game_state.Encounter;
import com.rpgcore.game_state.GameplayEffect;
import org.springframework.stereotype.Component;

/**
 * JSON-форма персонажа и боя для хоста. Состояния хранятся строкой ("raging",
 * "concentrating:hex"), эффекты умений плоским объектом, и проверяются при чтении.
 */
@Component
public class StateCodec {
    private final Gson gson;

    public StateCodec() {
        this.gson = new GsonBuilder()
            .registerTypeAdapter(Condition.class, (JsonSerializer<Condition>) (condition, type, ctx) ->
                condition == null ? JsonNull.INSTANCE : new JsonPrimitive(condition.toString()))
            .registerTypeAdapter(Condition.class, (JsonDeserializer<Condition>) (json, type, ctx) ->
                json == null || json.isJsonNull() ? Condition.ALWAYS : Condition.parse(json.getAsString()))
            .registerTypeAdapter(GameplayEffect.class, (JsonSerializer<GameplayEffect>) (effect, type, ctx) ->
                effect == null ? JsonNull.INSTANCE : GameplayEffectJson.toJson(effect))
            .registerTypeAdapter(GameplayEffect.class, (JsonDeserializer<GameplayEffect>) (json, type, ctx) -> {
                if (json == null || json.isJsonNull()) {
                    return null;
                }
                if (!json.isJsonObject()) {
                    throw new JsonParseException("Эффект умения должен быть объектом: " + json);
                }
                return GameplayEffectJson.fromJson(json.getAsJsonObject());
            })
            .setPrettyPrinting()
            .create();
    }

    public String writeCharacter(Character character) {
        return gson.toJson(character);
    }

    public Character readCharacter(String json) {
        Character character = gson.fromJson(json, Character.class);
        if (character == null) {
            throw new JsonParseException("Пустой JSON персонажа");
        }
        return character;
    }

    public String writeEncounter(Encounter encounter) {
        return gson.toJson(encounter);
    }

    public Encounter readEncounter(String json) {
        Encounter encounter = gson.fromJson(json, Encounter.class);
        if (encounter == null) {
            throw new JsonParseException("Пустой JSON боя");
        }
        return encounter;
    }

    public GameplayEffect readEffect(String json) {
        return gson.fromJson(json, GameplayEffect.class);
    }

    public String writeEffect(GameplayEffect effect) {
        return gson.toJson(effect, GameplayEffect.class);
    }

}
