package com.rpgcore.intents;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Чтение вызовов инструментов из ответа модели.
 * Вызов имеет вид {"name": "...", "input": {...}}; "arguments" может быть объектом или строкой с JSON.
 */
final class ToolCallJson {
    static final Gson GSON = new GsonBuilder().setLenient().create();

    private ToolCallJson() {
    }

    /**
     * Достаёт JSON из ответа: весь ответ, либо фрагмент между первой '{' / '[' и последней '}' / ']'
     */
    static JsonElement extract(String response) throws IntentParseException {
        if (response == null || response.trim().isEmpty()) {
            throw new IntentParseException("Пустой ответ вместо вызова инструмента");
        }
        String trimmed = response.trim();
        int start = firstIndex(trimmed, '{', '[');
        if (start == -1) {
            throw new IntentParseException("Не удалось найти JSON в ответе: " + trimmed);
        }
        char close = trimmed.charAt(start) == '{' ? '}' : ']';
        int end = trimmed.lastIndexOf(close);
        if (end <= start) {
            throw new IntentParseException("Не удалось найти JSON в ответе: " + trimmed);
        }
        String json = trimmed.substring(start, end + 1);
        try {
            JsonElement element = GSON.fromJson(json, JsonElement.class);
            if (element == null || element.isJsonNull()) {
                throw new IntentParseException("Пустой JSON: " + json);
            }
            return element;
        } catch (JsonParseException e) {
            throw new IntentParseException("Ошибка парсинга JSON: " + e.getMessage() + ". JSON: " + json, e);
        }
    }

    static String toolName(JsonObject call) throws IntentParseException {
        String name = string(call, "name");
        if (name == null) {
            name = string(call, "tool");
        }
        if (name == null || name.isBlank()) {
            throw new IntentParseException("В вызове нет имени инструмента: " + call);
        }
        return name.trim();
    }

    static JsonObject arguments(JsonObject call) throws IntentParseException {
        for (String key : new String[] {"input", "arguments", "args"}) {
            if (!call.has(key) || call.get(key).isJsonNull()) {
                continue;
            }
            JsonElement value = call.get(key);
            if (value.isJsonObject()) {
                return value.getAsJsonObject();
            }
            if (value.isJsonPrimitive() && value.getAsJsonPrimitive().isString()) {
                try {
                    JsonObject parsed = GSON.fromJson(value.getAsString(), JsonObject.class);
                    return parsed == null ? new JsonObject() : parsed;
                } catch (JsonParseException e) {
                    throw new IntentParseException("Аргументы инструмента не являются JSON-объектом: " + value, e);
                }
            }
            throw new IntentParseException("Аргументы инструмента не являются JSON-объектом: " + value);
        }
        return new JsonObject();
    }

    static String string(JsonObject obj, String key) {
        if (!obj.has(key) || obj.get(key).isJsonNull() || !obj.get(key).isJsonPrimitive()) {
            return null;
        }
        return obj.get(key).getAsString();
    }

    static String requireString(JsonObject obj, String key) throws IntentParseException {
        String value = string(obj, key);
        if (value == null || value.isBlank()) {
            throw new IntentParseException("Обязательное поле '" + key + "' отсутствует");
        }
        return value.trim();
    }

    static Integer integer(JsonObject obj, String key) throws IntentParseException {
        if (!obj.has(key) || obj.get(key).isJsonNull()) {
            return null;
        }
        JsonElement value = obj.get(key);
        try {
            if (value.isJsonPrimitive()) {
                return (int) Math.round(value.getAsDouble());
            }
        } catch (NumberFormatException e) {
            throw new IntentParseException("Поле '" + key + "' должно быть числом: " + value, e);
        }
        throw new IntentParseException("Поле '" + key + "' должно быть числом: " + value);
    }

    static boolean bool(JsonObject obj, String key) {
        if (!obj.has(key) || obj.get(key).isJsonNull() || !obj.get(key).isJsonPrimitive()) {
            return false;
        }
        return obj.get(key).getAsBoolean();
    }

    static List<String> strings(JsonObject obj, String key) throws IntentParseException {
        List<String> result = new ArrayList<>();
        if (!obj.has(key) || obj.get(key).isJsonNull()) {
            return result;
        }
        JsonElement value = obj.get(key);
        if (value.isJsonPrimitive()) {
            result.add(value.getAsString());
            return result;
        }
        if (!value.isJsonArray()) {
            throw new IntentParseException("Поле '" + key + "' должно быть массивом строк: " + value);
        }
        for (JsonElement element : value.getAsJsonArray()) {
            if (element != null && !element.isJsonNull() && element.isJsonPrimitive()) {
                result.add(element.getAsString());
            }
        }
        return result;
    }

    static List<JsonObject> objects(JsonObject obj, String key) throws IntentParseException {
        List<JsonObject> result = new ArrayList<>();
        if (!obj.has(key) || obj.get(key).isJsonNull()) {
            return result;
        }
        if (!obj.get(key).isJsonArray()) {
            throw new IntentParseException("Поле '" + key + "' должно быть массивом объектов");
        }
        JsonArray array = obj.getAsJsonArray(key);
        for (JsonElement element : array) {
            if (element.isJsonObject()) {
                result.add(element.getAsJsonObject());
            }
        }
        return result;
    }

    static Map<String, JsonElement> entries(JsonObject obj, String key) throws IntentParseException {
        Map<String, JsonElement> result = new LinkedHashMap<>();
        if (!obj.has(key) || obj.get(key).isJsonNull()) {
            return result;
        }
        if (!obj.get(key).isJsonObject()) {
            throw new IntentParseException("Поле '" + key + "' должно быть объектом");
        }
        for (Map.Entry<String, JsonElement> entry : obj.getAsJsonObject(key).entrySet()) {
            result.put(entry.getKey(), entry.getValue());
        }
        return result;
    }

    private static int firstIndex(String text, char a, char b) {
        int ia = text.indexOf(a);
        int ib = text.indexOf(b);
        if (ia == -1) {
            return ib;
        }
        if (ib == -1) {
            return ia;
        }
        return Math.min(ia, ib);
    }
}
