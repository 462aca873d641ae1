package com.rpgcore.srd;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.rpgcore.game_state.AbilityScores;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link StatLookup} поверх 5e-srd-api: GET {base}/{version}/{kind}/{slug}.
 * <p>
 * Базовый адрес берётся из SRD_API_URL, затем из свойства srd.api.url, затем из конфигурации;
 * к адресу без "/api" суффикс добавляется. Ошибки сети и 404 дают null.
 * Найденные записи кэшируются на время жизни объекта.
 */
public class SrdStatLookup implements StatLookup {
    private static final Logger log = LoggerFactory.getLogger(SrdStatLookup.class);
    private static final Gson gson = new GsonBuilder().setLenient().create();
    private static final Pattern LEADING_NUMBER = Pattern.compile("(\\d+)");

    private final OkHttpClient httpClient;
    private final String apiUrl;
    private final Map<String, StatBlock> cache = new ConcurrentHashMap<>();

    public SrdStatLookup(String srdApiBase, String version) {
        this(new OkHttpClient(), srdApiBase, version);
    }

    public SrdStatLookup(OkHttpClient httpClient, String srdApiBase, String version) {
        this.httpClient = httpClient;
        this.apiUrl = normalizeBase(srdApiBase) + "/" + version;
    }

    /**
     * Адрес из окружения важнее конфигурации
     */
    public static String resolveBaseUrl(String configured) {
        String url = System.getenv("SRD_API_URL");
        if (url == null || url.isEmpty()) {
            url = System.getProperty("srd.api.url");
        }
        if (url == null || url.isEmpty()) {
            url = configured;
        }
        return url;
    }

    static String normalizeBase(String url) {
        String base = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        return base.endsWith("/api") ? base : base + "/api";
    }

    @Override
    public StatBlock lookup(String kind, String slug) {
        if (kind == null || slug == null || slug.isBlank()) {
            return null;
        }
        String key = kind + "/" + slug;
        StatBlock cached = cache.get(key);
        if (cached != null) {
            return cached;
        }
        JsonObject json = fetch(kind, slug.trim().toLowerCase());
        if (json == null) {
            return null;
        }
        StatBlock block;
        try {
            block = toStatBlock(kind, slug, json);
        } catch (RuntimeException e) {
            log.warn("Некорректная запись SRD {}/{}: {}", kind, slug, e.getMessage());
            return null;
        }
        cache.put(key, block);
        return block;
    }

    private JsonObject fetch(String kind, String slug) {
        HttpUrl url = HttpUrl.parse(apiUrl + "/" + kind + "/" + slug);
        if (url == null) {
            log.warn("Некорректный адрес SRD: {}/{}/{}", apiUrl, kind, slug);
            return null;
        }
        Request request = new Request.Builder().url(url).build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (response.code() == 404) {
                log.debug("В SRD нет {}/{}", kind, slug);
                return null;
            }
            if (!response.isSuccessful() || response.body() == null) {
                log.warn("SRD ответил {} на {}", response.code(), url);
                return null;
            }
            JsonElement element = gson.fromJson(response.body().string(), JsonElement.class);
            return element != null && element.isJsonObject() ? element.getAsJsonObject() : null;
        } catch (IOException | JsonParseException e) {
            log.warn("Ошибка запроса к SRD ({}/{}): {}", kind, slug, e.getMessage());
            return null;
        }
    }

    static StatBlock toStatBlock(String kind, String slug, JsonObject json) {
        StatBlock block = new StatBlock(kind, string(json, "index", slug), string(json, "name", slug));
        block.setArmorClass(armorClass(json.get("armor_class")));
        block.setHitPoints(integer(json, "hit_points"));
        block.setChallengeRating(challengeRating(json.get("challenge_rating")));
        block.setXp(integer(json, "xp"));
        Integer dexterity = integer(json, "dexterity");
        if (dexterity != null) {
            block.setSavingThrowBonus(AbilityScores.modifierFor(dexterity));
        }
        block.setSpeed(speed(json.get("speed")));
        readFirstAttack(json, block);
        if (json.has("desc") && json.get("desc").isJsonArray() && json.getAsJsonArray("desc").size() > 0) {
            block.setDescription(json.getAsJsonArray("desc").get(0).getAsString());
        } else if (json.has("desc") && json.get("desc").isJsonPrimitive()) {
            block.setDescription(json.get("desc").getAsString());
        }
        return block;
    }

    /**
     * Первое действие с бонусом атаки: бонус и кубики первого урона
     */
    private static void readFirstAttack(JsonObject json, StatBlock block) {
        if (!json.has("actions") || !json.get("actions").isJsonArray()) {
            return;
        }
        for (JsonElement element : json.getAsJsonArray("actions")) {
            if (!element.isJsonObject()) {
                continue;
            }
            JsonObject action = element.getAsJsonObject();
            Integer attackBonus = integer(action, "attack_bonus");
            if (attackBonus == null) {
                continue;
            }
            block.setAttackBonus(attackBonus);
            if (action.has("damage") && action.get("damage").isJsonArray()) {
                JsonArray damage = action.getAsJsonArray("damage");
                if (damage.size() > 0 && damage.get(0).isJsonObject()) {
                    JsonObject first = damage.get(0).getAsJsonObject();
                    block.setDamageDice(string(first, "damage_dice", null));
                    if (first.has("damage_type") && first.get("damage_type").isJsonObject()) {
                        block.setDamageType(string(first.getAsJsonObject("damage_type"), "name", null));
                    }
                }
            }
            return;
        }
    }

    private static Integer armorClass(JsonElement element) {
        if (element == null || element.isJsonNull()) {
            return null;
        }
        if (element.isJsonPrimitive()) {
            return element.getAsInt();
        }
        if (element.isJsonArray() && element.getAsJsonArray().size() > 0) {
            JsonElement first = element.getAsJsonArray().get(0);
            if (first.isJsonPrimitive()) {
                return first.getAsInt();
            }
            if (first.isJsonObject()) {
                return integer(first.getAsJsonObject(), "value");
            }
        }
        return null;
    }

    /**
     * Число или дробь строкой ("1/4"); всё остальное даёт null
     */
    static Double challengeRating(JsonElement element) {
        if (element == null || !element.isJsonPrimitive()) {
            return null;
        }
        if (element.getAsJsonPrimitive().isNumber()) {
            return element.getAsDouble();
        }
        String value = element.getAsString().trim();
        try {
            int slash = value.indexOf('/');
            if (slash < 0) {
                return Double.parseDouble(value);
            }
            double denominator = Double.parseDouble(value.substring(slash + 1));
            return denominator == 0 ? null : Double.parseDouble(value.substring(0, slash)) / denominator;
        } catch (NumberFormatException e) {
            log.warn("Некорректный показатель опасности в SRD: '{}'", value);
            return null;
        }
    }

    private static Integer speed(JsonElement element) {
        if (element == null || !element.isJsonObject()) {
            return null;
        }
        String walk = string(element.getAsJsonObject(), "walk", null);
        if (walk == null) {
            return null;
        }
        Matcher matcher = LEADING_NUMBER.matcher(walk);
        return matcher.find() ? Integer.parseInt(matcher.group(1)) : null;
    }

    private static Integer integer(JsonObject obj, String key) {
        if (!obj.has(key) || !obj.get(key).isJsonPrimitive() || !obj.get(key).getAsJsonPrimitive().isNumber()) {
            return null;
        }
        return obj.get(key).getAsInt();
    }

    private static String string(JsonObject obj, String key, String fallback) {
        if (!obj.has(key) || !obj.get(key).isJsonPrimitive()) {
            return fallback;
        }
        return obj.get(key).getAsString();
    }
}
