package com.rpgcore.game_state;

import java.util.Collection;
import java.util.Objects;

/**
 * Тег состояния персонажа или NPC.
 * Известные теги разбираются в закрытый набор {@link Kind}, всё остальное
 * становится CUSTOM со строкой-носителем. CONCENTRATING хранит имя заклинания.
 */
public final class Condition {

    public enum Kind {
        ALWAYS("always"),
        BLINDED("blinded"),
        CHARMED("charmed"),
        DEAFENED("deafened"),
        EXHAUSTION("exhaustion"),
        FRIGHTENED("frightened"),
        GRAPPLED("grappled"),
        INCAPACITATED("incapacitated"),
        INVISIBLE("invisible"),
        PARALYZED("paralyzed"),
        PETRIFIED("petrified"),
        POISONED("poisoned"),
        PRONE("prone"),
        RESTRAINED("restrained"),
        STUNNED("stunned"),
        UNCONSCIOUS("unconscious"),
        RAGING("raging"),
        CONCENTRATING("concentrating"),
        DODGING("dodging"),
        HIDDEN("hidden"),
        CUSTOM("custom");

        private final String tag;

        Kind(String tag) {
            this.tag = tag;
        }

        public String getTag() {
            return tag;
        }
    }

    public static final Condition ALWAYS = new Condition(Kind.ALWAYS, null);
    public static final Condition RAGING = new Condition(Kind.RAGING, null);

    private final Kind kind;
    private final String payload;

    private Condition(Kind kind, String payload) {
        this.kind = kind;
        this.payload = payload;
    }

    public static Condition of(Kind kind) {
        if (kind == Kind.CUSTOM) {
            throw new IllegalArgumentException("Custom condition needs a tag");
        }
        return new Condition(kind, null);
    }

    public static Condition concentratingOn(String effectName) {
        return new Condition(Kind.CONCENTRATING, normalize(effectName));
    }

    public static Condition custom(String tag) {
        return new Condition(Kind.CUSTOM, normalize(tag));
    }

    /**
     * Разбор строки: "raging", "concentrating:hex", "concentrating on hunter's mark".
     * Пустая строка или null означает "always".
     */
    public static Condition parse(String raw) {
        String value = normalize(raw);
        if (value == null) {
            return ALWAYS;
        }
        if (value.startsWith("concentrat")) {
            String rest = value.replaceFirst("^concentrat(ing|ion)", "").trim();
            if (rest.startsWith(":")) {
                rest = rest.substring(1).trim();
            } else if (rest.startsWith("on ")) {
                rest = rest.substring(3).trim();
            }
            return new Condition(Kind.CONCENTRATING, rest.isEmpty() ? null : rest);
        }
        for (Kind kind : Kind.values()) {
            if (kind != Kind.CUSTOM && kind.tag.equals(value)) {
                return kind == Kind.ALWAYS ? ALWAYS : new Condition(kind, null);
            }
        }
        return new Condition(Kind.CUSTOM, value);
    }

    private static String normalize(String raw) {
        if (raw == null) {
            return null;
        }
        String value = raw.trim().toLowerCase();
        return value.isEmpty() ? null : value;
    }

    /**
     * Условие эффекта выполнено, если оно "always" или присутствует среди активных.
     * CONCENTRATING без имени выполняется любой концентрацией.
     */
    public boolean isSatisfiedBy(Collection<Condition> active) {
        if (kind == Kind.ALWAYS) {
            return true;
        }
        if (active == null) {
            return false;
        }
        if (kind == Kind.CONCENTRATING && payload == null) {
            return active.stream().anyMatch(c -> c.kind == Kind.CONCENTRATING);
        }
        return active.contains(this);
    }

    public boolean isConcentratingOn(String effectName) {
        return kind == Kind.CONCENTRATING && payload != null && payload.equals(normalize(effectName));
    }

    public Kind getKind() {
        return kind;
    }

    public String getPayload() {
        return payload;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Condition)) return false;
        Condition other = (Condition) o;
        return kind == other.kind && Objects.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, payload);
    }

    @Override
    public String toString() {
        if (kind == Kind.CUSTOM) {
            return payload;
        }
        if (kind == Kind.CONCENTRATING && payload != null) {
            return kind.tag + ":" + payload;
        }
        return kind.tag;
    }
}
