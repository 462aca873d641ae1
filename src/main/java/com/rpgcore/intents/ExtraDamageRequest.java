package com.rpgcore.intents;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Заявленный источник доп. урона с уровнем (ячейка для Smite, "Divine Smite 2")
 */
public class ExtraDamageRequest {
    private static final Pattern TIER = Pattern.compile("(\\d+)");

    private final ExtraDamageSource source;
    private final int tier;

    public ExtraDamageRequest(ExtraDamageSource source) {
        this(source, 1);
    }

    public ExtraDamageRequest(ExtraDamageSource source, int tier) {
        this.source = source;
        this.tier = tier;
    }

    /**
     * Разбирает строку классификатора; null для нераспознанного источника
     */
    public static ExtraDamageRequest parse(String raw) {
        if (raw == null) {
            return null;
        }
        String label = raw.replaceAll("\\d+", "").trim();
        ExtraDamageSource source = ExtraDamageSource.find(label);
        if (source == null) {
            return null;
        }
        Matcher matcher = TIER.matcher(raw);
        int tier = matcher.find() ? Integer.parseInt(matcher.group(1)) : 1;
        return new ExtraDamageRequest(source, tier);
    }

    public ExtraDamageSource getSource() { return source; }
    public int getTier() { return tier; }

    @Override
    public String toString() {
        return tier > 1 ? source.getLabel() + " " + tier : source.getLabel();
    }
}
