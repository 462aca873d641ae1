package com.rpgcore.intents;

import com.rpgcore.game_state.Disposition;

/**
 * Ввести в сцену одно или несколько одинаковых существ. Характеристики берутся
 * из справочника по slug; для неизвестных существ используются значения по умолчанию.
 */
public class CreateNpcIntent extends NarrationIntent {
    /** Больше существ за один вызов не создаётся */
    public static final int MAX_COUNT = 10;

    private final String name;
    private final String slug;
    private final Disposition disposition;
    private final int count;

    public CreateNpcIntent(String name, String slug, Disposition disposition) {
        this(name, slug, disposition, 1);
    }

    public CreateNpcIntent(String name, String slug, Disposition disposition, int count) {
        super(Kind.CREATE_NPC);
        this.name = name;
        this.slug = slug;
        this.disposition = disposition == null ? Disposition.HOSTILE : disposition;
        this.count = Math.max(1, Math.min(MAX_COUNT, count));
    }

    public String getName() { return name; }
    public String getSlug() { return slug; }
    public Disposition getDisposition() { return disposition; }
    public int getCount() { return count; }
}
