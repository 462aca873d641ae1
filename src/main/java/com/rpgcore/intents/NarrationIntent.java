package com.rpgcore.intents;

/**
 * Изменение состояния, которое рассказчик возвращает после хода.
 * Все намерения одного хода применяются одной пачкой.
 */
public abstract class NarrationIntent {

    public enum Kind { CREATE_NPC, UPDATE_NPC, PLAYER_STATE }

    private final Kind kind;

    protected NarrationIntent(Kind kind) {
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
