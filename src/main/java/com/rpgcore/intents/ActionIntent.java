package com.rpgcore.intents;

/**
 * Классифицированное действие игрока. Набор вариантов закрыт: {@link Kind}
 * перечисляет их все, и резолвер обрабатывает каждый.
 */
public abstract class ActionIntent {

    public enum Kind { ATTACK, SKILL_CHECK, SAVING_THROW, IMPOSSIBLE, NO_CHECK }

    private final Kind kind;

    protected ActionIntent(Kind kind) {
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
