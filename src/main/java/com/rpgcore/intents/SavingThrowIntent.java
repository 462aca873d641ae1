package com.rpgcore.intents;

import com.rpgcore.game_state.Ability;

public class SavingThrowIntent extends ActionIntent {
    private final Ability ability;
    private final int dc;
    private final String source;

    public SavingThrowIntent(Ability ability, int dc) {
        this(ability, dc, null);
    }

    public SavingThrowIntent(Ability ability, int dc, String source) {
        super(Kind.SAVING_THROW);
        this.ability = ability;
        this.dc = dc;
        this.source = source;
    }

    public Ability getAbility() { return ability; }
    public int getDc() { return dc; }

    /** Что вызвало спасбросок ("Fireball", "ловушка"); может быть null */
    public String getSource() { return source; }
}
