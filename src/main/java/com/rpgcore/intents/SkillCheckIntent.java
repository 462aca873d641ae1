package com.rpgcore.intents;

import com.rpgcore.game_state.Skill;

public class SkillCheckIntent extends ActionIntent {
    private final Skill skill;
    private final int dc;

    public SkillCheckIntent(Skill skill, int dc) {
        super(Kind.SKILL_CHECK);
        this.skill = skill;
        this.dc = dc;
    }

    public Skill getSkill() { return skill; }
    public int getDc() { return dc; }
}
