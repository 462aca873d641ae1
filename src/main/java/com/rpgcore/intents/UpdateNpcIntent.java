package com.rpgcore.intents;

import com.rpgcore.encounter.NpcUpdate;

public class UpdateNpcIntent extends NarrationIntent {
    private final String npcId;
    private final NpcUpdate update;

    public UpdateNpcIntent(String npcId, NpcUpdate update) {
        super(Kind.UPDATE_NPC);
        this.npcId = npcId;
        this.update = update;
    }

    public String getNpcId() { return npcId; }
    public NpcUpdate getUpdate() { return update; }
}
