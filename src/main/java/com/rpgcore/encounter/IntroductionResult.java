package com.rpgcore.encounter;

import com.rpgcore.game_state.Encounter;
import com.rpgcore.game_state.Npc;

import java.util.Collections;
import java.util.List;

/**
 * Итог {@link EncounterStateMachine#introduce}.
 * encounter равен null, если активного боя нет и он не начался.
 */
public class IntroductionResult {
    private final Encounter encounter;
    private final boolean activated;
    private final List<Npc> joined;
    private final List<Npc> untracked;

    public IntroductionResult(Encounter encounter, boolean activated, List<Npc> joined, List<Npc> untracked) {
        this.encounter = encounter;
        this.activated = activated;
        this.joined = Collections.unmodifiableList(joined);
        this.untracked = Collections.unmodifiableList(untracked);
    }

    public Encounter getEncounter() { return encounter; }

    /** Введение NPC начало новый бой */
    public boolean isActivated() { return activated; }

    /** NPC, добавленные в состав боя */
    public List<Npc> getJoined() { return joined; }

    /** Невраждебные NPC вне боя: сцена хранит их сама */
    public List<Npc> getUntracked() { return untracked; }
}
