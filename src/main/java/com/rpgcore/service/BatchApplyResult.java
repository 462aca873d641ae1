package com.rpgcore.service;

import com.rpgcore.encounter.NpcUpdateResult;
import com.rpgcore.game_state.Encounter;
import com.rpgcore.game_state.EncounterReward;
import com.rpgcore.game_state.Npc;

import java.util.Collections;
import java.util.List;

/**
 * Итог применения намерений рассказчика одной пачкой.
 * При applied=false ни персонаж, ни бой не изменены.
 */
public class BatchApplyResult {
    public static final String FAILURE_MESSAGE = "Could not resolve this action.";

    private final boolean applied;
    private final String message;
    private final Encounter encounter;
    private final List<NpcUpdateResult> npcUpdates;
    private final List<Npc> createdNpcs;
    private final int damageToPlayer;
    private final int cancelledDamage;
    private final EncounterReward reward;
    private final int pendingLevel;
    private final List<String> warnings;

    BatchApplyResult(boolean applied, String message, Encounter encounter, List<NpcUpdateResult> npcUpdates,
                     List<Npc> createdNpcs, int damageToPlayer, int cancelledDamage, EncounterReward reward,
                     int pendingLevel, List<String> warnings) {
        this.applied = applied;
        this.message = message;
        this.encounter = encounter;
        this.npcUpdates = Collections.unmodifiableList(npcUpdates);
        this.createdNpcs = Collections.unmodifiableList(createdNpcs);
        this.damageToPlayer = damageToPlayer;
        this.cancelledDamage = cancelledDamage;
        this.reward = reward;
        this.pendingLevel = pendingLevel;
        this.warnings = Collections.unmodifiableList(warnings);
    }

    static BatchApplyResult failed(Encounter encounter) {
        return new BatchApplyResult(false, FAILURE_MESSAGE, encounter, List.of(), List.of(), 0, 0, null, 0, List.of());
    }

    public boolean isApplied() { return applied; }
    public String getMessage() { return message; }

    /** Бой после применения: исходный экземпляр, новый (если бой начался) или null */
    public Encounter getEncounter() { return encounter; }
    public List<NpcUpdateResult> getNpcUpdates() { return npcUpdates; }
    public List<Npc> getCreatedNpcs() { return createdNpcs; }

    /** Предброшенный урон NPC после вычета атак погибших в этом ходу */
    public int getDamageToPlayer() { return damageToPlayer; }
    public int getCancelledDamage() { return cancelledDamage; }

    /** Награда, если бой завершился в этой пачке */
    public EncounterReward getReward() { return reward; }

    /** Уровень, доступный для повышения; 0, если повышения нет */
    public int getPendingLevel() { return pendingLevel; }
    public List<String> getWarnings() { return warnings; }
}
