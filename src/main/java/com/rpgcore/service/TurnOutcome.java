package com.rpgcore.service;

import com.rpgcore.encounter.EncounterSnapshot;
import com.rpgcore.encounter.NpcUpdateResult;
import com.rpgcore.game_rules.PreRollResult;
import com.rpgcore.game_rules.RollResult;
import com.rpgcore.game_rules.RollSummaryFormatter;
import com.rpgcore.game_state.EncounterReward;

/**
 * Всё, что рассказчик получает после хода игрока
 */
public class TurnOutcome {
    private final RollResult rollResult;
    private final NpcUpdateResult targetUpdate;
    private final PreRollResult preRoll;
    private final EncounterSnapshot snapshot;
    private final EncounterReward reward;
    private final int playerArmorClass;

    public TurnOutcome(RollResult rollResult, NpcUpdateResult targetUpdate, PreRollResult preRoll,
                       EncounterSnapshot snapshot, EncounterReward reward, int playerArmorClass) {
        this.rollResult = rollResult;
        this.targetUpdate = targetUpdate;
        this.preRoll = preRoll;
        this.snapshot = snapshot;
        this.reward = reward;
        this.playerArmorClass = playerArmorClass;
    }

    public String getRollSummary() {
        return RollSummaryFormatter.format(rollResult);
    }

    public RollResult getRollResult() { return rollResult; }

    /** Урон игрока по цели; null, если урона не было */
    public NpcUpdateResult getTargetUpdate() { return targetUpdate; }
    public PreRollResult getPreRoll() { return preRoll; }

    /** null вне боя */
    public EncounterSnapshot getSnapshot() { return snapshot; }

    /** Награда, если атака игрока завершила бой */
    public EncounterReward getReward() { return reward; }
    public int getPlayerArmorClass() { return playerArmorClass; }
}
