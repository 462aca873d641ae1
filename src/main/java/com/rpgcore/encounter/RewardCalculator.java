package com.rpgcore.encounter;

import com.rpgcore.game_state.EncounterReward;
import com.rpgcore.game_state.Npc;

import java.util.List;

/**
 * Награда за завершённый бой. Вызывается ровно один раз на бой.
 */
public interface RewardCalculator {

    EncounterReward calculate(List<Npc> defeated, int totalXpAwarded, int rounds);
}
