package com.rpgcore.encounter;

import com.rpgcore.game_state.EncounterReward;
import com.rpgcore.game_state.Npc;

import java.util.ArrayList;
import java.util.List;

/**
 * Награда только опытом: накопленный за бой XP и имена побеждённых.
 * Золото и добычу определяет внешний слой.
 */
public class XpRewardCalculator implements RewardCalculator {

    @Override
    public EncounterReward calculate(List<Npc> defeated, int totalXpAwarded, int rounds) {
        List<String> names = new ArrayList<>();
        for (Npc npc : defeated) {
            names.add(npc.getName());
        }
        return new EncounterReward(totalXpAwarded, 0, List.of(), names, rounds);
    }
}
