package com.rpgcore.game_state;

import java.util.ArrayList;
import java.util.List;

/**
 * Итог завершённого боя, рассчитанный внешним калькулятором наград
 */
public class EncounterReward {
    private final int totalXp;
    private final int gold;
    private final List<String> loot;
    private final List<String> defeatedNames;
    private final int rounds;

    public EncounterReward(int totalXp, int gold, List<String> loot, List<String> defeatedNames, int rounds) {
        this.totalXp = totalXp;
        this.gold = gold;
        this.loot = loot != null ? new ArrayList<>(loot) : new ArrayList<>();
        this.defeatedNames = defeatedNames != null ? new ArrayList<>(defeatedNames) : new ArrayList<>();
        this.rounds = rounds;
    }

    public int getTotalXp() { return totalXp; }
    public int getGold() { return gold; }
    public List<String> getLoot() { return loot; }
    public List<String> getDefeatedNames() { return defeatedNames; }
    public int getRounds() { return rounds; }
}
