package com.rpgcore.intents;

import com.rpgcore.game_state.CombatAbility;
import com.rpgcore.game_state.Condition;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Изменения состояния игрока из update_game_state.
 * <p>
 * Урон от атак NPC сюда не входит: его применяет ядро по результатам предброска.
 * Опыт во время активного боя не начисляется, его выдаёт награда за завершение боя.
 */
public class PlayerStateDelta extends NarrationIntent {
    private int hpDelta;
    private List<String> itemsGained = new ArrayList<>();
    private List<String> itemsLost = new ArrayList<>();
    private List<Condition> conditionsAdded = new ArrayList<>();
    private List<Condition> conditionsRemoved = new ArrayList<>();
    private int goldDelta;
    private int xpGained;
    private List<CombatAbility> weaponsGained = new ArrayList<>();
    private Map<String, String> featureChoiceUpdates = new LinkedHashMap<>();
    private Map<String, Integer> spellSlotsUsed = new LinkedHashMap<>();
    private String locationChanged;
    private String sceneUpdate;

    public PlayerStateDelta() {
        super(Kind.PLAYER_STATE);
    }

    public boolean isEmpty() {
        return hpDelta == 0 && goldDelta == 0 && xpGained == 0
            && itemsGained.isEmpty() && itemsLost.isEmpty()
            && conditionsAdded.isEmpty() && conditionsRemoved.isEmpty()
            && weaponsGained.isEmpty() && featureChoiceUpdates.isEmpty() && spellSlotsUsed.isEmpty()
            && locationChanged == null && sceneUpdate == null;
    }

    public int getHpDelta() { return hpDelta; }
    public void setHpDelta(int hpDelta) { this.hpDelta = hpDelta; }

    public List<String> getItemsGained() { return itemsGained; }
    public void setItemsGained(List<String> itemsGained) { this.itemsGained = itemsGained; }

    public List<String> getItemsLost() { return itemsLost; }
    public void setItemsLost(List<String> itemsLost) { this.itemsLost = itemsLost; }

    public List<Condition> getConditionsAdded() { return conditionsAdded; }
    public void setConditionsAdded(List<Condition> conditionsAdded) { this.conditionsAdded = conditionsAdded; }

    public List<Condition> getConditionsRemoved() { return conditionsRemoved; }
    public void setConditionsRemoved(List<Condition> conditionsRemoved) { this.conditionsRemoved = conditionsRemoved; }

    public int getGoldDelta() { return goldDelta; }
    public void setGoldDelta(int goldDelta) { this.goldDelta = goldDelta; }

    public int getXpGained() { return xpGained; }
    public void setXpGained(int xpGained) { this.xpGained = xpGained; }

    public List<CombatAbility> getWeaponsGained() { return weaponsGained; }
    public void setWeaponsGained(List<CombatAbility> weaponsGained) { this.weaponsGained = weaponsGained; }

    public Map<String, String> getFeatureChoiceUpdates() { return featureChoiceUpdates; }
    public void setFeatureChoiceUpdates(Map<String, String> featureChoiceUpdates) { this.featureChoiceUpdates = featureChoiceUpdates; }

    public Map<String, Integer> getSpellSlotsUsed() { return spellSlotsUsed; }
    public void setSpellSlotsUsed(Map<String, Integer> spellSlotsUsed) { this.spellSlotsUsed = spellSlotsUsed; }

    public String getLocationChanged() { return locationChanged; }
    public void setLocationChanged(String locationChanged) { this.locationChanged = locationChanged; }

    public String getSceneUpdate() { return sceneUpdate; }
    public void setSceneUpdate(String sceneUpdate) { this.sceneUpdate = sceneUpdate; }
}
