package com.rpgcore.encounter;

import com.rpgcore.game_state.Condition;

import java.util.ArrayList;
import java.util.List;

/**
 * Изменения одного NPC: урон/лечение, состояния, уход со сцены. Все поля необязательны.
 */
public class NpcUpdate {
    private Integer hpDelta;
    private List<Condition> conditionsAdded = new ArrayList<>();
    private List<Condition> conditionsRemoved = new ArrayList<>();
    private boolean removeFromScene;

    public static NpcUpdate damage(int amount) {
        return new NpcUpdate().hpDelta(-amount);
    }

    public static NpcUpdate dismiss() {
        return new NpcUpdate().removeFromScene(true);
    }

    public NpcUpdate hpDelta(Integer hpDelta) {
        this.hpDelta = hpDelta;
        return this;
    }

    public NpcUpdate addCondition(Condition condition) {
        conditionsAdded.add(condition);
        return this;
    }

    public NpcUpdate removeCondition(Condition condition) {
        conditionsRemoved.add(condition);
        return this;
    }

    public NpcUpdate removeFromScene(boolean removeFromScene) {
        this.removeFromScene = removeFromScene;
        return this;
    }

    public Integer getHpDelta() { return hpDelta; }
    public List<Condition> getConditionsAdded() { return conditionsAdded; }
    public List<Condition> getConditionsRemoved() { return conditionsRemoved; }
    public boolean isRemoveFromScene() { return removeFromScene; }
}
