package com.rpgcore.game_state;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Механический эффект умения: условие активации и список вкладов
 */
public class GameplayEffect {
    private final Condition condition;
    private final List<EffectContribution> contributions;

    public GameplayEffect(Condition condition, List<EffectContribution> contributions) {
        this.condition = condition != null ? condition : Condition.ALWAYS;
        this.contributions = contributions != null
            ? Collections.unmodifiableList(new ArrayList<>(contributions))
            : Collections.emptyList();
    }

    public static GameplayEffect always(EffectContribution... contributions) {
        return new GameplayEffect(Condition.ALWAYS, Arrays.asList(contributions));
    }

    public static GameplayEffect when(Condition condition, EffectContribution... contributions) {
        return new GameplayEffect(condition, Arrays.asList(contributions));
    }

    public Condition getCondition() {
        return condition;
    }

    public List<EffectContribution> getContributions() {
        return contributions;
    }

    public boolean contributes(EffectKind kind) {
        return contributions.stream().anyMatch(c -> c.getKind() == kind);
    }
}
