package com.rpgcore.service;

import com.rpgcore.game_rules.DiceRoller;
import com.rpgcore.game_state.Character;
import com.rpgcore.game_state.CharacterFeature;
import com.rpgcore.game_state.CombatAbility;
import com.rpgcore.game_state.Condition;
import com.rpgcore.game_state.Encounter;
import com.rpgcore.intents.PlayerStateDelta;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Применяет {@link PlayerStateDelta} к персонажу. Опыт во время активного боя
 * копится в бою и выдаётся при его завершении.
 */
@Component
public class PlayerStateApplier {
    private static final Logger log = LoggerFactory.getLogger(PlayerStateApplier.class);

    /**
     * @return предупреждения о пропущенных частях (неизвестное умение, некорректные кубики)
     */
    public List<String> apply(Character character, PlayerStateDelta delta, Encounter encounter) {
        return apply(character, delta, encounter, false);
    }

    /**
     * @param engineOwnsHp урон игроку уже посчитан предброском NPC; hp_delta рассказчика отбрасывается
     */
    public List<String> apply(Character character, PlayerStateDelta delta, Encounter encounter, boolean engineOwnsHp) {
        List<String> warnings = new ArrayList<>();
        if (delta.getHpDelta() != 0) {
            if (engineOwnsHp) {
                warnings.add("hp_delta " + delta.getHpDelta() + " ignored: player HP in combat comes from NPC attack rolls");
            } else {
                character.applyHpDelta(delta.getHpDelta());
            }
        }

        character.getInventory().addAll(delta.getItemsGained());
        for (String lost : delta.getItemsLost()) {
            if (!removeItem(character.getInventory(), lost)) {
                warnings.add("Item \"" + lost + "\" not in inventory");
            }
        }

        for (Condition condition : delta.getConditionsAdded()) {
            character.addCondition(condition);
        }
        for (Condition condition : delta.getConditionsRemoved()) {
            character.removeCondition(condition);
        }

        if (delta.getGoldDelta() != 0) {
            character.setGold(Math.max(0, character.getGold() + delta.getGoldDelta()));
        }

        if (delta.getXpGained() > 0) {
            if (encounter != null && encounter.isActive()) {
                encounter.setTotalXpAwarded(encounter.getTotalXpAwarded() + delta.getXpGained());
                log.debug("{} XP отложено до конца боя {}", delta.getXpGained(), encounter.getId());
            } else {
                character.gainXp(delta.getXpGained());
            }
        }

        for (CombatAbility weapon : delta.getWeaponsGained()) {
            if (!DiceRoller.isValid(weapon.getDamageRoll())) {
                warnings.add("Weapon \"" + weapon.getName() + "\" has invalid damage dice " + weapon.getDamageRoll());
                continue;
            }
            boolean known = character.getAbilities().stream()
                .anyMatch(a -> a.getName().equalsIgnoreCase(weapon.getName()));
            if (!known) {
                character.getAbilities().add(weapon);
            }
        }

        for (Map.Entry<String, String> choice : delta.getFeatureChoiceUpdates().entrySet()) {
            CharacterFeature feature = character.findFeature(choice.getKey());
            if (feature == null) {
                warnings.add("Feature \"" + choice.getKey() + "\" not found");
            } else {
                feature.setChosenOption(choice.getValue());
            }
        }

        // новое число использованных ячеек уровня, 0 после долгого отдыха
        for (Map.Entry<String, Integer> slot : delta.getSpellSlotsUsed().entrySet()) {
            if (slot.getValue() != null) {
                character.getSpellSlotsUsed().put(slot.getKey(), Math.max(0, slot.getValue()));
            }
        }

        if (encounter != null) {
            if (delta.getLocationChanged() != null) {
                encounter.setLocation(delta.getLocationChanged());
            }
            if (delta.getSceneUpdate() != null) {
                encounter.setScene(delta.getSceneUpdate());
            }
        }

        for (String warning : warnings) {
            log.warn("Изменение состояния {}: {}", character.getId(), warning);
        }
        return warnings;
    }

    private static boolean removeItem(List<String> inventory, String item) {
        Iterator<String> it = inventory.iterator();
        while (it.hasNext()) {
            if (it.next().equalsIgnoreCase(item)) {
                it.remove();
                return true;
            }
        }
        return false;
    }
}
