package com.rpgcore.service;

import com.google.gson.JsonParseException;
import com.rpgcore.game_state.Character;
import com.rpgcore.game_state.CharacterClass;
import com.rpgcore.game_state.CharacterFeature;
import com.rpgcore.game_state.Condition;
import com.rpgcore.game_state.Disposition;
import com.rpgcore.game_state.EffectContribution;
import com.rpgcore.game_state.EffectKind;
import com.rpgcore.game_state.Encounter;
import com.rpgcore.game_state.GameplayEffect;
import com.rpgcore.game_state.GridPosition;
import com.rpgcore.game_state.Npc;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StateCodecTest {
    private final StateCodec codec = new StateCodec();

    @Test
    void characterSurvivesJson() {
        Character barbarian = new Character("pc-1", "Urza", CharacterClass.BARBARIAN);
        barbarian.getFeatures().add(new CharacterFeature("Rage", 1,
            GameplayEffect.when(Condition.RAGING, EffectContribution.amount(EffectKind.MELEE_DAMAGE_BONUS, 2))));
        barbarian.addCondition(Condition.RAGING);
        barbarian.addCondition(Condition.concentratingOn("hex"));
        barbarian.getInventory().add("Greataxe");

        String json = codec.writeCharacter(barbarian);
        assertTrue(json.contains("\"raging\""));
        assertTrue(json.contains("\"meleeDamageBonus\": 2"));

        Character restored = codec.readCharacter(json);
        assertEquals("Urza", restored.getName());
        assertEquals(CharacterClass.BARBARIAN, restored.getCharacterClass());
        assertEquals(barbarian.getMaxHitPoints(), restored.getMaxHitPoints());
        assertTrue(restored.hasCondition(Condition.RAGING));
        assertTrue(restored.hasCondition(Condition.concentratingOn("hex")));
        assertEquals(List.of("Greataxe"), restored.getInventory());

        GameplayEffect rage = restored.findFeature("rage").getEffect();
        assertEquals(Condition.RAGING, rage.getCondition());
        assertEquals(1, rage.getContributions().size());
        assertEquals(EffectKind.MELEE_DAMAGE_BONUS, rage.getContributions().get(0).getKind());
        assertEquals(2, rage.getContributions().get(0).getAmount());
    }

    @Test
    void unknownEffectKeyBecomesCustom() {
        GameplayEffect effect = codec.readEffect("{\"acBonus\": 1, \"glowing\": \"faint\"}");

        assertEquals(Condition.ALWAYS, effect.getCondition());
        assertEquals(2, effect.getContributions().size());
        assertTrue(effect.contributes(EffectKind.AC_BONUS));
        EffectContribution custom = effect.getContributions().stream()
            .filter(c -> c.getKind() == EffectKind.CUSTOM).findFirst().orElseThrow();
        assertEquals(List.of("glowing: faint"), custom.getValues());
    }

    @Test
    void wrongValueTypeIsDropped() {
        GameplayEffect effect = codec.readEffect("{\"acBonus\": \"lots\", \"speedBonus\": 10}");

        assertEquals(1, effect.getContributions().size());
        assertTrue(effect.contributes(EffectKind.SPEED_BONUS));
    }

    @Test
    void encounterSurvivesJson() {
        Encounter encounter = new Encounter("enc-7", 20);
        encounter.addParticipant(new Npc("g1", "Goblin", 15, 7, 4, "1d6", 2, 50, Disposition.HOSTILE),
            new GridPosition(1, 3));
        encounter.getNpc("g1").addCondition(Condition.parse("prone"));

        Encounter restored = codec.readEncounter(codec.writeEncounter(encounter));

        assertEquals("enc-7", restored.getId());
        assertTrue(restored.isActive());
        assertEquals(new GridPosition(1, 3), restored.getPositions().get("g1"));
        assertEquals(7, restored.getNpc("g1").getCurrentHp());
        assertEquals(List.of(Condition.parse("prone")), restored.getNpc("g1").getConditions());
        assertEquals(encounter.getTurnOrder(), restored.getTurnOrder());
    }

    @Test
    void emptyInputIsRejected() {
        assertThrows(JsonParseException.class, () -> codec.readCharacter("null"));
        assertThrows(JsonParseException.class, () -> codec.readEncounter(""));
        assertThrows(JsonParseException.class, () -> codec.readEffect("[1, 2]"));
    }
}
