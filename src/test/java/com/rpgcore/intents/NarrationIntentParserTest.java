package com.rpgcore.intents;

import com.rpgcore.game_state.CombatAbility;
import com.rpgcore.game_state.Condition;
import com.rpgcore.game_state.Disposition;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NarrationIntentParserTest {
    private final NarrationIntentParser parser = new NarrationIntentParser();

    @Test
    void parsesBatchOfCalls() throws IntentParseException {
        List<NarrationIntent> intents = parser.parse("""
            [
              {"name": "create_npc", "input": {"name": "Goblin Archer", "count": 2}},
              {"name": "update_npc", "input": {"id": "goblin-1a2b", "hp_delta": -7,
                                               "conditions_added": ["prone"]}},
              {"name": "query_srd", "input": {"query": "goblin"}}
            ]
            """);

        assertEquals(2, intents.size());
        CreateNpcIntent create = assertInstanceOf(CreateNpcIntent.class, intents.get(0));
        assertEquals("goblin-archer", create.getSlug());
        assertEquals(Disposition.HOSTILE, create.getDisposition());
        assertEquals(2, create.getCount());

        UpdateNpcIntent update = assertInstanceOf(UpdateNpcIntent.class, intents.get(1));
        assertEquals("goblin-1a2b", update.getNpcId());
        assertEquals(-7, update.getUpdate().getHpDelta());
        assertEquals(List.of(Condition.parse("prone")), update.getUpdate().getConditionsAdded());
        assertFalse(update.getUpdate().isRemoveFromScene());
    }

    @Test
    void npcCountIsCapped() throws IntentParseException {
        List<NarrationIntent> intents = parser.parse("""
            {"name": "create_npc", "input": {"name": "Rat", "count": 100000}}
            """);

        CreateNpcIntent rats = (CreateNpcIntent) intents.get(0);
        assertEquals(CreateNpcIntent.MAX_COUNT, rats.getCount());
        assertEquals(1, new CreateNpcIntent("Rat", "rat", Disposition.HOSTILE, -3).getCount());
    }

    @Test
    void gameStateUpdateSplitsIntoNpcsAndPlayerDelta() throws IntentParseException {
        List<NarrationIntent> intents = parser.parse("""
            {"name": "update_game_state", "input": {
              "hp_delta": -3, "gold_delta": 15, "xp_gained": 50,
              "items_gained": ["Rope"], "conditions_added": ["poisoned"],
              "weapons_gained": [{"name": "Shortbow", "dice": "1d6", "stat": "dex", "damage_type": "piercing"}],
              "feature_choice_updates": {"Fighting Style": "Archery"},
              "spell_slots_used": {"1": 1},
              "location_changed": "Old Mill",
              "npcs_to_create": [{"name": "Wolf", "slug": "wolf", "disposition": "neutral"}]
            }}
            """);

        assertEquals(2, intents.size());
        CreateNpcIntent wolf = (CreateNpcIntent) intents.get(0);
        assertEquals(Disposition.NEUTRAL, wolf.getDisposition());

        PlayerStateDelta delta = (PlayerStateDelta) intents.get(1);
        assertEquals(-3, delta.getHpDelta());
        assertEquals(15, delta.getGoldDelta());
        assertEquals(50, delta.getXpGained());
        assertEquals(List.of("Rope"), delta.getItemsGained());
        assertEquals(List.of(Condition.parse("poisoned")), delta.getConditionsAdded());
        CombatAbility bow = delta.getWeaponsGained().get(0);
        assertEquals(CombatAbility.WeaponStat.DEX, bow.getWeaponStat());
        assertEquals("1d6", bow.getDamageRoll());
        assertEquals("Archery", delta.getFeatureChoiceUpdates().get("Fighting Style"));
        assertEquals(1, delta.getSpellSlotsUsed().get("1"));
        assertEquals("Old Mill", delta.getLocationChanged());
    }

    @Test
    void emptyGameStateUpdateProducesNothing() throws IntentParseException {
        assertTrue(parser.parse("{\"name\": \"update_game_state\", \"input\": {}}").isEmpty());
    }

    @Test
    void removeFromSceneFlag() throws IntentParseException {
        UpdateNpcIntent update = (UpdateNpcIntent) parser.parse(
            "{\"name\": \"update_npc\", \"input\": {\"id\": \"bandit-1\", \"remove_from_scene\": true}}").get(0);

        assertTrue(update.getUpdate().isRemoveFromScene());
        assertNull(update.getUpdate().getHpDelta());
    }

    @Test
    void invalidValuesAreRejected() {
        assertThrows(IntentParseException.class, () -> parser.parse(
            "{\"name\": \"create_npc\", \"input\": {\"name\": \"Ghost\", \"disposition\": \"grumpy\"}}"));
        assertThrows(IntentParseException.class, () -> parser.parse(
            "{\"name\": \"update_npc\", \"input\": {\"hp_delta\": -2}}"));
        assertThrows(IntentParseException.class, () -> parser.parse(
            "{\"name\": \"update_game_state\", \"input\": {\"spell_slots_used\": {\"1\": \"many\"}}}"));
        assertThrows(IntentParseException.class, () -> parser.parse("[1, 2]"));
    }
}
