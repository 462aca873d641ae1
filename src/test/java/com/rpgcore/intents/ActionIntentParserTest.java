package com.rpgcore.intents;

import com.rpgcore.game_state.Ability;
import com.rpgcore.game_state.Skill;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ActionIntentParserTest {
    private final ActionIntentParser parser = new ActionIntentParser();

    @Test
    void parsesAttackWithExtraDamage() throws IntentParseException {
        ActionIntent intent = parser.parse("""
            {"name": "resolve_attack", "input": {"weapon": "Longsword", "target": "goblin-1",
             "extra_damage_sources": ["Divine Smite 2", "hunters-mark", "moonbeam"]}}
            """);

        AttackIntent attack = assertInstanceOf(AttackIntent.class, intent);
        assertEquals("Longsword", attack.getWeapon());
        assertEquals("goblin-1", attack.getTarget());
        assertEquals(2, attack.getExtraDamage().size());
        assertEquals(ExtraDamageSource.DIVINE_SMITE, attack.getExtraDamage().get(0).getSource());
        assertEquals(2, attack.getExtraDamage().get(0).getTier());
        assertTrue(attack.requests(ExtraDamageSource.HUNTERS_MARK));
    }

    @Test
    void toleratesProseAroundJsonAndStringArguments() throws IntentParseException {
        ActionIntent intent = parser.parse("Sure! Here is the call: "
            + "{\"name\": \"resolve_skill_check\", \"arguments\": \"{\\\"skill\\\": \\\"Sleight of Hand\\\", \\\"dc\\\": \\\"hard\\\"}\"} Done.");

        SkillCheckIntent check = assertInstanceOf(SkillCheckIntent.class, intent);
        assertEquals(Skill.SLEIGHT_OF_HAND, check.getSkill());
        assertEquals(20, check.getDc());
    }

    @Test
    void dcDefaultsToMedium() throws IntentParseException {
        SkillCheckIntent check = (SkillCheckIntent) parser.parse(
            "{\"name\": \"resolve_skill_check\", \"input\": {\"skill\": \"perception\"}}");
        assertEquals(15, check.getDc());

        SkillCheckIntent numeric = (SkillCheckIntent) parser.parse(
            "{\"name\": \"resolve_skill_check\", \"input\": {\"skill\": \"perception\", \"dc\": 12}}");
        assertEquals(12, numeric.getDc());
    }

    @Test
    void unknownSkillIsImpossible() throws IntentParseException {
        ActionIntent intent = parser.parse(
            "{\"name\": \"resolve_skill_check\", \"input\": {\"skill\": \"juggling\"}}");

        assertEquals("Unknown skill: \"juggling\"", ((ImpossibleIntent) intent).getReason());
    }

    @Test
    void parsesSavingThrowFromFirstCallInArray() throws IntentParseException {
        ActionIntent intent = parser.parse("""
            [{"name": "resolve_saving_throw", "input": {"ability": "DEX", "dc": 14, "source": "trap"}},
             {"name": "mark_no_check", "input": {}}]
            """);

        SavingThrowIntent save = assertInstanceOf(SavingThrowIntent.class, intent);
        assertEquals(Ability.DEXTERITY, save.getAbility());
        assertEquals(14, save.getDc());
        assertEquals("trap", save.getSource());
    }

    @Test
    void markersAndUnknownTools() throws IntentParseException {
        assertEquals("You cannot reach the moon.", ((ImpossibleIntent) parser.parse(
            "{\"name\": \"mark_impossible\", \"input\": {\"reason\": \"You cannot reach the moon.\"}}")).getReason());
        assertEquals("No roll needed.", ((NoCheckIntent) parser.parse(
            "{\"name\": \"mark_no_check\"}")).getReason());
        assertEquals("Unknown intent 'cast_spell'; no roll made.", ((NoCheckIntent) parser.parse(
            "{\"tool\": \"cast_spell\", \"input\": {}}")).getReason());
    }

    @Test
    void malformedResponsesAreRejected() {
        assertThrows(IntentParseException.class, () -> parser.parse("I attack the goblin"));
        assertThrows(IntentParseException.class, () -> parser.parse(""));
        assertThrows(IntentParseException.class, () -> parser.parse("{\"input\": {}}"));
        assertThrows(IntentParseException.class, () -> parser.parse(
            "{\"name\": \"resolve_attack\", \"input\": {\"target\": \"goblin\"}}"));
        assertThrows(IntentParseException.class, () -> parser.parse(
            "{\"name\": \"resolve_saving_throw\", \"input\": {\"ability\": \"luck\"}}"));
    }
}
