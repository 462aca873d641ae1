package com.rpgcore.service;

import com.rpgcore.encounter.EncounterStateMachine;
import com.rpgcore.encounter.NpcUpdate;
import com.rpgcore.encounter.XpRewardCalculator;
import com.rpgcore.game_rules.ActionResolver;
import com.rpgcore.game_rules.DiceRoller;
import com.rpgcore.game_rules.EffectAggregator;
import com.rpgcore.game_rules.NpcAttackRoll;
import com.rpgcore.game_rules.NpcPreRollEngine;
import com.rpgcore.game_rules.PreRollResult;
import com.rpgcore.game_rules.RollResult;
import com.rpgcore.game_rules.ScriptedRandom;
import com.rpgcore.game_state.AbilityScores;
import com.rpgcore.game_state.Character;
import com.rpgcore.game_state.CharacterClass;
import com.rpgcore.game_state.CombatAbility;
import com.rpgcore.game_state.Disposition;
import com.rpgcore.game_state.Encounter;
import com.rpgcore.game_state.EncounterStatus;
import com.rpgcore.game_state.Npc;
import com.rpgcore.intents.ActionIntentParser;
import com.rpgcore.intents.AttackIntent;
import com.rpgcore.intents.CreateNpcIntent;
import com.rpgcore.intents.NarrationIntentParser;
import com.rpgcore.intents.PlayerStateDelta;
import com.rpgcore.intents.UpdateNpcIntent;
import com.rpgcore.srd.NpcFactory;
import com.rpgcore.srd.StatLookup;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class CombatTurnServiceTest {
    private StatLookup statLookup;
    private EncounterStateMachine stateMachine;
    private Character character;

    @BeforeEach
    void setUp() {
        statLookup = mock(StatLookup.class);
        stateMachine = new EncounterStateMachine(new XpRewardCalculator(), 20);
        character = new Character("pc-1", "Brom", CharacterClass.FIGHTER, 1,
            new AbilityScores(16, 12, 14, 10, 10, 8));
        character.getWeaponProficiencies().add("martial weapons");
        character.getAbilities().add(CombatAbility.weapon("Longsword", CombatAbility.WeaponStat.STR, "1d8", "slashing"));
    }

    private CombatTurnService service(int... faces) {
        DiceRoller dice = new DiceRoller(new ScriptedRandom(faces));
        return new CombatTurnService(new EffectAggregator(), new ActionResolver(dice), new NpcPreRollEngine(dice),
            stateMachine, new NpcFactory(statLookup), new PlayerStateApplier(),
            new ActionIntentParser(), new NarrationIntentParser());
    }

    private static Npc goblin(String id, int xp) {
        return new Npc(id, "Goblin " + id, 15, 7, 4, "1d6", 2, xp, Disposition.HOSTILE);
    }

    private Encounter encounterWith(Npc... npcs) {
        return stateMachine.introduce(null, List.of(npcs)).getEncounter();
    }

    private static TurnOutcome outcomeWithPreRoll(NpcAttackRoll... rolls) {
        return new TurnOutcome(null, null, new PreRollResult("ledger", List.of(rolls)), null, null, 16);
    }

    @Test
    void killingTheLastHostileCompletesEncounter() {
        Encounter encounter = encounterWith(goblin("a", 300));

        TurnOutcome outcome = service(15, 5).takeTurn(character, encounter, new AttackIntent("Longsword", "Goblin a"));

        RollResult roll = outcome.getRollResult();
        assertTrue(roll.isSuccess());
        assertEquals(8, roll.getTotalDamage());
        assertTrue(outcome.getTargetUpdate().isDied());
        assertEquals(EncounterStatus.COMPLETED, encounter.getStatus());
        assertEquals(300, outcome.getReward().getTotalXp());
        assertEquals(300, character.getXp());
        assertEquals(2, character.getPendingLevel());
        assertTrue(outcome.getPreRoll().isEmpty());
    }

    @Test
    void survivingNpcsArePreRolledAgainstPlayerAc() {
        Encounter encounter = encounterWith(goblin("a", 50), goblin("b", 50));

        // игрок: 15 + 5 урона по a; NPC b: d20=12 (+4 = 16 против AC 10), урон 3 + 2
        TurnOutcome outcome = service(15, 5, 12, 3).takeTurn(character, encounter,
            new AttackIntent("Longsword", "a"));

        assertEquals(10, outcome.getPlayerArmorClass());
        assertTrue(outcome.getTargetUpdate().isDied());
        assertEquals(1, outcome.getPreRoll().getPerNpc().size());
        assertEquals("b", outcome.getPreRoll().getPerNpc().get(0).getNpcId());
        assertEquals(5, outcome.getPreRoll().getTotalDamage());
        assertNotNull(outcome.getSnapshot());
        assertTrue(encounter.isActive());
    }

    @Test
    void damageFromNpcsKilledInSameBatchIsCancelled() {
        Encounter encounter = encounterWith(goblin("a", 50), goblin("b", 50));
        TurnOutcome outcome = outcomeWithPreRoll(
            new NpcAttackRoll("a", "Goblin a", 15, 19, true, false, "1d6", List.of(5), 7),
            new NpcAttackRoll("b", "Goblin b", 12, 16, true, false, "1d6", List.of(1), 3));
        int hpBefore = character.getCurrentHitPoints();

        BatchApplyResult result = service().applyNarration(character, encounter, outcome,
            List.of(new UpdateNpcIntent("a", NpcUpdate.damage(7))));

        assertTrue(result.isApplied());
        assertEquals(7, result.getCancelledDamage());
        assertEquals(3, result.getDamageToPlayer());
        assertEquals(hpBefore - 3, character.getCurrentHitPoints());
        assertSame(encounter, result.getEncounter());
        assertNull(encounter.getNpc("a"));
        assertEquals(2, encounter.getRound());
        assertEquals(Encounter.PLAYER_ID, encounter.getCurrentActorId());
    }

    @Test
    void narratorHpDeltaDoesNotDoubleCountNpcDamage() {
        Encounter encounter = encounterWith(goblin("a", 50), goblin("b", 50));
        TurnOutcome outcome = outcomeWithPreRoll(
            new NpcAttackRoll("b", "Goblin b", 14, 18, true, false, "1d6", List.of(3), 5));
        int hpBefore = character.getCurrentHitPoints();

        BatchApplyResult result = service().applyNarration(character, encounter, outcome,
            "{\"name\": \"update_game_state\", \"arguments\": {\"hp_delta\": -5}}");

        assertTrue(result.isApplied());
        assertEquals(5, result.getDamageToPlayer());
        assertEquals(hpBefore - 5, character.getCurrentHitPoints());
        assertEquals(1, result.getWarnings().size());
        assertTrue(result.getWarnings().get(0).startsWith("hp_delta -5 ignored"));
    }

    @Test
    void narratorHpDeltaAppliesOutsideCombat() {
        character.applyHpDelta(-6);
        int hpBefore = character.getCurrentHitPoints();
        PlayerStateDelta potion = new PlayerStateDelta();
        potion.setHpDelta(4);

        BatchApplyResult result = service().applyNarration(character, null, null, List.of(potion));

        assertTrue(result.isApplied());
        assertEquals(hpBefore + 4, character.getCurrentHitPoints());
        assertTrue(result.getWarnings().isEmpty());
    }

    @Test
    void failedBatchLeavesStateUntouched() {
        when(statLookup.lookupMonster(anyString())).thenThrow(new IllegalStateException("lookup exploded"));
        Encounter encounter = encounterWith(goblin("a", 50));
        TurnOutcome outcome = outcomeWithPreRoll(
            new NpcAttackRoll("a", "Goblin a", 15, 19, true, false, "1d6", List.of(5), 7));
        int hpBefore = character.getCurrentHitPoints();

        BatchApplyResult result = service().applyNarration(character, encounter, outcome, List.of(
            new UpdateNpcIntent("a", NpcUpdate.damage(3)),
            new CreateNpcIntent("Orc", "orc", Disposition.HOSTILE)));

        assertFalse(result.isApplied());
        assertEquals(BatchApplyResult.FAILURE_MESSAGE, result.getMessage());
        assertEquals(7, encounter.getNpc("a").getCurrentHp());
        assertEquals(1, encounter.getRound());
        assertEquals(hpBefore, character.getCurrentHitPoints());
    }

    @Test
    void hostileNpcOutsideCombatStartsEncounter() {
        BatchApplyResult result = service().applyNarration(character, null, null,
            List.of(new CreateNpcIntent("Orc", "orc", Disposition.HOSTILE)));

        assertTrue(result.isApplied());
        assertEquals(1, result.getCreatedNpcs().size());
        Encounter started = result.getEncounter();
        assertNotNull(started);
        assertTrue(started.isActive());
        assertEquals(1, started.getRound());
        assertEquals(2, started.getTurnOrder().size());
        verify(statLookup).lookupMonster("orc");
    }

    @Test
    void unknownNpcIdIsReportedAsWarning() {
        Encounter encounter = encounterWith(goblin("a", 50));

        BatchApplyResult result = service().applyNarration(character, encounter, outcomeWithPreRoll(),
            List.of(new UpdateNpcIntent("ghost", NpcUpdate.damage(4))));

        assertTrue(result.isApplied());
        assertEquals(List.of("NPC ghost not found"), result.getWarnings());
        assertFalse(result.getNpcUpdates().get(0).isFound());
    }

    @Test
    void unreadableResponsesDegradeGracefully() {
        CombatTurnService service = service();

        TurnOutcome outcome = service.takeTurn(character, null, "I have no idea what the player wants");
        assertEquals(RollResult.Kind.NO_CHECK, outcome.getRollResult().getKind());
        assertNull(outcome.getSnapshot());

        BatchApplyResult result = service.applyNarration(character, null, outcome, "{{{ not json");
        assertFalse(result.isApplied());
    }

    @Test
    void targetIsFoundByIdNameOrPartialName() {
        Encounter encounter = encounterWith(goblin("a", 50), new Npc("w1", "Dire Wolf", 14, 37, 5, "2d6", 3, 200,
            Disposition.HOSTILE));

        assertEquals("a", CombatTurnService.findTarget(encounter, "a").getId());
        assertEquals("w1", CombatTurnService.findTarget(encounter, "dire wolf").getId());
        assertEquals("w1", CombatTurnService.findTarget(encounter, "the wolf").getId());
        assertNull(CombatTurnService.findTarget(encounter, "dragon"));
        assertNull(CombatTurnService.findTarget(null, "a"));
    }

    @Test
    void namelessNpcIsNeverMatchedByName() {
        Npc nameless = new Npc("n1", null, 12, 5, 2, "1d4", 0, 10, Disposition.HOSTILE);
        Npc blank = new Npc("n2", "  ", 12, 5, 2, "1d4", 0, 10, Disposition.HOSTILE);
        Encounter encounter = encounterWith(nameless, blank, goblin("a", 50));

        assertEquals("a", CombatTurnService.findTarget(encounter, "goblin").getId());
        assertNull(CombatTurnService.findTarget(encounter, "dragon"));
        assertEquals("n1", CombatTurnService.findTarget(encounter, "n1").getId());
    }
}
