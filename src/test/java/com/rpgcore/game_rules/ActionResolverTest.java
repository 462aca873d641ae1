package com.rpgcore.game_rules;

import com.rpgcore.game_state.Ability;
import com.rpgcore.game_state.AbilityScores;
import com.rpgcore.game_state.Character;
import com.rpgcore.game_state.CharacterClass;
import com.rpgcore.game_state.CharacterFeature;
import com.rpgcore.game_state.CombatAbility;
import com.rpgcore.game_state.Condition;
import com.rpgcore.game_state.Disposition;
import com.rpgcore.game_state.EffectContribution;
import com.rpgcore.game_state.EffectKind;
import com.rpgcore.game_state.GameplayEffect;
import com.rpgcore.game_state.Npc;
import com.rpgcore.game_state.Skill;
import com.rpgcore.intents.AttackIntent;
import com.rpgcore.intents.ExtraDamageRequest;
import com.rpgcore.intents.ExtraDamageSource;
import com.rpgcore.intents.NoCheckIntent;
import com.rpgcore.intents.SavingThrowIntent;
import com.rpgcore.intents.SkillCheckIntent;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ActionResolverTest {
    private final EffectAggregator aggregator = new EffectAggregator();

    private static ActionResolver resolver(int... faces) {
        return new ActionResolver(new DiceRoller(new ScriptedRandom(faces)));
    }

    private static Character fighter() {
        Character character = new Character("pc-1", "Brom", CharacterClass.FIGHTER, 1,
            new AbilityScores(16, 12, 14, 10, 10, 8));
        character.getWeaponProficiencies().add("martial weapons");
        character.getAbilities().add(CombatAbility.weapon("Longsword", CombatAbility.WeaponStat.STR, "1d8", "slashing"));
        return character;
    }

    private static Npc goblin(int armorClass, int hp) {
        return new Npc("goblin-1", "Goblin", armorClass, hp, 4, "1d6", 2, 50, Disposition.HOSTILE);
    }

    @Test
    void weaponHitAddsAbilityModifierToDamage() {
        Character character = fighter();
        character.getFeatures().add(new CharacterFeature("Keen Edge", 1,
            GameplayEffect.always(EffectContribution.amount(EffectKind.MELEE_ATTACK_BONUS, 1))));

        RollResult result = resolver(15, 5).resolve(new AttackIntent("Longsword", "goblin-1"),
            aggregator.aggregate(character), goblin(20, 20));

        assertEquals(List.of("STR +3", "Prof +2", "Effects +1"), result.getComponents());
        assertEquals(6, result.getTotalModifier());
        assertEquals(21, result.getTotal());
        assertEquals(20, result.getTarget());
        assertTrue(result.isSuccess());
        assertEquals(8, result.getTotalDamage());
        assertEquals("Attack hits", result.getNotes());
    }

    @Test
    void criticalHitDoublesDiceButNotFlatBonus() {
        RollResult result = resolver(20, 4, 6).resolve(new AttackIntent("Longsword", "goblin-1"),
            aggregator.aggregate(fighter()), goblin(30, 30));

        DamageRoll damage = result.getDamage();
        assertTrue(damage.isCrit());
        DamageBreakdown weapon = damage.getBreakdown().get(0);
        assertEquals("2d8", weapon.getDice());
        assertEquals(List.of(4, 6), weapon.getRolls());
        assertEquals(3, weapon.getFlatBonus());
        assertEquals(13, result.getTotalDamage());
        assertTrue(result.getNotes().startsWith("Natural 20"));
    }

    @Test
    void naturalOneAlwaysMisses() {
        RollResult result = resolver(1).resolve(new AttackIntent("Longsword", "goblin-1"),
            aggregator.aggregate(fighter()), goblin(2, 7));

        assertFalse(result.isSuccess());
        assertNull(result.getDamage());
        assertEquals("Natural 1: automatic miss", result.getNotes());
    }

    @Test
    void unknownWeaponIsImpossible() {
        RollResult result = resolver().resolve(new AttackIntent("Vorpal Blade", "goblin-1"),
            aggregator.aggregate(fighter()), goblin(12, 7));

        assertEquals(RollResult.Kind.IMPOSSIBLE, result.getKind());
        assertTrue(result.getNotes().contains("is not among Brom's weapons"));
    }

    @Test
    void missingOrDeadTargetIsImpossible() {
        DerivedStats stats = aggregator.aggregate(fighter());
        RollResult missing = resolver().resolve(new AttackIntent("Longsword", "dragon"), stats, null);
        assertEquals(RollResult.Kind.IMPOSSIBLE, missing.getKind());
        assertTrue(missing.getNotes().contains("\"dragon\""));

        Npc dead = goblin(12, 7);
        dead.applyHpDelta(-7);
        RollResult down = resolver().resolve(new AttackIntent("Longsword", "goblin-1"), stats, dead);
        assertEquals("Goblin is already down", down.getNotes());
    }

    @Test
    void utilityActionNeedsNoRoll() {
        Character character = fighter();
        character.getAbilities().add(CombatAbility.action("Second Wind"));

        RollResult result = resolver().resolve(new AttackIntent("Second Wind", null),
            aggregator.aggregate(character), null);

        assertEquals(RollResult.Kind.NO_CHECK, result.getKind());
    }

    @Test
    void halfProficiencyRoundsDown() {
        Character bard = new Character("pc-2", "Lyra", CharacterClass.BARD, 5, new AbilityScores());
        bard.getFeatures().add(new CharacterFeature("Jack of All Trades", 2,
            GameplayEffect.always(EffectContribution.flag(EffectKind.HALF_PROFICIENCY))));

        RollResult result = resolver(12).resolve(new SkillCheckIntent(Skill.ATHLETICS, 13),
            aggregator.aggregate(bard), null);

        assertEquals(List.of("STR +0", "Half Prof +1"), result.getComponents());
        assertEquals(13, result.getTotal());
        assertTrue(result.isSuccess());
        assertEquals("Athletics Check", result.getCheckType());
    }

    @Test
    void reliableTalentRaisesLowRollsOnProficientChecks() {
        Character rogue = new Character("pc-3", "Vex", CharacterClass.ROGUE, 11, new AbilityScores(10, 18, 12, 12, 10, 10));
        rogue.getSkillProficiencies().add(Skill.STEALTH);
        rogue.getFeatures().add(new CharacterFeature("Reliable Talent", 11,
            GameplayEffect.always(EffectContribution.amount(EffectKind.MIN_CHECK_ROLL, 10))));

        RollResult result = resolver(3).resolve(new SkillCheckIntent(Skill.STEALTH, 15),
            aggregator.aggregate(rogue), null);

        assertEquals(10, result.getDieResult());
        assertEquals(18, result.getTotal());
        assertTrue(result.getNotes().contains("Reliable Talent: d20 3 -> 10"));
    }

    @Test
    void expertiseDoublesProficiency() {
        Character rogue = new Character("pc-3", "Vex", CharacterClass.ROGUE, 1, new AbilityScores(10, 16, 12, 12, 10, 10));
        rogue.getSkillProficiencies().add(Skill.STEALTH);
        rogue.getFeatures().add(new CharacterFeature("Expertise", 1, null, "stealth, thieves' tools"));

        RollResult result = resolver(10).resolve(new SkillCheckIntent(Skill.STEALTH, 15),
            aggregator.aggregate(rogue), null);

        assertEquals(List.of("DEX +3", "Expertise +4"), result.getComponents());
        assertEquals(17, result.getTotal());
    }

    @Test
    void savingThrowUsesProficiency() {
        Character character = fighter();
        character.getSavingThrowProficiencies().add(Ability.CONSTITUTION);

        RollResult result = resolver(9).resolve(new SavingThrowIntent(Ability.CONSTITUTION, 12, "poison gas"),
            aggregator.aggregate(character), null);

        assertEquals("Constitution Saving Throw", result.getCheckType());
        assertEquals(13, result.getTotal());
        assertEquals("Save succeeds (poison gas)", result.getNotes());
    }

    @Test
    void divineSmiteAddsRadiantDiceByTier() {
        Character paladin = new Character("pc-4", "Aria", CharacterClass.PALADIN, 5, new AbilityScores(16, 10, 14, 8, 10, 16));
        paladin.getWeaponProficiencies().add("martial weapons");
        paladin.getAbilities().add(CombatAbility.weapon("Longsword", CombatAbility.WeaponStat.STR, "1d8", "slashing"));
        paladin.getFeatures().add(new CharacterFeature("Divine Smite", 2));

        AttackIntent intent = new AttackIntent("Longsword", "goblin-1",
            List.of(new ExtraDamageRequest(ExtraDamageSource.DIVINE_SMITE, 2)));
        RollResult result = resolver(15, 5, 2, 3, 4).resolve(intent, aggregator.aggregate(paladin), goblin(15, 40));

        List<DamageBreakdown> breakdown = result.getDamage().getBreakdown();
        assertEquals(2, breakdown.size());
        assertEquals("Divine Smite", breakdown.get(1).getLabel());
        assertEquals("3d8", breakdown.get(1).getDice());
        assertEquals("radiant", breakdown.get(1).getDamageType());
        assertEquals(17, result.getTotalDamage());
    }

    @Test
    void rageIsRejectedWhenNotRaging() {
        Character barbarian = new Character("pc-5", "Grog", CharacterClass.BARBARIAN, 1, new AbilityScores(18, 12, 16, 8, 10, 10));
        barbarian.getWeaponProficiencies().add("martial weapons");
        barbarian.getAbilities().add(CombatAbility.weapon("Greataxe", CombatAbility.WeaponStat.STR, "1d12", "slashing"));
        barbarian.getFeatures().add(new CharacterFeature("Rage", 1));

        AttackIntent intent = new AttackIntent("Greataxe", "goblin-1", List.of(new ExtraDamageRequest(ExtraDamageSource.RAGE)));
        RollResult result = resolver(12, 7).resolve(intent, aggregator.aggregate(barbarian), goblin(13, 30));

        assertEquals(11, result.getTotalDamage());
        assertTrue(result.getNotes().contains("Rage not applied: Grog is not raging"));
    }

    @Test
    void rageEffectAlreadyAppliedIsNotCountedTwice() {
        Character barbarian = new Character("pc-5", "Grog", CharacterClass.BARBARIAN, 1, new AbilityScores(18, 12, 16, 8, 10, 10));
        barbarian.getWeaponProficiencies().add("martial weapons");
        barbarian.getAbilities().add(CombatAbility.weapon("Greataxe", CombatAbility.WeaponStat.STR, "1d12", "slashing"));
        barbarian.getFeatures().add(new CharacterFeature("Rage", 1,
            GameplayEffect.when(Condition.RAGING, EffectContribution.amount(EffectKind.MELEE_DAMAGE_BONUS, 2))));
        barbarian.addCondition(Condition.RAGING);

        AttackIntent intent = new AttackIntent("Greataxe", "goblin-1", List.of(new ExtraDamageRequest(ExtraDamageSource.RAGE)));
        RollResult result = resolver(12, 7).resolve(intent, aggregator.aggregate(barbarian), goblin(13, 30));

        assertEquals(1, result.getDamage().getBreakdown().size());
        assertEquals(13, result.getTotalDamage());
        assertTrue(result.getNotes().contains("Rage damage already included in damage bonus"));
    }

    @Test
    void rageWithoutEffectAddsFlatBonus() {
        Character barbarian = new Character("pc-5", "Grog", CharacterClass.BARBARIAN, 9, new AbilityScores(18, 12, 16, 8, 10, 10));
        barbarian.getWeaponProficiencies().add("martial weapons");
        barbarian.getAbilities().add(CombatAbility.weapon("Greataxe", CombatAbility.WeaponStat.STR, "1d12", "slashing"));
        barbarian.getFeatures().add(new CharacterFeature("Rage", 1));
        barbarian.addCondition(Condition.RAGING);

        AttackIntent intent = new AttackIntent("Greataxe", "goblin-1", List.of(new ExtraDamageRequest(ExtraDamageSource.RAGE)));
        RollResult result = resolver(12, 7).resolve(intent, aggregator.aggregate(barbarian), goblin(13, 30));

        DamageBreakdown rage = result.getDamage().getBreakdown().get(1);
        assertEquals("Rage", rage.getLabel());
        assertEquals(3, rage.getSubtotal());
        assertEquals(14, result.getTotalDamage());
    }

    @Test
    void greatWeaponMasterTradesAccuracyForDamage() {
        Character character = fighter();
        character.getAbilities().add(CombatAbility.weapon("Greatsword", CombatAbility.WeaponStat.STR, "2d6", "slashing"));
        character.getFeatures().add(new CharacterFeature("Great Weapon Master", 4));

        AttackIntent intent = new AttackIntent("Greatsword", "goblin-1",
            List.of(new ExtraDamageRequest(ExtraDamageSource.GREAT_WEAPON_MASTER)));
        RollResult result = resolver(14, 3, 4).resolve(intent, aggregator.aggregate(character), goblin(13, 40));

        assertTrue(result.getComponents().contains("Great Weapon Master -5"));
        assertEquals(0, result.getTotalModifier());
        assertTrue(result.isSuccess());
        assertEquals(20, result.getTotalDamage());
    }

    @Test
    void hexOnSpellAttackRequiresConcentration() {
        Character warlock = new Character("pc-6", "Mor", CharacterClass.WARLOCK, 5, new AbilityScores(8, 14, 14, 10, 10, 16));
        warlock.getAbilities().add(CombatAbility.spell("Eldritch Blast", CombatAbility.Type.CANTRIP,
            CombatAbility.AttackKind.RANGED, "1d10", "force"));
        AttackIntent intent = new AttackIntent("Eldritch Blast", "goblin-1", List.of(new ExtraDamageRequest(ExtraDamageSource.HEX)));

        RollResult unfocused = resolver(10, 6).resolve(intent, aggregator.aggregate(warlock), goblin(12, 30));
        assertEquals(6, unfocused.getTotalDamage());
        assertTrue(unfocused.getNotes().contains("Hex not applied: not concentrating on Hex"));

        warlock.addCondition(Condition.concentratingOn("Hex"));
        RollResult focused = resolver(10, 6, 4).resolve(intent, aggregator.aggregate(warlock), goblin(12, 30));
        assertEquals(List.of("CHA +3", "Prof +3"), focused.getComponents());
        assertEquals(10, focused.getTotalDamage());
        assertEquals("necrotic", focused.getDamage().getBreakdown().get(1).getDamageType());
    }

    @Test
    void saveSpellLandsWhenTargetFailsAgainstSpellDc() {
        Character wizard = new Character("pc-7", "Ezra", CharacterClass.WIZARD, 1, new AbilityScores(8, 14, 12, 16, 12, 10));
        CombatAbility spray = CombatAbility.spell("Poison Spray", CombatAbility.Type.CANTRIP,
            CombatAbility.AttackKind.SAVE, "1d12", "poison");
        spray.setSaveAbility(Ability.CONSTITUTION);
        wizard.getAbilities().add(spray);
        Npc target = goblin(12, 30);
        target.setSavingThrowBonus(1);

        RollResult result = resolver(8, 7).resolve(new AttackIntent("Poison Spray", "goblin-1"),
            aggregator.aggregate(wizard), target);

        assertEquals("Poison Spray (CON save)", result.getCheckType());
        assertEquals(13, result.getTarget());
        assertEquals(9, result.getTotal());
        assertTrue(result.isSuccess());
        assertEquals(7, result.getTotalDamage());
    }

    @Test
    void racialSaveUsesItsOwnDcAbilityAndScalesWithLevel() {
        Character dragonborn = new Character("pc-8", "Kava", CharacterClass.FIGHTER, 6, new AbilityScores(16, 12, 14, 10, 10, 8));
        CombatAbility breath = CombatAbility.spell("Breath Weapon", CombatAbility.Type.RACIAL,
            CombatAbility.AttackKind.SAVE, "2d6", "fire");
        breath.setSaveAbility(Ability.DEXTERITY);
        breath.setSaveDcAbility(Ability.CONSTITUTION);
        breath.getRacialScaling().put(6, "3d6");
        breath.getRacialScaling().put(11, "4d6");
        dragonborn.getAbilities().add(breath);
        Npc target = goblin(12, 30);
        target.setSavingThrowBonus(1);

        RollResult result = resolver(8, 2, 3, 4).resolve(new AttackIntent("Breath Weapon", "goblin-1"),
            aggregator.aggregate(dragonborn), target);

        // 8 + CON +2 + Prof +3
        assertEquals(13, result.getTarget());
        assertTrue(result.isSuccess());
        assertEquals("3d6", result.getDamage().getBreakdown().get(0).getDice());
        assertEquals(9, result.getTotalDamage());
        assertTrue(result.getNotes().contains("CON +2"));
    }

    @Test
    void racialScalingFallsBackToBaseDiceBelowFirstThreshold() {
        CombatAbility breath = CombatAbility.spell("Breath Weapon", CombatAbility.Type.RACIAL,
            CombatAbility.AttackKind.SAVE, "2d6", "fire");
        breath.getRacialScaling().put(6, "3d6");
        breath.getRacialScaling().put(11, "4d6");

        assertEquals("2d6", breath.damageRollForLevel(5));
        assertEquals("3d6", breath.damageRollForLevel(10));
        assertEquals("4d6", breath.damageRollForLevel(20));
    }

    @Test
    void unknownIntentProducesNoCheck() {
        DerivedStats stats = aggregator.aggregate(fighter());
        assertEquals(RollResult.Kind.NO_CHECK, resolver().resolve(null, stats, null).getKind());
        RollResult noCheck = resolver().resolve(new NoCheckIntent("Walks to the door."), stats, null);
        assertEquals("Walks to the door.", noCheck.getNotes());
    }
}
