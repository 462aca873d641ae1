package com.rpgcore.game_rules;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RollSummaryFormatterTest {

    @Test
    void formatsRolledAttackWithDamage() {
        DamageRoll damage = new DamageRoll(List.of(
            new DamageBreakdown("Longsword", "1d8", List.of(5), 3, "slashing")), false);
        RollResult result = RollResult.rolled("Longsword Attack", List.of("STR +3", "Prof +2", "Effects +1"),
            15, 6, 20, true, "Attack hits", damage);

        String expected = String.join("\n",
            "CHECK: Longsword Attack",
            "COMPONENTS: STR +3, Prof +2, Effects +1 = +6",
            "ROLL: 15 + +6 = 21",
            "DC/AC: 20",
            "RESULT: SUCCESS",
            "DAMAGE: Longsword: 1d8 [5]+3 = 8 slashing | TOTAL 8",
            "NOTES: Attack hits");
        assertEquals(expected, RollSummaryFormatter.format(result));
    }

    @Test
    void failedCheckHasNoDamage() {
        RollResult result = RollResult.rolled("Stealth Check", List.of("DEX -1"), 4, -1, 15, false, "Check fails", null);

        String summary = RollSummaryFormatter.format(result);
        assertTrue(summary.contains("ROLL: 4 + -1 = 3"));
        assertTrue(summary.contains("RESULT: FAILURE"));
        assertTrue(summary.contains("DAMAGE: N/A"));
    }

    @Test
    void nonRolledResultsAreShort() {
        assertEquals("CHECK: IMPOSSIBLE\nNOTES: You cannot fly.",
            RollSummaryFormatter.format(RollResult.impossible("You cannot fly.")));
        assertEquals("CHECK: NONE\nNOTES: No roll needed.",
            RollSummaryFormatter.format(RollResult.noCheck("No roll needed.")));
    }

    @Test
    void criticalDamageIsMarked() {
        DamageRoll damage = new DamageRoll(List.of(
            new DamageBreakdown("Dagger", "2d4", List.of(1, 4), 2, "piercing"),
            DamageBreakdown.flat("Great Weapon Master", 10, "piercing")), true);
        RollResult result = RollResult.rolled("Dagger Attack", List.of("DEX +2"), 20, 2, 14, true,
            "Natural 20: critical hit!", damage);

        assertTrue(RollSummaryFormatter.format(result).contains(
            "DAMAGE: Dagger: 2d4 [1, 4]+2 = 7 piercing; Great Weapon Master: +10 = 10 piercing | TOTAL 17 (critical)"));
    }
}
