package com.rpgcore.game_rules;

import com.rpgcore.game_state.Disposition;
import com.rpgcore.game_state.Npc;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class NpcPreRollEngineTest {

    private static Npc npc(String id, String name, int attackBonus, String dice, int damageBonus, Disposition disposition) {
        return new Npc(id, name, 13, 10, attackBonus, dice, damageBonus, 50, disposition);
    }

    @Test
    void rollsEachHostileAgainstPlayerArmorClass() {
        ScriptedRandom random = new ScriptedRandom(18, 4, 10);
        NpcPreRollEngine engine = new NpcPreRollEngine(new DiceRoller(random));
        Npc orc = npc("orc-1", "Orc", 4, "1d6", 2, Disposition.HOSTILE);
        Npc kobold = npc("kobold-1", "Kobold", 2, "1d4", 0, Disposition.HOSTILE);

        PreRollResult result = engine.preRoll(List.of(orc, kobold), 16);

        NpcAttackRoll orcRoll = result.getPerNpc().get(0);
        assertEquals(22, orcRoll.getAttackTotal());
        assertTrue(orcRoll.isHit());
        assertEquals(6, orcRoll.getDamage());

        NpcAttackRoll koboldRoll = result.getPerNpc().get(1);
        assertEquals(12, koboldRoll.getAttackTotal());
        assertFalse(koboldRoll.isHit());
        assertEquals(0, koboldRoll.getDamage());

        assertEquals(6, result.getTotalDamage());
        assertEquals(String.join("\n",
            "Orc [id=orc-1]: d20 18 +4 = 22 vs AC 16 -> HIT, 6 damage (1d6 [4] +2)",
            "Kobold [id=kobold-1]: d20 10 +2 = 12 vs AC 16 -> MISS",
            "TOTAL DAMAGE TO PLAYER: 6"), result.getLedgerText());
        assertEquals(0, random.remaining());
    }

    @Test
    void skipsDeadAndNonHostileNpcs() {
        Npc dead = npc("wolf-1", "Wolf", 4, "2d4", 2, Disposition.HOSTILE);
        dead.applyHpDelta(-100);
        Npc friend = npc("guard-1", "Guard", 3, "1d8", 1, Disposition.FRIENDLY);

        PreRollResult result = new NpcPreRollEngine(new DiceRoller(new ScriptedRandom()))
            .preRoll(List.of(dead, friend), 15);

        assertTrue(result.isEmpty());
        assertEquals(PreRollResult.NO_ATTACKS_LEDGER, result.getLedgerText());
        assertEquals(0, result.getTotalDamage());
    }

    @Test
    void criticalDoublesDiceAndNaturalOneMisses() {
        NpcPreRollEngine engine = new NpcPreRollEngine(new DiceRoller(new ScriptedRandom(20, 3, 5, 2, 6, 1)));
        Npc ogre = npc("ogre-1", "Ogre", 6, "2d8", 4, Disposition.HOSTILE);
        Npc ogre2 = npc("ogre-2", "Ogre 2", 30, "2d8", 4, Disposition.HOSTILE);

        PreRollResult result = engine.preRoll(List.of(ogre, ogre2), 40);

        NpcAttackRoll crit = result.getPerNpc().get(0);
        assertTrue(crit.isCrit());
        assertEquals("4d8", crit.getDamageDice());
        assertFalse(result.getPerNpc().get(1).isHit());
        assertTrue(result.getLedgerText().contains("MISS (natural 1)"));
    }

    @Test
    void damageFromSelectsKilledAttackers() {
        NpcPreRollEngine engine = new NpcPreRollEngine(new DiceRoller(new ScriptedRandom(15, 5, 15, 2)));
        PreRollResult result = engine.preRoll(List.of(
            npc("a", "Bandit A", 3, "1d6", 2, Disposition.HOSTILE),
            npc("b", "Bandit B", 3, "1d6", 1, Disposition.HOSTILE)), 12);

        assertEquals(10, result.getTotalDamage());
        assertEquals(7, result.damageFrom(Set.of("a")));
        assertEquals(0, result.damageFrom(Set.of("nobody")));
    }
}
