package com.rpgcore.game_state;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ConditionTest {

    @Test
    void parsesKnownTagsCaseInsensitively() {
        assertEquals(Condition.RAGING, Condition.parse(" Raging "));
        assertEquals(Condition.Kind.POISONED, Condition.parse("poisoned").getKind());
        assertSame(Condition.ALWAYS, Condition.parse(""));
        assertSame(Condition.ALWAYS, Condition.parse(null));
    }

    @Test
    void concentrationCarriesSpellName() {
        Condition colon = Condition.parse("concentrating:Hunter's Mark");
        Condition phrase = Condition.parse("Concentrating on hunter's mark");

        assertEquals(colon, phrase);
        assertTrue(colon.isConcentratingOn("HUNTER'S MARK"));
        assertFalse(colon.isConcentratingOn("hex"));
        assertEquals("concentrating:hunter's mark", colon.toString());
    }

    @Test
    void unknownTagBecomesCustom() {
        Condition blessed = Condition.parse("Blessed");
        assertEquals(Condition.Kind.CUSTOM, blessed.getKind());
        assertEquals("blessed", blessed.toString());
        assertEquals(blessed, Condition.custom("blessed"));
    }

    @Test
    void satisfiedByActiveSet() {
        Set<Condition> active = Set.of(Condition.RAGING, Condition.concentratingOn("bless"));

        assertTrue(Condition.ALWAYS.isSatisfiedBy(List.of()));
        assertTrue(Condition.RAGING.isSatisfiedBy(active));
        assertFalse(Condition.of(Condition.Kind.PRONE).isSatisfiedBy(active));
        assertTrue(Condition.parse("concentrating").isSatisfiedBy(active));
        assertFalse(Condition.concentratingOn("hex").isSatisfiedBy(active));
    }

    @Test
    void customKindNeedsTag() {
        assertThrows(IllegalArgumentException.class, () -> Condition.of(Condition.Kind.CUSTOM));
    }
}
