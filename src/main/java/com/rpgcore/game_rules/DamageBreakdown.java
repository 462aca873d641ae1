package com.rpgcore.game_rules;

import java.util.Collections;
import java.util.List;

/**
 * Урон от одного источника: оружие, Sneak Attack, Divine Smite и т.д.
 */
public class DamageBreakdown {
    private final String label;
    private final String dice;
    private final List<Integer> rolls;
    private final int flatBonus;
    private final int subtotal;
    private final String damageType;

    public DamageBreakdown(String label, String dice, List<Integer> rolls, int flatBonus, String damageType) {
        this.label = label;
        this.dice = dice == null ? "" : dice;
        this.rolls = rolls == null ? List.of() : Collections.unmodifiableList(rolls);
        this.flatBonus = flatBonus;
        this.subtotal = Math.max(0, this.rolls.stream().mapToInt(Integer::intValue).sum() + flatBonus);
        this.damageType = damageType;
    }

    /** Источник только с плоским бонусом, без кубиков */
    public static DamageBreakdown flat(String label, int flatBonus, String damageType) {
        return new DamageBreakdown(label, "", List.of(), flatBonus, damageType);
    }

    public String getLabel() { return label; }
    public String getDice() { return dice; }
    public List<Integer> getRolls() { return rolls; }
    public int getFlatBonus() { return flatBonus; }
    public int getSubtotal() { return subtotal; }
    public String getDamageType() { return damageType; }
}
