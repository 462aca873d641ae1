package com.rpgcore.game_rules;

import java.util.Collections;
import java.util.List;

public class DamageRoll {
    private final List<DamageBreakdown> breakdown;
    private final int totalDamage;
    private final boolean crit;

    public DamageRoll(List<DamageBreakdown> breakdown, boolean crit) {
        this.breakdown = Collections.unmodifiableList(breakdown);
        this.totalDamage = breakdown.stream().mapToInt(DamageBreakdown::getSubtotal).sum();
        this.crit = crit;
    }

    public List<DamageBreakdown> getBreakdown() { return breakdown; }
    public int getTotalDamage() { return totalDamage; }
    public boolean isCrit() { return crit; }
}
