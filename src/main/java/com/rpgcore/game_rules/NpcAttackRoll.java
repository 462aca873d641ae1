package com.rpgcore.game_rules;

import java.util.Collections;
import java.util.List;

/**
 * Предброшенная атака одного NPC
 */
public class NpcAttackRoll {
    private final String npcId;
    private final String npcName;
    private final int d20;
    private final int attackTotal;
    private final boolean hit;
    private final boolean crit;
    private final String damageDice;
    private final List<Integer> damageRolls;
    private final int damage;

    public NpcAttackRoll(String npcId, String npcName, int d20, int attackTotal, boolean hit, boolean crit,
                         String damageDice, List<Integer> damageRolls, int damage) {
        this.npcId = npcId;
        this.npcName = npcName;
        this.d20 = d20;
        this.attackTotal = attackTotal;
        this.hit = hit;
        this.crit = crit;
        this.damageDice = damageDice;
        this.damageRolls = damageRolls == null ? List.of() : Collections.unmodifiableList(damageRolls);
        this.damage = damage;
    }

    public String getNpcId() { return npcId; }
    public String getNpcName() { return npcName; }
    public int getD20() { return d20; }
    public int getAttackTotal() { return attackTotal; }
    public boolean isHit() { return hit; }
    public boolean isCrit() { return crit; }
    public String getDamageDice() { return damageDice; }
    public List<Integer> getDamageRolls() { return damageRolls; }
    public int getDamage() { return damage; }
}
