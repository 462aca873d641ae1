package com.rpgcore.srd;

/**
 * Характеристики для существ, которых нет в справочнике
 */
public class NpcFallback {
    public static final NpcFallback DEFAULT = new NpcFallback(12, 11, 3, "1d6+1", 50);

    private final int armorClass;
    private final int hitPoints;
    private final int attackBonus;
    private final String damageDice;
    private final int xp;

    public NpcFallback(int armorClass, int hitPoints, int attackBonus, String damageDice, int xp) {
        this.armorClass = armorClass;
        this.hitPoints = hitPoints;
        this.attackBonus = attackBonus;
        this.damageDice = damageDice;
        this.xp = xp;
    }

    public int getArmorClass() { return armorClass; }
    public int getHitPoints() { return hitPoints; }
    public int getAttackBonus() { return attackBonus; }
    public String getDamageDice() { return damageDice; }
    public int getXp() { return xp; }
}
