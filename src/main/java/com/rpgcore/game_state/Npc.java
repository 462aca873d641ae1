package com.rpgcore.game_state;

import java.util.ArrayList;
import java.util.List;

/**
 * Неигровой участник сцены
 */
public class Npc {
    private String id;
    private String name;
    private String slug;
    private int armorClass;
    private int currentHp;
    private int maxHp;
    private int attackBonus;
    private String damageDice;
    private int damageBonus;
    private int savingThrowBonus;
    private int xpValue;
    private Disposition disposition;
    private List<Condition> conditions = new ArrayList<>();
    private int speed = 30;
    private String notes = "";

    public Npc() {
    }

    public Npc(String id, String name, int armorClass, int maxHp, int attackBonus,
               String damageDice, int damageBonus, int xpValue, Disposition disposition) {
        this.id = id;
        this.name = name;
        this.armorClass = armorClass;
        this.maxHp = Math.max(1, maxHp);
        this.currentHp = this.maxHp;
        this.attackBonus = attackBonus;
        this.damageDice = damageDice;
        this.damageBonus = damageBonus;
        this.xpValue = xpValue;
        this.disposition = disposition;
    }

    public Npc copy() {
        Npc copy = new Npc(id, name, armorClass, maxHp, attackBonus, damageDice, damageBonus, xpValue, disposition);
        copy.currentHp = currentHp;
        copy.slug = slug;
        copy.savingThrowBonus = savingThrowBonus;
        copy.conditions = new ArrayList<>(conditions);
        copy.speed = speed;
        copy.notes = notes;
        return copy;
    }

    /**
     * Изменяет HP с ограничением в [0, maxHp] и возвращает новое значение
     */
    public int applyHpDelta(int delta) {
        long raw = (long) currentHp + delta;
        currentHp = (int) Math.max(0, Math.min(maxHp, raw));
        return currentHp;
    }

    public boolean isAlive() {
        return currentHp > 0;
    }

    public boolean isHostile() {
        return disposition == Disposition.HOSTILE;
    }

    public boolean isActiveHostile() {
        return isHostile() && isAlive();
    }

    public void addCondition(Condition condition) {
        if (!conditions.contains(condition)) {
            conditions.add(condition);
        }
    }

    public void removeCondition(Condition condition) {
        conditions.remove(condition);
    }

    // Getters and Setters
    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getSlug() { return slug; }
    public void setSlug(String slug) { this.slug = slug; }

    public int getArmorClass() { return armorClass; }
    public void setArmorClass(int armorClass) { this.armorClass = armorClass; }

    public int getCurrentHp() { return currentHp; }
    public void setCurrentHp(int currentHp) { this.currentHp = Math.max(0, Math.min(maxHp, currentHp)); }

    public int getMaxHp() { return maxHp; }
    public void setMaxHp(int maxHp) { this.maxHp = maxHp; }

    public int getAttackBonus() { return attackBonus; }
    public void setAttackBonus(int attackBonus) { this.attackBonus = attackBonus; }

    public String getDamageDice() { return damageDice; }
    public void setDamageDice(String damageDice) { this.damageDice = damageDice; }

    public int getDamageBonus() { return damageBonus; }
    public void setDamageBonus(int damageBonus) { this.damageBonus = damageBonus; }

    public int getSavingThrowBonus() { return savingThrowBonus; }
    public void setSavingThrowBonus(int savingThrowBonus) { this.savingThrowBonus = savingThrowBonus; }

    public int getXpValue() { return xpValue; }
    public void setXpValue(int xpValue) { this.xpValue = xpValue; }

    public Disposition getDisposition() { return disposition; }
    public void setDisposition(Disposition disposition) { this.disposition = disposition; }

    public List<Condition> getConditions() { return conditions; }
    public void setConditions(List<Condition> conditions) { this.conditions = conditions; }

    public int getSpeed() { return speed; }
    public void setSpeed(int speed) { this.speed = speed; }

    public String getNotes() { return notes; }
    public void setNotes(String notes) { this.notes = notes; }
}
