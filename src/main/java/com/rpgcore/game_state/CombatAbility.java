package com.rpgcore.game_state;

import java.util.Map;
import java.util.TreeMap;

/**
 * Оружие, заговор, заклинание или действие, доступное персонажу в бою
 */
public class CombatAbility {

    public enum Type { WEAPON, CANTRIP, SPELL, ACTION, RACIAL }

    /** Как способность выбирает цель */
    public enum AttackKind { MELEE, RANGED, SAVE, AUTO, NONE }

    /** Характеристика для оружия; FINESSE берёт лучшую из STR и DEX */
    public enum WeaponStat { STR, DEX, FINESSE, NONE }

    private String id;
    private String name;
    private Type type;
    private AttackKind attackKind;
    private WeaponStat weaponStat;
    private int weaponBonus;
    private String damageRoll;
    private String damageType;
    private Ability saveAbility;
    /** Характеристика для DC спасброска (CON у Breath Weapon); null означает заклинательную */
    private Ability saveDcAbility;
    /** Расовые способности: уровень персонажа → кубики урона с этого уровня */
    private Map<Integer, String> racialScaling = new TreeMap<>();
    private boolean requiresTarget = true;

    public CombatAbility() {
    }

    public static CombatAbility weapon(String name, WeaponStat stat, String damageRoll, String damageType) {
        CombatAbility ability = new CombatAbility();
        ability.id = "weapon:" + name.toLowerCase().replaceAll("\\s+", "-");
        ability.name = name;
        ability.type = Type.WEAPON;
        ability.attackKind = stat == WeaponStat.DEX ? AttackKind.RANGED : AttackKind.MELEE;
        ability.weaponStat = stat;
        ability.damageRoll = damageRoll;
        ability.damageType = damageType;
        return ability;
    }

    public static CombatAbility spell(String name, Type type, AttackKind attackKind,
                                      String damageRoll, String damageType) {
        CombatAbility ability = new CombatAbility();
        String prefix = type == Type.CANTRIP ? "cantrip:" : type == Type.RACIAL ? "racial:" : "spell:";
        ability.id = prefix + name.toLowerCase().replaceAll("\\s+", "-");
        ability.name = name;
        ability.type = type;
        ability.attackKind = attackKind;
        ability.weaponStat = WeaponStat.NONE;
        ability.damageRoll = damageRoll;
        ability.damageType = damageType;
        return ability;
    }

    public static CombatAbility action(String name) {
        CombatAbility ability = new CombatAbility();
        ability.id = "action:" + name.toLowerCase().replaceAll("\\s+", "-");
        ability.name = name;
        ability.type = Type.ACTION;
        ability.attackKind = AttackKind.NONE;
        ability.weaponStat = WeaponStat.NONE;
        ability.requiresTarget = false;
        return ability;
    }

    /**
     * Дальнобойное оружие использует DEX, всё остальное считается ближним боем
     */
    public boolean isMelee() {
        if (type == Type.WEAPON) {
            return weaponStat != WeaponStat.DEX;
        }
        return attackKind == AttackKind.MELEE;
    }

    /**
     * Кубики урона с учётом расового роста: берётся наибольший порог, не превышающий уровень
     */
    public String damageRollForLevel(int level) {
        if (type != Type.RACIAL || racialScaling == null || racialScaling.isEmpty()) {
            return damageRoll;
        }
        String scaled = null;
        int best = Integer.MIN_VALUE;
        for (Map.Entry<Integer, String> entry : racialScaling.entrySet()) {
            if (entry.getKey() != null && entry.getKey() <= level && entry.getKey() > best && entry.getValue() != null) {
                best = entry.getKey();
                scaled = entry.getValue();
            }
        }
        return scaled != null ? scaled : damageRoll;
    }

    // Getters and Setters
    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public Type getType() { return type; }
    public void setType(Type type) { this.type = type; }

    public AttackKind getAttackKind() { return attackKind; }
    public void setAttackKind(AttackKind attackKind) { this.attackKind = attackKind; }

    public WeaponStat getWeaponStat() { return weaponStat; }
    public void setWeaponStat(WeaponStat weaponStat) { this.weaponStat = weaponStat; }

    public int getWeaponBonus() { return weaponBonus; }
    public void setWeaponBonus(int weaponBonus) { this.weaponBonus = weaponBonus; }

    public String getDamageRoll() { return damageRoll; }
    public void setDamageRoll(String damageRoll) { this.damageRoll = damageRoll; }

    public String getDamageType() { return damageType; }
    public void setDamageType(String damageType) { this.damageType = damageType; }

    public Ability getSaveAbility() { return saveAbility; }
    public void setSaveAbility(Ability saveAbility) { this.saveAbility = saveAbility; }

    public Ability getSaveDcAbility() { return saveDcAbility; }
    public void setSaveDcAbility(Ability saveDcAbility) { this.saveDcAbility = saveDcAbility; }

    public Map<Integer, String> getRacialScaling() { return racialScaling; }
    public void setRacialScaling(Map<Integer, String> racialScaling) { this.racialScaling = racialScaling; }

    public boolean isRequiresTarget() { return requiresTarget; }
    public void setRequiresTarget(boolean requiresTarget) { this.requiresTarget = requiresTarget; }
}
