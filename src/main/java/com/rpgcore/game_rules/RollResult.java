package com.rpgcore.game_rules;

import java.util.Collections;
import java.util.List;

/**
 * Результат разрешения одного действия.
 * <p>
 * {@link Kind#IMPOSSIBLE} и {@link Kind#NO_CHECK} не содержат бросков и не считаются
 * проваленной проверкой; числовые поля у них нулевые, {@link #getTarget()} равен null.
 */
public class RollResult {

    public enum Kind { ROLLED, IMPOSSIBLE, NO_CHECK }

    private final Kind kind;
    private final String checkType;
    private final List<String> components;
    private final int dieResult;
    private final int totalModifier;
    private final int total;
    private final Integer target;
    private final boolean success;
    private final String notes;
    private final DamageRoll damage;

    private RollResult(Kind kind, String checkType, List<String> components, int dieResult, int totalModifier,
                       int total, Integer target, boolean success, String notes, DamageRoll damage) {
        this.kind = kind;
        this.checkType = checkType;
        this.components = Collections.unmodifiableList(components);
        this.dieResult = dieResult;
        this.totalModifier = totalModifier;
        this.total = total;
        this.target = target;
        this.success = success;
        this.notes = notes;
        this.damage = damage;
    }

    public static RollResult rolled(String checkType, List<String> components, int dieResult, int totalModifier,
                                    int target, boolean success, String notes, DamageRoll damage) {
        return new RollResult(Kind.ROLLED, checkType, components, dieResult, totalModifier,
            dieResult + totalModifier, target, success, notes, damage);
    }

    public static RollResult impossible(String reason) {
        return new RollResult(Kind.IMPOSSIBLE, "IMPOSSIBLE", List.of(), 0, 0, 0, null, false, reason, null);
    }

    public static RollResult noCheck(String reason) {
        return new RollResult(Kind.NO_CHECK, "NONE", List.of(), 0, 0, 0, null, false, reason, null);
    }

    public boolean isRolled() { return kind == Kind.ROLLED; }

    public Kind getKind() { return kind; }
    public String getCheckType() { return checkType; }

    /** Слагаемые модификатора: "STR +3", "Prof +2" */
    public List<String> getComponents() { return components; }

    /** Значение на d20 после Reliable Talent; без модификаторов */
    public int getDieResult() { return dieResult; }
    public int getTotalModifier() { return totalModifier; }
    public int getTotal() { return total; }

    /** КД или DC, с которым сравнивался бросок */
    public Integer getTarget() { return target; }
    public boolean isSuccess() { return success; }
    public String getNotes() { return notes; }

    /** Урон при попадании; null при промахе и для проверок */
    public DamageRoll getDamage() { return damage; }

    public int getTotalDamage() { return damage == null ? 0 : damage.getTotalDamage(); }
}
