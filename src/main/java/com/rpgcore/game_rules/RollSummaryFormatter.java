package com.rpgcore.game_rules;

import java.util.ArrayList;
import java.util.List;

/**
 * Текстовая сводка броска для рассказчика:
 * CHECK / COMPONENTS / ROLL / DC/AC / RESULT / DAMAGE / NOTES
 */
public final class RollSummaryFormatter {

    private RollSummaryFormatter() {
    }

    public static String format(RollResult result) {
        switch (result.getKind()) {
            case IMPOSSIBLE:
                return "CHECK: IMPOSSIBLE\nNOTES: " + result.getNotes();
            case NO_CHECK:
                return "CHECK: NONE\nNOTES: " + result.getNotes();
            default:
                break;
        }

        List<String> lines = new ArrayList<>();
        lines.add("CHECK: " + result.getCheckType());
        lines.add("COMPONENTS: " + String.join(", ", result.getComponents())
            + " = " + formatModifier(result.getTotalModifier()));
        lines.add("ROLL: " + result.getDieResult() + " + " + formatModifier(result.getTotalModifier())
            + " = " + result.getTotal());
        lines.add("DC/AC: " + (result.getTarget() == null ? "N/A" : result.getTarget()));
        lines.add("RESULT: " + (result.isSuccess() ? "SUCCESS" : "FAILURE"));

        DamageRoll damage = result.getDamage();
        if (damage == null) {
            lines.add("DAMAGE: N/A");
        } else {
            List<String> parts = new ArrayList<>();
            for (DamageBreakdown b : damage.getBreakdown()) {
                StringBuilder part = new StringBuilder(b.getLabel()).append(": ").append(b.getDice());
                if (!b.getRolls().isEmpty()) {
                    part.append(' ').append(b.getRolls());
                }
                if (b.getFlatBonus() != 0) {
                    part.append(formatModifier(b.getFlatBonus()));
                }
                part.append(" = ").append(b.getSubtotal());
                if (b.getDamageType() != null && !b.getDamageType().isEmpty()) {
                    part.append(' ').append(b.getDamageType());
                }
                parts.add(part.toString());
            }
            lines.add("DAMAGE: " + String.join("; ", parts) + " | TOTAL " + damage.getTotalDamage()
                + (damage.isCrit() ? " (critical)" : ""));
        }
        lines.add("NOTES: " + result.getNotes());
        return String.join("\n", lines);
    }

    public static String formatModifier(int value) {
        return value >= 0 ? "+" + value : String.valueOf(value);
    }
}
