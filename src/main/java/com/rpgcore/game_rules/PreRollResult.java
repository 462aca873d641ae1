package com.rpgcore.game_rules;

import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Результат предброска атак NPC: текст для рассказчика, суммарный урон и
 * таблица по каждому NPC для отмены атак погибших в этом ходу.
 */
public class PreRollResult {
    public static final String NO_ATTACKS_LEDGER = "No hostile NPCs remain to attack.";

    private final String ledgerText;
    private final int totalDamage;
    private final List<NpcAttackRoll> perNpc;

    public PreRollResult(String ledgerText, List<NpcAttackRoll> perNpc) {
        this.ledgerText = ledgerText;
        this.perNpc = Collections.unmodifiableList(perNpc);
        this.totalDamage = perNpc.stream().mapToInt(NpcAttackRoll::getDamage).sum();
    }

    public static PreRollResult empty() {
        return new PreRollResult(NO_ATTACKS_LEDGER, List.of());
    }

    /** Никто из NPC не атаковал; отличается от ошибки движка */
    public boolean isEmpty() {
        return perNpc.isEmpty();
    }

    /**
     * Урон, который нанесли бы перечисленные NPC; используется для вычитания атак убитых
     */
    public int damageFrom(Collection<String> npcIds) {
        if (npcIds == null || npcIds.isEmpty()) {
            return 0;
        }
        return perNpc.stream()
            .filter(roll -> npcIds.contains(roll.getNpcId()))
            .mapToInt(NpcAttackRoll::getDamage)
            .sum();
    }

    public String getLedgerText() { return ledgerText; }
    public int getTotalDamage() { return totalDamage; }
    public List<NpcAttackRoll> getPerNpc() { return perNpc; }
}
