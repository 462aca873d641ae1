package com.rpgcore.encounter;

import com.rpgcore.game_state.Condition;
import com.rpgcore.game_state.Encounter;
import com.rpgcore.game_state.EncounterStatus;
import com.rpgcore.game_state.GridPosition;
import com.rpgcore.game_state.Npc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Неизменяемый срез боя для рассказчика: состав, позиции, очередь ходов, раунд
 */
public class EncounterSnapshot {
    private final String encounterId;
    private final EncounterStatus status;
    private final int round;
    private final String currentActorId;
    private final List<String> turnOrder;
    private final Map<String, GridPosition> positions;
    private final List<Combatant> combatants;

    private EncounterSnapshot(Encounter encounter) {
        this.encounterId = encounter.getId();
        this.status = encounter.getStatus();
        this.round = encounter.getRound();
        this.currentActorId = encounter.getCurrentActorId();
        this.turnOrder = List.copyOf(encounter.getTurnOrder());
        this.positions = Collections.unmodifiableMap(new LinkedHashMap<>(encounter.getPositions()));
        List<Combatant> list = new ArrayList<>();
        for (Npc npc : encounter.getNpcList()) {
            list.add(new Combatant(npc, encounter.getPositions().get(npc.getId())));
        }
        this.combatants = Collections.unmodifiableList(list);
    }

    static EncounterSnapshot of(Encounter encounter) {
        return new EncounterSnapshot(encounter);
    }

    /**
     * Текст для промпта рассказчика
     */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append("ENCOUNTER ").append(encounterId).append(" (").append(status.getValue()).append("), round ")
            .append(round).append(", current turn: ").append(currentActorId).append('\n');
        sb.append("TURN ORDER: ").append(String.join(" -> ", turnOrder)).append('\n');
        sb.append("PLAYER at ").append(positions.get(Encounter.PLAYER_ID)).append('\n');
        for (Combatant c : combatants) {
            sb.append("- ").append(c.name).append(" [id=").append(c.id).append("] ")
                .append(c.disposition).append(", HP ").append(c.currentHp).append('/').append(c.maxHp)
                .append(", AC ").append(c.armorClass);
            if (c.position != null) {
                sb.append(", at ").append(c.position);
            }
            if (!c.conditions.isEmpty()) {
                sb.append(", conditions: ").append(String.join(", ", c.conditions));
            }
            sb.append('\n');
        }
        return sb.toString().trim();
    }

    public String getEncounterId() { return encounterId; }
    public EncounterStatus getStatus() { return status; }
    public int getRound() { return round; }
    public String getCurrentActorId() { return currentActorId; }
    public List<String> getTurnOrder() { return turnOrder; }
    public Map<String, GridPosition> getPositions() { return positions; }
    public List<Combatant> getCombatants() { return combatants; }

    public static class Combatant {
        private final String id;
        private final String name;
        private final String disposition;
        private final int currentHp;
        private final int maxHp;
        private final int armorClass;
        private final GridPosition position;
        private final List<String> conditions;

        Combatant(Npc npc, GridPosition position) {
            this.id = npc.getId();
            this.name = npc.getName();
            this.disposition = npc.getDisposition().getValue();
            this.currentHp = npc.getCurrentHp();
            this.maxHp = npc.getMaxHp();
            this.armorClass = npc.getArmorClass();
            this.position = position;
            List<String> tags = new ArrayList<>();
            for (Condition condition : npc.getConditions()) {
                tags.add(condition.toString());
            }
            this.conditions = List.copyOf(tags);
        }

        public String getId() { return id; }
        public String getName() { return name; }
        public String getDisposition() { return disposition; }
        public int getCurrentHp() { return currentHp; }
        public int getMaxHp() { return maxHp; }
        public int getArmorClass() { return armorClass; }
        public GridPosition getPosition() { return position; }
        public List<String> getConditions() { return conditions; }
    }
}
