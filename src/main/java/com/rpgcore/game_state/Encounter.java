package com.rpgcore.game_state;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Состояние одного боя. Передаётся явно в каждую операцию EncounterStateMachine;
 * хост загружает его перед ходом и сохраняет после.
 */
public class Encounter {
    public static final String PLAYER_ID = "player";

    private String id;
    private EncounterStatus status = EncounterStatus.ACTIVE;
    private Map<String, Npc> npcs = new LinkedHashMap<>();
    private Map<String, GridPosition> positions = new LinkedHashMap<>();
    private int gridSize;
    private List<String> turnOrder = new ArrayList<>();
    private int currentTurnIndex = 0;
    private int round = 1;
    private List<Npc> defeatedNpcs = new ArrayList<>();
    private int totalXpAwarded = 0;
    private EncounterReward reward;
    private String location = "";
    private String scene = "";

    private Encounter() {
    }

    public Encounter(String id, int gridSize) {
        this.id = id;
        this.gridSize = gridSize;
    }

    public Encounter copy() {
        Encounter copy = new Encounter(id, gridSize);
        copy.status = status;
        for (Npc npc : npcs.values()) {
            copy.npcs.put(npc.getId(), npc.copy());
        }
        copy.positions = new LinkedHashMap<>(positions);
        copy.turnOrder = new ArrayList<>(turnOrder);
        copy.currentTurnIndex = currentTurnIndex;
        copy.round = round;
        for (Npc npc : defeatedNpcs) {
            copy.defeatedNpcs.add(npc.copy());
        }
        copy.totalXpAwarded = totalXpAwarded;
        copy.reward = reward;
        copy.location = location;
        copy.scene = scene;
        return copy;
    }

    public void restoreFrom(Encounter other) {
        this.status = other.status;
        this.npcs = other.npcs;
        this.positions = other.positions;
        this.gridSize = other.gridSize;
        this.turnOrder = other.turnOrder;
        this.currentTurnIndex = other.currentTurnIndex;
        this.round = other.round;
        this.defeatedNpcs = other.defeatedNpcs;
        this.totalXpAwarded = other.totalXpAwarded;
        this.reward = other.reward;
        this.location = other.location;
        this.scene = other.scene;
    }

    public boolean isActive() {
        return status == EncounterStatus.ACTIVE;
    }

    public Npc getNpc(String npcId) {
        return npcId != null ? npcs.get(npcId) : null;
    }

    public Collection<Npc> getNpcList() {
        return npcs.values();
    }

    public boolean hasActiveHostiles() {
        return npcs.values().stream().anyMatch(Npc::isActiveHostile);
    }

    public void addParticipant(Npc npc, GridPosition position) {
        npcs.put(npc.getId(), npc);
        positions.put(npc.getId(), position);
        turnOrder.add(npc.getId());
    }

    /**
     * Удаляет NPC из состава, очереди ходов и сетки за один шаг.
     * Индекс текущего хода сдвигается так, чтобы он указывал на того же или следующего участника.
     */
    public Npc removeParticipant(String npcId) {
        Npc removed = npcs.remove(npcId);
        if (removed == null) {
            return null;
        }
        positions.remove(npcId);
        int index = turnOrder.indexOf(npcId);
        if (index >= 0) {
            turnOrder.remove(index);
            if (index < currentTurnIndex) {
                currentTurnIndex--;
            } else if (currentTurnIndex >= turnOrder.size()) {
                currentTurnIndex = 0;
                round++;
            }
        }
        return removed;
    }

    public String getCurrentActorId() {
        if (turnOrder.isEmpty()) {
            return null;
        }
        return turnOrder.get(Math.min(currentTurnIndex, turnOrder.size() - 1));
    }

    public boolean isOccupied(GridPosition position) {
        return positions.containsValue(position);
    }

    public boolean isInBounds(GridPosition position) {
        return position.getRow() >= 0 && position.getCol() >= 0
            && position.getRow() < gridSize && position.getCol() < gridSize;
    }

    // Getters and Setters
    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public EncounterStatus getStatus() { return status; }
    public void setStatus(EncounterStatus status) { this.status = status; }

    public Map<String, Npc> getNpcs() { return npcs; }

    public Map<String, GridPosition> getPositions() { return positions; }

    public int getGridSize() { return gridSize; }

    public List<String> getTurnOrder() { return turnOrder; }

    public int getCurrentTurnIndex() { return currentTurnIndex; }
    public void setCurrentTurnIndex(int currentTurnIndex) { this.currentTurnIndex = currentTurnIndex; }

    public int getRound() { return round; }
    public void setRound(int round) { this.round = round; }

    public List<Npc> getDefeatedNpcs() { return defeatedNpcs; }

    public int getTotalXpAwarded() { return totalXpAwarded; }
    public void setTotalXpAwarded(int totalXpAwarded) { this.totalXpAwarded = totalXpAwarded; }

    public EncounterReward getReward() { return reward; }
    public void setReward(EncounterReward reward) { this.reward = reward; }

    public String getLocation() { return location; }
    public void setLocation(String location) { this.location = location; }

    public String getScene() { return scene; }
    public void setScene(String scene) { this.scene = scene; }
}
