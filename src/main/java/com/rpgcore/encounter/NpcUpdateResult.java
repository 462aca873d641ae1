package com.rpgcore.encounter;

/**
 * Итог {@link EncounterStateMachine#update}. found=false для неизвестного или уже убранного id.
 */
public class NpcUpdateResult {
    private final boolean found;
    private final String npcId;
    private final String name;
    private final int newHp;
    private final boolean died;
    private final boolean removed;
    private final int xpAwarded;
    private final boolean encounterCompleted;

    public NpcUpdateResult(boolean found, String npcId, String name, int newHp, boolean died,
                           boolean removed, int xpAwarded, boolean encounterCompleted) {
        this.found = found;
        this.npcId = npcId;
        this.name = name;
        this.newHp = newHp;
        this.died = died;
        this.removed = removed;
        this.xpAwarded = xpAwarded;
        this.encounterCompleted = encounterCompleted;
    }

    public static NpcUpdateResult notFound(String npcId) {
        return new NpcUpdateResult(false, npcId, npcId, 0, false, false, 0, false);
    }

    public boolean isFound() { return found; }
    public String getNpcId() { return npcId; }
    public String getName() { return name; }
    public int getNewHp() { return newHp; }
    public boolean isDied() { return died; }
    public boolean isRemoved() { return removed; }
    public int getXpAwarded() { return xpAwarded; }

    /** Это обновление завершило бой */
    public boolean isEncounterCompleted() { return encounterCompleted; }
}
