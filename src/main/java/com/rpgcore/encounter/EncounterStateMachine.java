package com.rpgcore.encounter;

import com.rpgcore.game_state.Condition;
import com.rpgcore.game_state.Encounter;
import com.rpgcore.game_state.EncounterReward;
import com.rpgcore.game_state.EncounterStatus;
import com.rpgcore.game_state.GridPosition;
import com.rpgcore.game_state.Npc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Жизненный цикл боя: нет боя → ACTIVE → COMPLETED.
 * <p>
 * Машина не хранит "текущий бой": {@link Encounter} передаётся в каждую операцию,
 * а новый бой после завершения создаётся новым экземпляром. Операции с неизвестным id
 * не бросают исключений, а сообщают found=false.
 * <p>
 * Гибель NPC (переход hp &gt; 0 → hp = 0) происходит один раз: снимок уходит в список
 * побеждённых, опыт начисляется один раз, NPC удаляется из состава, очереди и сетки.
 * Когда живых враждебных NPC не остаётся, бой завершается и {@link RewardCalculator}
 * вызывается ровно один раз.
 */
@Component
public class EncounterStateMachine {
    private static final Logger log = LoggerFactory.getLogger(EncounterStateMachine.class);

    private final RewardCalculator rewardCalculator;
    private final int gridSize;

    public EncounterStateMachine(RewardCalculator rewardCalculator,
                                 @Value("${rules.grid.size:20}") int gridSize) {
        this.rewardCalculator = rewardCalculator;
        this.gridSize = gridSize;
    }

    /**
     * Вводит NPC в сцену. Враждебный NPC без активного боя начинает новый бой;
     * при активном бое все NPC присоединяются к нему; невраждебные NPC вне боя
     * возвращаются как неотслеживаемые.
     *
     * @param current текущий бой или null
     */
    public IntroductionResult introduce(Encounter current, List<Npc> npcs) {
        List<Npc> incoming = npcs == null ? List.of() : npcs;
        if (current != null && current.isActive()) {
            List<Npc> joined = new ArrayList<>();
            for (Npc npc : incoming) {
                if (join(current, npc)) {
                    joined.add(npc);
                }
            }
            return new IntroductionResult(current, false, joined, List.of());
        }

        boolean anyHostile = incoming.stream().anyMatch(Npc::isActiveHostile);
        if (!anyHostile) {
            return new IntroductionResult(null, false, List.of(), new ArrayList<>(incoming));
        }

        Encounter encounter = new Encounter(UUID.randomUUID().toString(), gridSize);
        encounter.getTurnOrder().add(Encounter.PLAYER_ID);
        encounter.getPositions().put(Encounter.PLAYER_ID, GridPlacement.playerStart(gridSize));
        List<Npc> joined = new ArrayList<>();
        for (Npc npc : incoming) {
            if (join(encounter, npc)) {
                joined.add(npc);
            }
        }
        encounter.setCurrentTurnIndex(0);
        encounter.setRound(1);
        log.info("Начат бой {}: {} участников", encounter.getId(), joined.size());
        return new IntroductionResult(encounter, true, joined, List.of());
    }

    private boolean join(Encounter encounter, Npc npc) {
        if (npc.getId() == null || encounter.getNpc(npc.getId()) != null || Encounter.PLAYER_ID.equals(npc.getId())) {
            log.warn("NPC с id {} уже есть в бою {}, пропущен", npc.getId(), encounter.getId());
            return false;
        }
        GridPosition slot = GridPlacement.nextNpcSlot(encounter);
        if (slot == null) {
            log.warn("Сетка боя {} заполнена, {} добавлен без позиции", encounter.getId(), npc.getId());
            encounter.getNpcs().put(npc.getId(), npc);
            encounter.getTurnOrder().add(npc.getId());
            return true;
        }
        encounter.addParticipant(npc, slot);
        return true;
    }

    /**
     * Передаёт ход следующему участнику; возврат к началу очереди увеличивает раунд.
     *
     * @return id участника, чей теперь ход, или null для завершённого/пустого боя
     */
    public String advanceTurn(Encounter encounter) {
        if (encounter == null || !encounter.isActive() || encounter.getTurnOrder().isEmpty()) {
            return null;
        }
        int next = encounter.getCurrentTurnIndex() + 1;
        if (next >= encounter.getTurnOrder().size()) {
            next = 0;
            encounter.setRound(encounter.getRound() + 1);
        }
        encounter.setCurrentTurnIndex(next);
        return encounter.getCurrentActorId();
    }

    /**
     * Закрывает раунд после хода игрока и предброшенных атак NPC: ход снова у игрока.
     *
     * @return номер нового раунда или 0 для неактивного боя
     */
    public int endRound(Encounter encounter) {
        if (encounter == null || !encounter.isActive()) {
            return 0;
        }
        encounter.setCurrentTurnIndex(0);
        encounter.setRound(encounter.getRound() + 1);
        return encounter.getRound();
    }

    public NpcUpdateResult update(Encounter encounter, String npcId, NpcUpdate update) {
        Npc npc = encounter == null ? null : encounter.getNpc(npcId);
        if (npc == null) {
            log.debug("Обновление неизвестного NPC {} пропущено", npcId);
            return NpcUpdateResult.notFound(npcId);
        }
        NpcUpdate change = update == null ? new NpcUpdate() : update;

        boolean wasAlive = npc.isAlive();
        if (change.getHpDelta() != null && change.getHpDelta() != 0) {
            npc.applyHpDelta(change.getHpDelta());
        }
        for (Condition condition : change.getConditionsAdded()) {
            npc.addCondition(condition);
        }
        for (Condition condition : change.getConditionsRemoved()) {
            npc.removeCondition(condition);
        }

        boolean died = wasAlive && !npc.isAlive();
        int xpAwarded = 0;
        boolean removed = false;
        if (died) {
            encounter.getDefeatedNpcs().add(npc.copy());
            if (npc.isHostile() && npc.getXpValue() > 0) {
                xpAwarded = npc.getXpValue();
                encounter.setTotalXpAwarded(encounter.getTotalXpAwarded() + xpAwarded);
            }
            encounter.removeParticipant(npcId);
            removed = true;
            log.info("{} погиб в бою {} ({} XP)", npc.getName(), encounter.getId(), xpAwarded);
        } else if (change.isRemoveFromScene() || !npc.isAlive()) {
            encounter.removeParticipant(npcId);
            removed = true;
            log.info("{} покинул бой {}", npc.getName(), encounter.getId());
        }

        boolean completed = checkCompletion(encounter) != null;
        return new NpcUpdateResult(true, npcId, npc.getName(), npc.getCurrentHp(), died, removed, xpAwarded, completed);
    }

    public NpcUpdateResult dismiss(Encounter encounter, String npcId) {
        return update(encounter, npcId, NpcUpdate.dismiss());
    }

    /**
     * Перемещает фишку: только известный id, клетка в пределах сетки и свободна
     */
    public boolean moveToken(Encounter encounter, String id, GridPosition position) {
        if (encounter == null || position == null || !encounter.isActive()) {
            return false;
        }
        boolean known = Encounter.PLAYER_ID.equals(id) || encounter.getNpc(id) != null;
        if (!known || !encounter.isInBounds(position)) {
            return false;
        }
        if (position.equals(encounter.getPositions().get(id))) {
            return true;
        }
        if (encounter.isOccupied(position)) {
            return false;
        }
        encounter.getPositions().put(id, position);
        return true;
    }

    /**
     * Завершает бой, если живых враждебных NPC не осталось.
     *
     * @return награда, если бой завершился именно сейчас; иначе null
     */
    public EncounterReward checkCompletion(Encounter encounter) {
        if (encounter == null || encounter.getStatus() != EncounterStatus.ACTIVE || encounter.hasActiveHostiles()) {
            return null;
        }
        encounter.setStatus(EncounterStatus.COMPLETED);
        EncounterReward reward = rewardCalculator.calculate(
            List.copyOf(encounter.getDefeatedNpcs()), encounter.getTotalXpAwarded(), encounter.getRound());
        encounter.setReward(reward);
        log.info("Бой {} завершён за {} раундов, {} XP", encounter.getId(), encounter.getRound(),
            reward == null ? 0 : reward.getTotalXp());
        return reward;
    }

    public EncounterSnapshot snapshot(Encounter encounter) {
        return EncounterSnapshot.of(encounter);
    }

    public int getGridSize() {
        return gridSize;
    }
}
