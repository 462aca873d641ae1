package com.rpgcore.service;

import com.rpgcore.encounter.EncounterSnapshot;
import com.rpgcore.encounter.EncounterStateMachine;
import com.rpgcore.encounter.IntroductionResult;
import com.rpgcore.encounter.NpcUpdate;
import com.rpgcore.encounter.NpcUpdateResult;
import com.rpgcore.game_rules.ActionResolver;
import com.rpgcore.game_rules.DerivedStats;
import com.rpgcore.game_rules.EffectAggregator;
import com.rpgcore.game_rules.NpcPreRollEngine;
import com.rpgcore.game_rules.PreRollResult;
import com.rpgcore.game_rules.RollResult;
import com.rpgcore.game_state.Character;
import com.rpgcore.game_state.Encounter;
import com.rpgcore.game_state.EncounterReward;
import com.rpgcore.game_state.Npc;
import com.rpgcore.intents.ActionIntent;
import com.rpgcore.intents.ActionIntentParser;
import com.rpgcore.intents.AttackIntent;
import com.rpgcore.intents.CreateNpcIntent;
import com.rpgcore.intents.IntentParseException;
import com.rpgcore.intents.NarrationIntent;
import com.rpgcore.intents.NarrationIntentParser;
import com.rpgcore.intents.NoCheckIntent;
import com.rpgcore.intents.PlayerStateDelta;
import com.rpgcore.intents.UpdateNpcIntent;
import com.rpgcore.srd.NpcFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ход игрока в бою и применение ответа рассказчика.
 * <p>
 * {@link #takeTurn}: свежая свёртка эффектов → разрешение действия → урон по цели
 * (погибшая цель убирается до предброска) → предбросок атак оставшихся NPC.
 * <p>
 * {@link #applyNarration}: все намерения применяются к копиям персонажа и боя;
 * урон предброска уменьшается на атаки NPC, убитых этой же пачкой. В бою HP игрока
 * меняет только предбросок, hp_delta рассказчика отбрасывается с предупреждением. Копии
 * фиксируются вместе, а при любой ошибке исходные объекты не меняются.
 * <p>
 * Один бой в каждый момент меняет только один вызывающий поток.
 */
@Service
public class CombatTurnService {
    private static final Logger log = LoggerFactory.getLogger(CombatTurnService.class);

    private final EffectAggregator effectAggregator;
    private final ActionResolver actionResolver;
    private final NpcPreRollEngine preRollEngine;
    private final EncounterStateMachine stateMachine;
    private final NpcFactory npcFactory;
    private final PlayerStateApplier playerStateApplier;
    private final ActionIntentParser actionIntentParser;
    private final NarrationIntentParser narrationIntentParser;

    public CombatTurnService(EffectAggregator effectAggregator, ActionResolver actionResolver,
                             NpcPreRollEngine preRollEngine, EncounterStateMachine stateMachine,
                             NpcFactory npcFactory, PlayerStateApplier playerStateApplier,
                             ActionIntentParser actionIntentParser, NarrationIntentParser narrationIntentParser) {
        this.effectAggregator = effectAggregator;
        this.actionResolver = actionResolver;
        this.preRollEngine = preRollEngine;
        this.stateMachine = stateMachine;
        this.npcFactory = npcFactory;
        this.playerStateApplier = playerStateApplier;
        this.actionIntentParser = actionIntentParser;
        this.narrationIntentParser = narrationIntentParser;
    }

    /**
     * Ход по сырому ответу классификатора; неразборчивый ответ даёт NoCheck
     */
    public TurnOutcome takeTurn(Character character, Encounter encounter, String classifierResponse) {
        ActionIntent intent;
        try {
            intent = actionIntentParser.parse(classifierResponse);
        } catch (IntentParseException e) {
            log.warn("Не удалось разобрать ответ классификатора: {}", e.getMessage());
            intent = new NoCheckIntent("Could not classify this action; no roll made.");
        }
        return takeTurn(character, encounter, intent);
    }

    public TurnOutcome takeTurn(Character character, Encounter encounter, ActionIntent intent) {
        DerivedStats stats = effectAggregator.aggregate(character);
        boolean inCombat = encounter != null && encounter.isActive();

        Npc target = null;
        if (intent instanceof AttackIntent) {
            target = findTarget(encounter, ((AttackIntent) intent).getTarget());
        }
        RollResult result = actionResolver.resolve(intent, stats, target, inCombat ? encounter.getRound() : 0);

        NpcUpdateResult targetUpdate = null;
        EncounterReward reward = null;
        if (target != null && inCombat && result.isRolled() && result.isSuccess() && result.getTotalDamage() > 0) {
            targetUpdate = stateMachine.update(encounter, target.getId(), NpcUpdate.damage(result.getTotalDamage()));
            if (targetUpdate.isEncounterCompleted()) {
                reward = encounter.getReward();
                creditReward(character, reward);
            }
        }

        PreRollResult preRoll = inCombat
            ? preRollEngine.preRoll(encounter.getNpcList(), stats.getArmorClass())
            : PreRollResult.empty();
        EncounterSnapshot snapshot = encounter == null ? null : stateMachine.snapshot(encounter);
        log.debug("Ход {}: {} ({}), предбросок {} урона", character.getId(), result.getKind(),
            result.getCheckType(), preRoll.getTotalDamage());
        return new TurnOutcome(result, targetUpdate, preRoll, snapshot, reward, stats.getArmorClass());
    }

    /**
     * Применение по сырому ответу рассказчика; неразборчивый ответ ничего не меняет
     */
    public BatchApplyResult applyNarration(Character character, Encounter encounter, TurnOutcome outcome,
                                           String narratorResponse) {
        try {
            return applyNarration(character, encounter, outcome, narrationIntentParser.parse(narratorResponse));
        } catch (IntentParseException e) {
            log.warn("Не удалось разобрать ответ рассказчика: {}", e.getMessage());
            return BatchApplyResult.failed(encounter);
        }
    }

    public BatchApplyResult applyNarration(Character character, Encounter encounter, TurnOutcome outcome,
                                           List<NarrationIntent> intents) {
        Character workingCharacter = character.copy();
        Encounter workingEncounter = encounter == null ? null : encounter.copy();
        List<NpcUpdateResult> npcUpdates = new ArrayList<>();
        List<Npc> created = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        Set<String> killed = new LinkedHashSet<>();
        EncounterReward reward = null;

        PreRollResult preRoll = outcome == null ? PreRollResult.empty() : outcome.getPreRoll();
        boolean engineOwnsHp = !preRoll.isEmpty() || (encounter != null && encounter.isActive());

        try {
            List<PlayerStateDelta> playerDeltas = new ArrayList<>();
            for (NarrationIntent intent : intents == null ? List.<NarrationIntent>of() : intents) {
                switch (intent.getKind()) {
                    case CREATE_NPC -> {
                        List<Npc> npcs = npcFactory.create((CreateNpcIntent) intent);
                        IntroductionResult introduction = stateMachine.introduce(workingEncounter, npcs);
                        if (introduction.getEncounter() != null) {
                            workingEncounter = introduction.getEncounter();
                        }
                        created.addAll(npcs);
                    }
                    case UPDATE_NPC -> {
                        UpdateNpcIntent update = (UpdateNpcIntent) intent;
                        NpcUpdateResult npcResult = stateMachine.update(workingEncounter, update.getNpcId(), update.getUpdate());
                        npcUpdates.add(npcResult);
                        if (!npcResult.isFound()) {
                            warnings.add("NPC " + update.getNpcId() + " not found");
                        }
                        if (npcResult.isDied()) {
                            killed.add(npcResult.getNpcId());
                        }
                        if (npcResult.isEncounterCompleted()) {
                            reward = workingEncounter.getReward();
                        }
                    }
                    case PLAYER_STATE -> playerDeltas.add((PlayerStateDelta) intent);
                }
            }

            int cancelled = preRoll.damageFrom(killed);
            int damageToPlayer = Math.max(0, preRoll.getTotalDamage() - cancelled);
            if (cancelled > 0) {
                log.info("Отменено {} урона от NPC, погибших в этом ходу: {}", cancelled, killed);
            }
            if (damageToPlayer > 0) {
                workingCharacter.applyHpDelta(-damageToPlayer);
            }

            for (PlayerStateDelta delta : playerDeltas) {
                warnings.addAll(playerStateApplier.apply(workingCharacter, delta, workingEncounter, engineOwnsHp));
            }

            if (reward == null && workingEncounter != null) {
                reward = stateMachine.checkCompletion(workingEncounter);
            }
            if (reward != null) {
                creditReward(workingCharacter, reward);
            } else if (outcome != null && workingEncounter != null && workingEncounter.isActive()) {
                stateMachine.endRound(workingEncounter);
            }

            character.restoreFrom(workingCharacter);
            Encounter committed = workingEncounter;
            if (encounter != null && workingEncounter != null && encounter.getId().equals(workingEncounter.getId())) {
                encounter.restoreFrom(workingEncounter);
                committed = encounter;
            }
            return new BatchApplyResult(true, "Applied " + intents.size() + " change(s).", committed, npcUpdates,
                created, damageToPlayer, cancelled, reward, character.getPendingLevel(), warnings);
        } catch (RuntimeException e) {
            log.error("Пакет изменений не применён, состояние не изменено: {}", e.getMessage(), e);
            return BatchApplyResult.failed(encounter);
        }
    }

    /**
     * Цель атаки по id, затем по имени без учёта регистра, затем по вхождению имени
     */
    static Npc findTarget(Encounter encounter, String target) {
        if (encounter == null || target == null || target.isBlank()) {
            return null;
        }
        Npc byId = encounter.getNpc(target.trim());
        if (byId != null) {
            return byId;
        }
        String needle = target.trim().toLowerCase();
        Npc partial = null;
        for (Npc npc : encounter.getNpcList()) {
            if (npc.getName() == null || npc.getName().isBlank()) {
                continue;
            }
            String name = npc.getName().trim().toLowerCase();
            if (name.equals(needle)) {
                return npc;
            }
            if (partial == null && npc.isAlive() && (name.contains(needle) || needle.contains(name))) {
                partial = npc;
            }
        }
        return partial;
    }

    private static void creditReward(Character character, EncounterReward reward) {
        if (reward != null && reward.getTotalXp() > 0) {
            character.gainXp(reward.getTotalXp());
            log.info("{} получает {} XP за бой", character.getName(), reward.getTotalXp());
        }
    }
}
