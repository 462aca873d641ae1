package com.rpgcore.game_rules;

import com.rpgcore.game_state.Npc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import static com.rpgcore.game_rules.RollSummaryFormatter.formatModifier;

/**
 * Бросает атаки всех живых враждебных NPC до того, как рассказчик опишет ход.
 * <p>
 * Состояние не меняется: NPC только читаются. Сверку с погибшими в этом ходу
 * делает вызывающий код через {@link PreRollResult#damageFrom}.
 */
@Component
public class NpcPreRollEngine {
    private static final Logger log = LoggerFactory.getLogger(NpcPreRollEngine.class);

    private final DiceRoller dice;

    public NpcPreRollEngine(DiceRoller dice) {
        this.dice = dice;
    }

    public PreRollResult preRoll(Collection<Npc> npcs, int targetAc) {
        List<NpcAttackRoll> rolls = new ArrayList<>();
        StringBuilder ledger = new StringBuilder();
        if (npcs != null) {
            for (Npc npc : npcs) {
                if (!npc.isActiveHostile()) {
                    continue;
                }
                NpcAttackRoll roll = rollAttack(npc, targetAc);
                rolls.add(roll);
                if (ledger.length() > 0) {
                    ledger.append('\n');
                }
                ledger.append(describe(npc, roll, targetAc));
            }
        }
        if (rolls.isEmpty()) {
            return PreRollResult.empty();
        }
        PreRollResult result = new PreRollResult(ledger.append("\nTOTAL DAMAGE TO PLAYER: ")
            .append(rolls.stream().mapToInt(NpcAttackRoll::getDamage).sum()).toString(), rolls);
        log.debug("Предбросок: {} атак, {} урона", rolls.size(), result.getTotalDamage());
        return result;
    }

    private NpcAttackRoll rollAttack(Npc npc, int targetAc) {
        DiceRoller.D20Result attack = dice.rollD20(npc.getAttackBonus());
        boolean crit = attack.isCritical();
        boolean hit = !attack.isCriticalFail() && (crit || attack.getTotal() >= targetAc);
        if (!hit) {
            return new NpcAttackRoll(npc.getId(), npc.getName(), attack.getRoll(), attack.getTotal(),
                false, false, null, List.of(), 0);
        }

        String damageDice = npc.getDamageDice();
        if (damageDice == null || !DiceRoller.isValid(damageDice)) {
            log.warn("У NPC {} некорректные кубики урона '{}', учитывается только бонус", npc.getId(), damageDice);
            return new NpcAttackRoll(npc.getId(), npc.getName(), attack.getRoll(), attack.getTotal(),
                true, crit, null, List.of(), Math.max(0, npc.getDamageBonus()));
        }
        DiceRoller.DiceExpression expression = DiceRoller.parse(damageDice);
        if (crit) {
            expression = expression.doubled();
        }
        DiceRoller.DiceResult damage = dice.roll(expression);
        return new NpcAttackRoll(npc.getId(), npc.getName(), attack.getRoll(), attack.getTotal(),
            true, crit, expression.toString(), damage.getRolls(),
            Math.max(0, damage.getTotal() + npc.getDamageBonus()));
    }

    private static String describe(Npc npc, NpcAttackRoll roll, int targetAc) {
        StringBuilder line = new StringBuilder()
            .append(npc.getName()).append(" [id=").append(npc.getId()).append("]: d20 ").append(roll.getD20())
            .append(' ').append(formatModifier(npc.getAttackBonus())).append(" = ").append(roll.getAttackTotal())
            .append(" vs AC ").append(targetAc).append(" -> ");
        if (!roll.isHit()) {
            return line.append(roll.getD20() == 1 ? "MISS (natural 1)" : "MISS").toString();
        }
        line.append(roll.isCrit() ? "CRITICAL HIT" : "HIT").append(", ").append(roll.getDamage()).append(" damage");
        if (roll.getDamageDice() != null) {
            line.append(" (").append(roll.getDamageDice()).append(' ').append(roll.getDamageRolls());
            if (npc.getDamageBonus() != 0) {
                line.append(' ').append(formatModifier(npc.getDamageBonus()));
            }
            line.append(')');
        }
        return line.toString();
    }
}
