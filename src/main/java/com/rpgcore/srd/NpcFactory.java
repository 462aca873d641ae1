package com.rpgcore.srd;

import com.rpgcore.game_rules.DiceRoller;
import com.rpgcore.game_state.Disposition;
import com.rpgcore.game_state.Npc;
import com.rpgcore.intents.CreateNpcIntent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Создаёт NPC по записи справочника; для неизвестных существ берёт {@link NpcFallback}
 */
@Component
public class NpcFactory {
    private static final Logger log = LoggerFactory.getLogger(NpcFactory.class);

    private static final Map<Double, Integer> CR_TO_XP = Map.ofEntries(
        Map.entry(0.0, 10), Map.entry(0.125, 25), Map.entry(0.25, 50), Map.entry(0.5, 100),
        Map.entry(1.0, 200), Map.entry(2.0, 450), Map.entry(3.0, 700), Map.entry(4.0, 1100),
        Map.entry(5.0, 1800), Map.entry(6.0, 2300), Map.entry(7.0, 2900), Map.entry(8.0, 3900),
        Map.entry(9.0, 5000), Map.entry(10.0, 5900), Map.entry(11.0, 7200), Map.entry(12.0, 8400),
        Map.entry(13.0, 10000), Map.entry(14.0, 11500), Map.entry(15.0, 13000), Map.entry(16.0, 15000),
        Map.entry(17.0, 18000), Map.entry(18.0, 20000), Map.entry(19.0, 22000), Map.entry(20.0, 25000),
        Map.entry(21.0, 33000), Map.entry(22.0, 41000), Map.entry(23.0, 50000), Map.entry(24.0, 62000),
        Map.entry(25.0, 75000), Map.entry(26.0, 90000), Map.entry(27.0, 105000), Map.entry(28.0, 120000),
        Map.entry(29.0, 135000), Map.entry(30.0, 155000));

    private final StatLookup statLookup;

    public NpcFactory(StatLookup statLookup) {
        this.statLookup = statLookup;
    }

    public List<Npc> create(CreateNpcIntent intent) {
        return create(intent, NpcFallback.DEFAULT);
    }

    /**
     * Несколько одинаковых существ получают имена "Goblin 1", "Goblin 2"
     */
    public List<Npc> create(CreateNpcIntent intent, NpcFallback fallback) {
        StatBlock block = statLookup.lookupMonster(intent.getSlug());
        if (block == null) {
            log.info("Существо {} не найдено в справочнике, используются значения по умолчанию", intent.getSlug());
        }
        List<Npc> npcs = new ArrayList<>();
        for (int i = 1; i <= intent.getCount(); i++) {
            String name = intent.getCount() > 1 ? intent.getName() + " " + i : intent.getName();
            npcs.add(build(newId(intent.getSlug()), name, intent.getSlug(), intent.getDisposition(), block, fallback));
        }
        return npcs;
    }

    public Npc build(String id, String name, String slug, Disposition disposition, StatBlock block, NpcFallback fallback) {
        int armorClass = block != null && block.getArmorClass() != null ? block.getArmorClass() : fallback.getArmorClass();
        int hitPoints = block != null && block.getHitPoints() != null ? block.getHitPoints() : fallback.getHitPoints();
        int attackBonus = block != null && block.getAttackBonus() != null ? block.getAttackBonus() : fallback.getAttackBonus();
        String dice = block != null && block.getDamageDice() != null && DiceRoller.isValid(block.getDamageDice())
            ? block.getDamageDice() : fallback.getDamageDice();
        int xp = fallback.getXp();
        if (block != null && block.getXp() != null) {
            xp = block.getXp();
        } else if (block != null && block.getChallengeRating() != null) {
            xp = xpForChallengeRating(block.getChallengeRating());
        }

        DiceRoller.DiceExpression damage = DiceRoller.parse(dice);
        Npc npc = new Npc(id, name, armorClass, hitPoints, attackBonus,
            damage.withoutModifier().toString(), damage.getModifier(), xp, disposition);
        npc.setSlug(slug);
        if (block != null && block.getSavingThrowBonus() != null) {
            npc.setSavingThrowBonus(block.getSavingThrowBonus());
        }
        if (block != null && block.getSpeed() != null) {
            npc.setSpeed(block.getSpeed());
        }
        return npc;
    }

    public static int xpForChallengeRating(double challengeRating) {
        return CR_TO_XP.getOrDefault(challengeRating, 0);
    }

    /** "1/4" или "2" */
    public static int xpForChallengeRating(String challengeRating) {
        if (challengeRating == null || challengeRating.isBlank()) {
            return 0;
        }
        String value = challengeRating.trim();
        try {
            if (value.contains("/")) {
                String[] parts = value.split("/");
                double denominator = Double.parseDouble(parts[1]);
                return denominator == 0 ? 0 : xpForChallengeRating(Double.parseDouble(parts[0]) / denominator);
            }
            return xpForChallengeRating(Double.parseDouble(value));
        } catch (NumberFormatException | ArrayIndexOutOfBoundsException e) {
            log.debug("Некорректный показатель опасности '{}'", challengeRating);
            return 0;
        }
    }

    private static String newId(String slug) {
        return slug + "-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
