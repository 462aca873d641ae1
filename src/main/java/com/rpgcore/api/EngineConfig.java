package com.rpgcore.api;

import com.rpgcore.encounter.RewardCalculator;
import com.rpgcore.encounter.XpRewardCalculator;
import com.rpgcore.game_rules.DiceRoller;
import com.rpgcore.srd.SrdStatLookup;
import com.rpgcore.srd.StatLookup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Random;

/**
 * Бины, которым нужна конфигурация: кубики, награда за бой, справочник SRD
 */
@Configuration
public class EngineConfig {
    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    /**
     * Пустой rules.dice.seed даёт случайные броски, число делает их воспроизводимыми
     */
    @Bean
    public DiceRoller diceRoller(@Value("${rules.dice.seed:}") String seed) {
        if (seed == null || seed.isBlank()) {
            return new DiceRoller(new Random());
        }
        try {
            long value = Long.parseLong(seed.trim());
            log.info("Кубики с фиксированным seed {}", value);
            return new DiceRoller(new Random(value));
        } catch (NumberFormatException e) {
            throw new IllegalStateException("rules.dice.seed must be a number: " + seed, e);
        }
    }

    @Bean
    public RewardCalculator rewardCalculator() {
        return new XpRewardCalculator();
    }

    @Bean
    public StatLookup statLookup(@Value("${rules.srd.api-url:http://localhost:3000/api}") String apiUrl,
                                 @Value("${rules.srd.version:2014}") String version) {
        String base = SrdStatLookup.resolveBaseUrl(apiUrl);
        log.info("SRD API: {} (версия {})", base, version);
        return new SrdStatLookup(base, version);
    }
}
