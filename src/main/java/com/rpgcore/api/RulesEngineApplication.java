package com.rpgcore.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot приложение движка правил. Веб-слоя нет: хост получает
 * {@link com.rpgcore.service.CombatTurnService} из контекста и вызывает его напрямую.
 */
@SpringBootApplication(scanBasePackages = "com.rpgcore")
public class RulesEngineApplication {
    private static final Logger log = LoggerFactory.getLogger(RulesEngineApplication.class);

    public static void main(String[] args) {
        log.info("=== RPG Rules Engine ===");
        SpringApplication.run(RulesEngineApplication.class, args);
    }
}
