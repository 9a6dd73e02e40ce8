package com.ruach.formation.bootstrap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

import com.ruach.formation.bootstrap.config.FormationProperties;

/**
 * Formation Progression Engine - Application Entry Point.
 * <p>
 * Records a learner's formation journey as an append-only event log,
 * projects it into state, analyzes readiness and gates canon content.
 * </p>
 *
 * <pre>
 * Architecture: Hexagonal (Ports &amp; Adapters)
 * Pattern:      Event-Sourced (Record-Reduce-Gate)
 * Tech:         Spring Boot 3.2 + Kafka + Redis + PostgreSQL
 * </pre>
 */
@SpringBootApplication(scanBasePackages = "com.ruach.formation")
@EnableConfigurationProperties(FormationProperties.class)
@EnableScheduling
public class FormationEngineApp {

    public static void main(String[] args) {
        SpringApplication.run(FormationEngineApp.class, args);
    }
}
