package com.trendloop.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * TrendLoop pipeline orchestrator.
 *
 * Runs as a long-lived service (scheduled runs + REST API) by default, or once and
 * exit with {@code --trendloop.pipeline.run-once=true}.
 *
 * To run:
 *   AGENTS_BASE_URL=http://localhost:8000 mvn spring-boot:run
 */
@SpringBootApplication
public class OrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrchestratorApplication.class, args);
    }
}
