package com.deepansh.salesagent.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Binds the engine.* block of application.yml.
 * Registered via @EnableConfigurationProperties on the application class.
 */
@Data
@ConfigurationProperties(prefix = "engine")
public class EngineProperties {

    private Session session = new Session();
    private Repair repair = new Repair();
    private Planner planner = new Planner();
    private Responder responder = new Responder();

    @Data
    public static class Session {
        /** message_history entries kept per session (oldest dropped first) */
        private int maxMessageHistory = 10;
        /** trace_history entries kept per session */
        private int maxTraceHistory = 5;
        /** step_N_result keys kept per session (highest N kept) */
        private int maxStepResults = 10;
        /** idle expiry, reset on every write */
        private long ttlMinutes = 1440;
    }

    @Data
    public static class Repair {
        private boolean enabled = true;
    }

    @Data
    public static class Planner {
        private int historyTurns = 10;
        private int maxCharsPerTurn = 500;
    }

    @Data
    public static class Responder {
        private int historyTurns = 10;
        private int maxCharsPerTurn = 400;
    }
}
