package com.khaounen.security.sessionrisk;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

public interface SessionStatus {

    boolean exists();

    boolean blocked();

    RiskLevel riskLevel();

    Map<String, Object> toMap();

    static SessionStatus notFound() {
        return NotFound.INSTANCE;
    }

    record NotFound() implements SessionStatus {

        private static final NotFound INSTANCE = new NotFound();

        @Override
        public boolean exists() {
            return false;
        }

        @Override
        public boolean blocked() {
            return false;
        }

        @Override
        public RiskLevel riskLevel() {
            return RiskLevel.UNKNOWN;
        }

        @Override
        public Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("exists", false);
            map.put("is_blocked", false);
            map.put("risk_level", RiskLevel.UNKNOWN.label());
            return map;
        }
    }

    record Found(
            String sessionId,
            SessionState state,
            String blockReason,
            RiskLevel riskLevel,
            double cumulativeRisk,
            int injectionAttempts,
            int highRiskCount,
            int eventCount,
            Duration sessionDuration
    ) implements SessionStatus {

        @Override
        public boolean exists() {
            return true;
        }

        @Override
        public boolean blocked() {
            return state == SessionState.BLOCKED;
        }

        @Override
        public Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("exists", true);
            map.put("is_blocked", blocked());
            map.put("block_reason", blockReason);
            map.put("risk_level", riskLevel.label());
            map.put("cumulative_risk", cumulativeRisk);
            map.put("injection_attempts", injectionAttempts);
            map.put("high_risk_count", highRiskCount);
            map.put("event_count", eventCount);
            map.put("session_duration", sessionDuration.toMillis() / 1000.0);
            return map;
        }
    }
}
