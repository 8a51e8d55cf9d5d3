package com.khaounen.security.sessionrisk;

import java.time.Instant;

public record SessionBlockEvent(
        String sessionId,
        String reason,
        Instant blockedAt,
        RiskLevel riskLevel,
        double cumulativeRisk,
        int injectionAttempts,
        int highRiskCount,
        int eventCount,
        String lastContentSample
) {

    static SessionBlockEvent of(SessionRiskProfile profile, RiskEvent trigger) {
        return new SessionBlockEvent(
                profile.getSessionId(),
                profile.getBlockReason(),
                trigger.timestamp(),
                profile.riskLevel(),
                profile.getCumulativeRisk(),
                profile.getInjectionAttempts(),
                profile.getHighRiskCount(),
                profile.eventCount(),
                trigger.contentSample()
        );
    }
}
