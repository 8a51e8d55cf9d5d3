package com.khaounen.security.sessionrisk;

import java.time.Instant;
import java.util.List;

public class SessionRiskProfile {

    private final String sessionId;
    private final Instant createdAt;
    private final RiskEventWindow riskEvents;
    private double cumulativeRisk;
    private int highRiskCount;
    private int injectionAttempts;
    private Instant lastActivity;
    private volatile boolean blocked;
    private String blockReason;

    public SessionRiskProfile(String sessionId, Instant createdAt, int windowCapacity) {
        this.sessionId = sessionId;
        this.createdAt = createdAt;
        this.lastActivity = createdAt;
        this.riskEvents = new RiskEventWindow(windowCapacity);
    }

    void record(RiskEvent event, double highRiskThreshold) {
        riskEvents.add(event);
        if (event.timestamp().isAfter(lastActivity)) {
            lastActivity = event.timestamp();
        }
        cumulativeRisk += event.riskScore();
        if (event.riskScore() >= highRiskThreshold) {
            highRiskCount++;
        }
        if (event.isInjection()) {
            injectionAttempts++;
        }
    }

    // first reason wins
    boolean block(String reason) {
        if (blocked) {
            return false;
        }
        blockReason = reason;
        blocked = true;
        return true;
    }

    public String getSessionId() {
        return sessionId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public double getCumulativeRisk() {
        return cumulativeRisk;
    }

    public int getHighRiskCount() {
        return highRiskCount;
    }

    public int getInjectionAttempts() {
        return injectionAttempts;
    }

    public Instant getLastActivity() {
        return lastActivity;
    }

    public boolean isBlocked() {
        return blocked;
    }

    public String getBlockReason() {
        return blockReason;
    }

    public int eventCount() {
        return riskEvents.size();
    }

    public List<RiskEvent> recentEvents(int count) {
        return riskEvents.recent(count);
    }

    public RiskLevel riskLevel() {
        return RiskLevel.fromCumulativeRisk(cumulativeRisk);
    }
}
