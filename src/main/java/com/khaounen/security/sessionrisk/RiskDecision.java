package com.khaounen.security.sessionrisk;

public record RiskDecision(boolean blocked, String reason) {

    private static final RiskDecision ALLOW = new RiskDecision(false, null);

    public static RiskDecision allow() {
        return ALLOW;
    }

    public static RiskDecision block(String reason) {
        return new RiskDecision(true, reason);
    }
}
