package com.khaounen.security.sessionrisk;

import java.util.Optional;

public class HardThresholdDetector implements AttackDetector {

    static final String INJECTION_REASON = "Multiple injection attempts detected";
    static final String CUMULATIVE_REASON = "Cumulative risk threshold exceeded";

    private final int maxInjectionAttempts;
    private final double cumulativeRiskLimit;

    public HardThresholdDetector(SessionRiskProperties properties) {
        this.maxInjectionAttempts = properties.getMaxInjectionAttempts();
        this.cumulativeRiskLimit = properties.getCumulativeRiskLimit();
    }

    @Override
    public Optional<String> detect(SessionRiskProfile profile) {
        if (profile.getInjectionAttempts() >= maxInjectionAttempts) {
            return Optional.of(INJECTION_REASON);
        }
        if (profile.getCumulativeRisk() >= cumulativeRiskLimit) {
            return Optional.of(CUMULATIVE_REASON);
        }
        return Optional.empty();
    }
}
