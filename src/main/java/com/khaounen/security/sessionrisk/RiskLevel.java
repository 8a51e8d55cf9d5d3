package com.khaounen.security.sessionrisk;

import java.util.Locale;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL,
    UNKNOWN;

    public static RiskLevel fromCumulativeRisk(double cumulativeRisk) {
        if (cumulativeRisk >= 3.0) {
            return CRITICAL;
        }
        if (cumulativeRisk >= 2.0) {
            return HIGH;
        }
        if (cumulativeRisk >= 1.0) {
            return MEDIUM;
        }
        return LOW;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
