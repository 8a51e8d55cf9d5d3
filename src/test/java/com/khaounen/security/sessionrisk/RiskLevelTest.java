package com.khaounen.security.sessionrisk;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class RiskLevelTest {

    @Test
    void bucketsCumulativeRisk() {
        assertEquals(RiskLevel.LOW, RiskLevel.fromCumulativeRisk(0.0));
        assertEquals(RiskLevel.LOW, RiskLevel.fromCumulativeRisk(0.99));
        assertEquals(RiskLevel.MEDIUM, RiskLevel.fromCumulativeRisk(1.0));
        assertEquals(RiskLevel.HIGH, RiskLevel.fromCumulativeRisk(2.0));
        assertEquals(RiskLevel.HIGH, RiskLevel.fromCumulativeRisk(2.99));
        assertEquals(RiskLevel.CRITICAL, RiskLevel.fromCumulativeRisk(3.0));
        assertEquals("critical", RiskLevel.CRITICAL.label());
    }
}
