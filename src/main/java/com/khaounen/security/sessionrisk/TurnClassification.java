package com.khaounen.security.sessionrisk;

import java.util.List;

public record TurnClassification(
        double riskScore,
        String eventType,
        List<String> patternsDetected
) {

    public static final String BENIGN = "benign";

    public TurnClassification {
        patternsDetected = patternsDetected == null ? List.of() : List.copyOf(patternsDetected);
    }

    public static TurnClassification benign() {
        return new TurnClassification(0.0, BENIGN, List.of());
    }
}
