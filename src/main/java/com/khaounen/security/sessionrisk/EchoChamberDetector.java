package com.khaounen.security.sessionrisk;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class EchoChamberDetector implements AttackDetector {

    static final String SIMILAR_RISK_REASON = "Echo chamber attack: Repetitive similar risk patterns";

    private final int repeatThreshold;
    private final int lookback;
    private final int similarityWindow;
    private final double similarityTolerance;
    private final int similarTransitionsThreshold;

    public EchoChamberDetector(SessionRiskProperties properties) {
        this.repeatThreshold = Math.max(1, properties.getEchoRepeatThreshold());
        this.lookback = Math.max(1, properties.getEchoLookback());
        this.similarityWindow = Math.max(2, properties.getSimilarityWindow());
        this.similarityTolerance = properties.getSimilarityTolerance();
        this.similarTransitionsThreshold = Math.max(1, properties.getSimilarTransitionsThreshold());
    }

    @Override
    public Optional<String> detect(SessionRiskProfile profile) {
        if (profile.eventCount() < repeatThreshold) {
            return Optional.empty();
        }

        Map<String, Integer> patternCounts = new LinkedHashMap<>();
        for (RiskEvent event : profile.recentEvents(lookback)) {
            for (String pattern : event.patternsDetected()) {
                patternCounts.merge(pattern, 1, Integer::sum);
            }
        }
        for (Map.Entry<String, Integer> entry : patternCounts.entrySet()) {
            if (entry.getValue() >= repeatThreshold) {
                return Optional.of("Echo chamber attack detected: '" + entry.getKey()
                        + "' repeated " + entry.getValue() + " times");
            }
        }

        if (profile.eventCount() < similarityWindow) {
            return Optional.empty();
        }
        List<RiskEvent> window = profile.recentEvents(similarityWindow);
        int similar = 0;
        for (int i = 1; i < window.size(); i++) {
            double delta = window.get(i).riskScore() - window.get(i - 1).riskScore();
            if (Math.abs(delta) < similarityTolerance) {
                similar++;
            }
        }
        if (similar >= similarTransitionsThreshold) {
            return Optional.of(SIMILAR_RISK_REASON);
        }
        return Optional.empty();
    }
}
