package com.khaounen.security.sessionrisk;

import java.util.Objects;

public class SessionRiskGuard {

    private final SessionRiskTracker tracker;
    private final TurnClassifier classifier;

    public SessionRiskGuard(SessionRiskTracker tracker, TurnClassifier classifier) {
        this.tracker = Objects.requireNonNull(tracker, "tracker");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
    }

    public RiskDecision inspect(String sessionId, String turnText) {
        String text = turnText == null ? "" : turnText;
        TurnClassification classification = classifier.classify(text);
        if (classification == null) {
            throw new IllegalStateException("turn classifier returned no result");
        }
        return tracker.trackRiskEvent(
                sessionId,
                classification.riskScore(),
                classification.eventType(),
                classification.patternsDetected(),
                text
        );
    }

    public boolean isBlocked(String sessionId) {
        return tracker.isSessionBlocked(sessionId);
    }
}
