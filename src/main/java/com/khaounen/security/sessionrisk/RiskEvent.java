package com.khaounen.security.sessionrisk;

import java.time.Instant;
import java.util.List;

public record RiskEvent(
        Instant timestamp,
        double riskScore,
        String eventType,
        List<String> patternsDetected,
        String contentSample
) {

    public static final String PROMPT_INJECTION = "prompt_injection";

    public RiskEvent {
        patternsDetected = patternsDetected == null ? List.of() : List.copyOf(patternsDetected);
        contentSample = contentSample == null ? "" : contentSample;
    }

    public boolean isInjection() {
        return PROMPT_INJECTION.equals(eventType);
    }

    public int patternCount() {
        return patternsDetected.size();
    }

    static String truncate(String sample, int maxLength) {
        if (sample == null) {
            return "";
        }
        int limit = Math.max(0, maxLength);
        if (sample.length() <= limit) {
            return sample;
        }
        if (limit > 0 && Character.isHighSurrogate(sample.charAt(limit - 1))) {
            limit--;
        }
        return sample.substring(0, limit);
    }
}
