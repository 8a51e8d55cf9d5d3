package com.khaounen.security.sessionrisk;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

public class CrescendoDetector implements AttackDetector {

    static final String INJECTION_COMPLEXITY_REASON = "Crescendo attack: Escalating injection complexity";

    private final int window;
    private final double increasingRatio;
    private final double growthFactor;
    private final int minInjections;

    public CrescendoDetector(SessionRiskProperties properties) {
        this.window = Math.max(2, properties.getCrescendoWindow());
        this.increasingRatio = properties.getCrescendoIncreasingRatio();
        this.growthFactor = properties.getCrescendoGrowthFactor();
        this.minInjections = Math.max(2, properties.getCrescendoMinInjections());
    }

    @Override
    public Optional<String> detect(SessionRiskProfile profile) {
        if (profile.eventCount() < window) {
            return Optional.empty();
        }
        List<RiskEvent> recent = profile.recentEvents(window);

        int transitions = recent.size() - 1;
        int increasing = 0;
        for (int i = 1; i < recent.size(); i++) {
            if (recent.get(i).riskScore() > recent.get(i - 1).riskScore()) {
                increasing++;
            }
        }
        if (increasing >= transitions * increasingRatio) {
            double first = recent.get(0).riskScore();
            double last = recent.get(transitions).riskScore();
            if (last > first * growthFactor) {
                return Optional.of(String.format(Locale.ROOT,
                        "Crescendo attack detected: Risk escalated from %.2f to %.2f", first, last));
            }
        }

        List<RiskEvent> injections = recent.stream().filter(RiskEvent::isInjection).toList();
        if (injections.size() >= minInjections && isNonDecreasing(injections)) {
            return Optional.of(INJECTION_COMPLEXITY_REASON);
        }
        return Optional.empty();
    }

    private static boolean isNonDecreasing(List<RiskEvent> injections) {
        for (int i = 1; i < injections.size(); i++) {
            if (injections.get(i).patternCount() < injections.get(i - 1).patternCount()) {
                return false;
            }
        }
        return true;
    }
}
