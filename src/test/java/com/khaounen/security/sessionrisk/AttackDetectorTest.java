package com.khaounen.security.sessionrisk;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AttackDetectorTest {

    private final SessionRiskProperties properties = new SessionRiskProperties();

    @Test
    void hardThresholdPrefersInjectionCountOverCumulativeRisk() {
        SessionRiskProfile profile = profile();
        for (int i = 0; i < 5; i++) {
            add(profile, 1.5, RiskEvent.PROMPT_INJECTION);
        }

        Optional<String> reason = new HardThresholdDetector(properties).detect(profile);

        assertEquals(Optional.of("Multiple injection attempts detected"), reason);
    }

    @Test
    void hardThresholdTripsOnCumulativeRisk() {
        SessionRiskProfile profile = profile();
        add(profile, 2.5, "benign");
        assertTrue(new HardThresholdDetector(properties).detect(profile).isEmpty());

        add(profile, 2.5, "benign");
        assertEquals(Optional.of("Cumulative risk threshold exceeded"),
                new HardThresholdDetector(properties).detect(profile));
    }

    @Test
    void echoChamberOnlyCountsPatternsInsideLookback() {
        SessionRiskProfile profile = profile();
        add(profile, 0.1, "benign", "authority_claim");
        add(profile, 0.5, "benign", "authority_claim");
        for (int i = 0; i < 9; i++) {
            add(profile, i % 2 == 0 ? 0.1 : 0.5, "benign", "filler_" + i);
        }
        add(profile, 0.1, "benign", "authority_claim");

        assertTrue(new EchoChamberDetector(properties).detect(profile).isEmpty());
    }

    @Test
    void echoChamberReportsRepeatedPattern() {
        SessionRiskProfile profile = profile();
        add(profile, 0.2, "benign", "hypothetical_framing");
        add(profile, 0.6, "benign", "hypothetical_framing", "role_play");
        add(profile, 0.1, "benign", "hypothetical_framing");

        assertEquals(Optional.of("Echo chamber attack detected: 'hypothetical_framing' repeated 3 times"),
                new EchoChamberDetector(properties).detect(profile));
    }

    @Test
    void echoChamberFlagsNearIdenticalScores() {
        SessionRiskProfile profile = profile();
        for (double score : new double[]{0.5, 0.52, 0.51, 0.53, 0.5}) {
            add(profile, score, "benign");
        }

        assertEquals(Optional.of(EchoChamberDetector.SIMILAR_RISK_REASON),
                new EchoChamberDetector(properties).detect(profile));
    }

    @Test
    void echoChamberIgnoresVaryingScores() {
        SessionRiskProfile profile = profile();
        for (double score : new double[]{0.6, 0.2, 0.5, 0.1, 0.4}) {
            add(profile, score, "benign");
        }

        assertTrue(new EchoChamberDetector(properties).detect(profile).isEmpty());
    }

    @Test
    void crescendoNeedsAFullWindow() {
        SessionRiskProfile profile = profile();
        for (double score : new double[]{0.1, 0.2, 0.3, 0.7}) {
            add(profile, score, "benign");
        }

        assertTrue(new CrescendoDetector(properties).detect(profile).isEmpty());
    }

    @Test
    void crescendoRequiresSubstantialGrowth() {
        SessionRiskProfile profile = profile();
        for (double score : new double[]{0.4, 0.42, 0.44, 0.46, 0.5}) {
            add(profile, score, "benign");
        }

        assertTrue(new CrescendoDetector(properties).detect(profile).isEmpty());
    }

    @Test
    void crescendoNeedsEveryTransitionToRise() {
        SessionRiskProfile profile = profile();
        for (double score : new double[]{0.1, 0.4, 0.2, 0.5, 0.9}) {
            add(profile, score, "benign");
        }

        assertTrue(new CrescendoDetector(properties).detect(profile).isEmpty());
    }

    @Test
    void crescendoFlagsEscalatingInjectionComplexity() {
        SessionRiskProfile profile = profile();
        add(profile, 0.6, "benign");
        add(profile, 0.2, RiskEvent.PROMPT_INJECTION, "ignore_previous");
        add(profile, 0.5, "benign");
        add(profile, 0.1, RiskEvent.PROMPT_INJECTION, "ignore_previous", "system_override");
        add(profile, 0.4, RiskEvent.PROMPT_INJECTION, "dan_mode", "system_override", "encoding_trick");

        assertEquals(Optional.of(CrescendoDetector.INJECTION_COMPLEXITY_REASON),
                new CrescendoDetector(properties).detect(profile));
    }

    @Test
    void crescendoIgnoresDecreasingInjectionComplexity() {
        SessionRiskProfile profile = profile();
        add(profile, 0.6, "benign");
        add(profile, 0.2, RiskEvent.PROMPT_INJECTION, "a", "b", "c");
        add(profile, 0.5, "benign");
        add(profile, 0.1, RiskEvent.PROMPT_INJECTION, "a", "b");
        add(profile, 0.4, RiskEvent.PROMPT_INJECTION, "a");

        assertTrue(new CrescendoDetector(properties).detect(profile).isEmpty());
    }

    private static SessionRiskProfile profile() {
        return new SessionRiskProfile("s", Instant.EPOCH, 100);
    }

    private static void add(SessionRiskProfile profile, double score, String type, String... patterns) {
        Instant at = profile.getLastActivity().plusSeconds(1);
        profile.record(new RiskEvent(at, score, type, List.of(patterns), ""), 0.7);
    }
}
