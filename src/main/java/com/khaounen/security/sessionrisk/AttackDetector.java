package com.khaounen.security.sessionrisk;

import java.util.Optional;

/**
 * One link of the detector chain. Called with the profile monitor held and
 * after the newest event has been recorded.
 */
@FunctionalInterface
public interface AttackDetector {

    /**
     * @return the block reason, or empty when the session looks benign
     */
    Optional<String> detect(SessionRiskProfile profile);
}
