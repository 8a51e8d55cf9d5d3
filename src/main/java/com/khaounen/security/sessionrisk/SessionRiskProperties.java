package com.khaounen.security.sessionrisk;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "session-risk")
public class SessionRiskProperties {

    private boolean enabled = true;

    private double highRiskThreshold = 0.7;
    private Duration sessionIdleTimeout = Duration.ofMinutes(30);
    private int maxSessions = 10000;
    private int evictionHeadroom = 1000;
    private int windowCapacity = 100;
    private int contentSampleLength = 100;

    private int maxInjectionAttempts = 5;
    private double cumulativeRiskLimit = 5.0;

    private int echoRepeatThreshold = 3;
    private int echoLookback = 10;
    private int similarityWindow = 5;
    private double similarityTolerance = 0.1;
    private int similarTransitionsThreshold = 4;

    private int crescendoWindow = 5;
    private double crescendoIncreasingRatio = 0.8;
    private double crescendoGrowthFactor = 1.5;
    private int crescendoMinInjections = 3;

    // capped at a tenth of maxSessions, at least one
    public int effectiveEvictionHeadroom() {
        int cap = Math.max(1, maxSessions / 10);
        return Math.max(1, Math.min(evictionHeadroom, cap));
    }
}
