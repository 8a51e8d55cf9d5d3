package com.khaounen.security.sessionrisk;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

@Slf4j
public class SessionRiskTracker {

    private final SessionRiskProperties properties;
    private final Clock clock;
    private final List<AttackDetector> detectors;
    private final SessionBlockListener blockListener;

    // updates and reads: read lock + profile monitor; create and evict: write lock
    private final Map<String, SessionRiskProfile> sessions = new ConcurrentHashMap<>();
    private final ReentrantReadWriteLock tableLock = new ReentrantReadWriteLock();

    public SessionRiskTracker(SessionRiskProperties properties) {
        this(properties, Clock.systemUTC(), SessionBlockListener.NOOP);
    }

    public SessionRiskTracker(SessionRiskProperties properties, Clock clock, SessionBlockListener blockListener) {
        this(properties, clock, defaultDetectors(properties), blockListener);
    }

    public SessionRiskTracker(
            SessionRiskProperties properties,
            Clock clock,
            List<AttackDetector> detectors,
            SessionBlockListener blockListener
    ) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.detectors = List.copyOf(detectors);
        this.blockListener = blockListener == null ? SessionBlockListener.NOOP : blockListener;
        if (properties.getMaxSessions() < 1) {
            throw new IllegalArgumentException("max-sessions must be positive: " + properties.getMaxSessions());
        }
        if (properties.getWindowCapacity() < 1) {
            throw new IllegalArgumentException("window-capacity must be positive: " + properties.getWindowCapacity());
        }
        if (properties.getSessionIdleTimeout() == null || properties.getSessionIdleTimeout().isNegative()) {
            throw new IllegalArgumentException("session-idle-timeout must not be negative");
        }
    }

    public static List<AttackDetector> defaultDetectors(SessionRiskProperties properties) {
        return List.of(
                new HardThresholdDetector(properties),
                new EchoChamberDetector(properties),
                new CrescendoDetector(properties)
        );
    }

    public RiskDecision trackRiskEvent(
            String sessionId,
            double riskScore,
            String eventType,
            List<String> patternsDetected,
            String contentSample
    ) {
        requireSessionId(sessionId);
        if (Double.isNaN(riskScore) || Double.isInfinite(riskScore) || riskScore < 0) {
            throw new IllegalArgumentException("risk score must be a finite non-negative number: " + riskScore);
        }
        if (eventType == null) {
            throw new IllegalArgumentException("event type is required");
        }

        RiskEvent event = new RiskEvent(
                clock.instant(),
                riskScore,
                eventType,
                cleanPatterns(patternsDetected),
                RiskEvent.truncate(contentSample, properties.getContentSampleLength())
        );

        Outcome outcome;
        Lock held = tableLock.readLock();
        held.lock();
        try {
            SessionRiskProfile profile = sessions.get(sessionId);
            if (profile == null || sessions.size() >= properties.getMaxSessions()) {
                held.unlock();
                held = tableLock.writeLock();
                held.lock();
                profile = getOrCreate(sessionId, event.timestamp());
            }
            synchronized (profile) {
                outcome = apply(profile, event);
            }
        } finally {
            held.unlock();
        }

        if (outcome.blockEvent() != null) {
            notifyBlocked(outcome.blockEvent());
        }
        return outcome.decision();
    }

    public SessionStatus getSessionStatus(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return SessionStatus.notFound();
        }
        Lock lock = tableLock.readLock();
        lock.lock();
        try {
            SessionRiskProfile profile = sessions.get(sessionId);
            if (profile == null) {
                return SessionStatus.notFound();
            }
            synchronized (profile) {
                Duration duration = Duration.between(profile.getCreatedAt(), clock.instant());
                return new SessionStatus.Found(
                        profile.getSessionId(),
                        profile.isBlocked() ? SessionState.BLOCKED : SessionState.ACTIVE,
                        profile.getBlockReason(),
                        profile.riskLevel(),
                        profile.getCumulativeRisk(),
                        profile.getInjectionAttempts(),
                        profile.getHighRiskCount(),
                        profile.eventCount(),
                        duration.isNegative() ? Duration.ZERO : duration
                );
            }
        } finally {
            lock.unlock();
        }
    }

    public boolean isSessionBlocked(String sessionId) {
        if (sessionId == null) {
            return false;
        }
        SessionRiskProfile profile = sessions.get(sessionId);
        return profile != null && profile.isBlocked();
    }

    public int activeSessionCount() {
        return sessions.size();
    }

    public int evictIdleSessions() {
        Lock lock = tableLock.writeLock();
        lock.lock();
        try {
            int removed = removeIdle(clock.instant(), null);
            if (removed > 0) {
                log.debug("session-risk idle sweep removed {} sessions", removed);
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    private Outcome apply(SessionRiskProfile profile, RiskEvent event) {
        profile.record(event, properties.getHighRiskThreshold());
        if (profile.isBlocked()) {
            return new Outcome(RiskDecision.block(profile.getBlockReason()), null);
        }

        Optional<String> detected = runDetectors(profile);
        if (detected.isEmpty()) {
            return new Outcome(RiskDecision.allow(), null);
        }

        String reason = detected.get();
        profile.block(reason);
        log.warn("Session {} blocked due to: {}. Cumulative risk: {}, Injection attempts: {}",
                profile.getSessionId(),
                reason,
                String.format(Locale.ROOT, "%.2f", profile.getCumulativeRisk()),
                profile.getInjectionAttempts());
        return new Outcome(RiskDecision.block(reason), SessionBlockEvent.of(profile, event));
    }

    private Optional<String> runDetectors(SessionRiskProfile profile) {
        for (AttackDetector detector : detectors) {
            Optional<String> reason = detector.detect(profile);
            if (reason.isPresent()) {
                return reason;
            }
        }
        return Optional.empty();
    }

    private void notifyBlocked(SessionBlockEvent event) {
        try {
            blockListener.onBlock(event);
        } catch (RuntimeException ex) {
            log.warn("session-risk block listener failed for {}: {}", event.sessionId(), ex.getMessage());
        }
    }

    // caller holds the write lock
    private SessionRiskProfile getOrCreate(String sessionId, Instant now) {
        if (sessions.size() >= properties.getMaxSessions()) {
            cleanup(now, sessionId);
        }
        return sessions.computeIfAbsent(
                sessionId,
                id -> new SessionRiskProfile(id, now, properties.getWindowCapacity())
        );
    }

    // the requesting session is never evicted to make room for itself
    private void cleanup(Instant now, String requestingId) {
        int idle = removeIdle(now, requestingId);
        int evicted = 0;
        int maxSessions = properties.getMaxSessions();
        if (sessions.size() >= maxSessions) {
            int target = maxSessions - properties.effectiveEvictionHeadroom();
            List<SessionRiskProfile> oldest = new ArrayList<>(sessions.values());
            oldest.sort(Comparator.comparing(SessionRiskProfile::getLastActivity));
            int excess = sessions.size() - target;
            for (SessionRiskProfile profile : oldest) {
                if (evicted >= excess) {
                    break;
                }
                if (profile.getSessionId().equals(requestingId)) {
                    continue;
                }
                if (sessions.remove(profile.getSessionId(), profile)) {
                    evicted++;
                }
            }
        }
        log.debug("session-risk capacity cleanup removed {} idle and {} oldest sessions, {} remain",
                idle, evicted, sessions.size());
    }

    private int removeIdle(Instant now, String keepId) {
        Duration timeout = properties.getSessionIdleTimeout();
        int removed = 0;
        Iterator<SessionRiskProfile> it = sessions.values().iterator();
        while (it.hasNext()) {
            SessionRiskProfile profile = it.next();
            if (!profile.getSessionId().equals(keepId)
                    && Duration.between(profile.getLastActivity(), now).compareTo(timeout) > 0) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    private static List<String> cleanPatterns(List<String> patternsDetected) {
        if (patternsDetected == null || patternsDetected.isEmpty()) {
            return List.of();
        }
        List<String> cleaned = new ArrayList<>(patternsDetected.size());
        for (String pattern : patternsDetected) {
            if (pattern != null && !pattern.isBlank()) {
                cleaned.add(pattern);
            }
        }
        return cleaned;
    }

    private static void requireSessionId(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("session id is required");
        }
    }

    private record Outcome(RiskDecision decision, SessionBlockEvent blockEvent) {
    }
}
