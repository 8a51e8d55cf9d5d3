package com.khaounen.security.sessionrisk;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionRiskAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(SessionRiskAutoConfiguration.class));

    @Test
    void registersTrackerAndAlertDispatcherByDefault() {
        runner.run(context -> {
            assertEquals(1, context.getBeansOfType(SessionRiskTracker.class).size());
            assertInstanceOf(SessionBlockAlertDispatcher.class, context.getBean(SessionBlockListener.class));
            assertTrue(context.getBeansOfType(SessionRiskGuard.class).isEmpty());
        });
    }

    @Test
    void bindsTrackerProperties() {
        runner.withPropertyValues(
                "session-risk.max-sessions=42",
                "session-risk.session-idle-timeout=5m",
                "session-risk.high-risk-threshold=0.9",
                "session-risk.alert.mail.recipients=secops@example.com",
                "session-risk.alert.webhook.request-timeout=5s"
        ).run(context -> {
            SessionRiskProperties properties = context.getBean(SessionRiskProperties.class);
            assertEquals(42, properties.getMaxSessions());
            assertEquals(Duration.ofMinutes(5), properties.getSessionIdleTimeout());
            assertEquals(0.9, properties.getHighRiskThreshold());
            SessionRiskAlertProperties alert = context.getBean(SessionRiskAlertProperties.class);
            assertEquals(List.of("secops@example.com"), alert.getMail().getRecipients());
            assertEquals(Duration.ofSeconds(5), alert.getWebhook().getRequestTimeout());
        });
    }

    @Test
    void createsGuardWhenClassifierIsPresent() {
        runner.withUserConfiguration(ClassifierConfig.class).run(context -> {
            SessionRiskGuard guard = context.getBean(SessionRiskGuard.class);
            assertFalse(guard.inspect("s1", "hi there").blocked());
            assertTrue(context.getBean(SessionRiskTracker.class).getSessionStatus("s1").exists());
        });
    }

    @Test
    void keepsUserDefinedListener() {
        runner.withUserConfiguration(ListenerConfig.class).run(context ->
                assertSame(ListenerConfig.LISTENER, context.getBean(SessionBlockListener.class)));
    }

    @Test
    void canBeDisabled() {
        runner.withPropertyValues("session-risk.enabled=false").run(context ->
                assertTrue(context.getBeansOfType(SessionRiskTracker.class).isEmpty()));
    }

    @Configuration(proxyBeanMethods = false)
    static class ClassifierConfig {
        @Bean
        TurnClassifier turnClassifier() {
            return text -> TurnClassification.benign();
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class ListenerConfig {
        static final SessionBlockListener LISTENER = event -> { };

        @Bean
        SessionBlockListener sessionBlockListener() {
            return LISTENER;
        }
    }
}
