package com.khaounen.security.sessionrisk;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.mail.javamail.JavaMailSender;

import java.time.Clock;

@Slf4j
@AutoConfiguration
@ConditionalOnProperty(prefix = "session-risk", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties({SessionRiskProperties.class, SessionRiskAlertProperties.class})
public class SessionRiskAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public SessionBlockListener sessionBlockListener(
            SessionRiskAlertProperties properties,
            ObjectProvider<ObjectMapper> objectMapperProvider,
            ObjectProvider<JavaMailSender> mailSenderProvider
    ) {
        return new SessionBlockAlertDispatcher(properties, objectMapperProvider, mailSenderProvider);
    }

    @Bean
    @ConditionalOnMissingBean
    public SessionRiskTracker sessionRiskTracker(
            SessionRiskProperties properties,
            ObjectProvider<Clock> clockProvider,
            SessionBlockListener blockListener
    ) {
        Clock clock = clockProvider.getIfUnique(Clock::systemUTC);
        log.info("session-risk tracker enabled: max-sessions={}, idle-timeout={}",
                properties.getMaxSessions(), properties.getSessionIdleTimeout());
        return new SessionRiskTracker(properties, clock, blockListener);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(TurnClassifier.class)
    public SessionRiskGuard sessionRiskGuard(SessionRiskTracker tracker, TurnClassifier classifier) {
        return new SessionRiskGuard(tracker, classifier);
    }
}
