package com.khaounen.security.sessionrisk;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
public class SessionBlockAlertDispatcher implements SessionBlockListener {

    private final SessionRiskAlertProperties properties;
    private final ObjectProvider<ObjectMapper> objectMapperProvider;
    private final ObjectProvider<JavaMailSender> mailSenderProvider;

    public SessionBlockAlertDispatcher(
            SessionRiskAlertProperties properties,
            ObjectProvider<ObjectMapper> objectMapperProvider,
            ObjectProvider<JavaMailSender> mailSenderProvider
    ) {
        this.properties = properties;
        this.objectMapperProvider = objectMapperProvider;
        this.mailSenderProvider = mailSenderProvider;
    }

    @Override
    public void onBlock(SessionBlockEvent event) {
        if (properties == null || !properties.shouldAlert(event.riskLevel())) {
            return;
        }
        sendWebhook(event);
        sendMail(event);
    }

    private void sendWebhook(SessionBlockEvent event) {
        SessionRiskAlertProperties.Webhook webhook = properties.getWebhook();
        if (webhook == null || !webhook.isConfigured()) {
            return;
        }
        try {
            ObjectMapper mapper = objectMapperProvider.getIfAvailable(ObjectMapper::new);
            String payload = mapper.writeValueAsString(buildPayload(event, properties.isIncludeContentSample()));
            HttpClient client = HttpClient.newBuilder()
                    .connectTimeout(webhook.getConnectTimeout())
                    .build();
            HttpRequest.Builder request = HttpRequest.newBuilder()
                    .uri(URI.create(webhook.getUrl()))
                    .timeout(webhook.getRequestTimeout())
                    .header("Content-Type", "application/json");
            webhook.getHeaders().forEach(request::header);
            client.sendAsync(request.POST(HttpRequest.BodyPublishers.ofString(payload)).build(),
                            HttpResponse.BodyHandlers.discarding())
                    .exceptionally(ex -> {
                        log.warn("session-risk webhook alert failed for {}: {}", event.sessionId(), ex.getMessage());
                        return null;
                    });
        } catch (Exception ex) {
            log.warn("session-risk webhook alert failed for {}: {}", event.sessionId(), ex.getMessage());
        }
    }

    private void sendMail(SessionBlockEvent event) {
        SessionRiskAlertProperties.Mail mail = properties.getMail();
        if (mail == null || !mail.isConfigured()) {
            return;
        }
        JavaMailSender sender = mailSenderProvider.getIfAvailable();
        if (sender == null) {
            log.debug("session-risk mail alert skipped for {}: no JavaMailSender", event.sessionId());
            return;
        }
        try {
            SimpleMailMessage message = new SimpleMailMessage();
            message.setFrom(mail.getFrom());
            message.setTo(mail.getRecipients().toArray(new String[0]));
            message.setSubject(mail.subjectFor(event));
            message.setText(buildMailBody(event, properties.isIncludeContentSample()));
            sender.send(message);
        } catch (Exception ex) {
            log.warn("session-risk mail alert failed for {}: {}", event.sessionId(), ex.getMessage());
        }
    }

    Map<String, Object> buildPayload(SessionBlockEvent event, boolean includeContentSample) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("timestamp", event.blockedAt().toString());
        payload.put("sessionId", event.sessionId());
        payload.put("reason", event.reason());
        payload.put("riskLevel", event.riskLevel().name());
        payload.put("cumulativeRisk", event.cumulativeRisk());
        payload.put("injectionAttempts", event.injectionAttempts());
        payload.put("highRiskCount", event.highRiskCount());
        payload.put("eventCount", event.eventCount());
        if (includeContentSample) {
            payload.put("lastContentSample", event.lastContentSample());
        }
        return payload;
    }

    String buildMailBody(SessionBlockEvent event, boolean includeContentSample) {
        StringBuilder sb = new StringBuilder();
        sb.append("Session blocked\n");
        sb.append("timestamp: ").append(event.blockedAt()).append('\n');
        sb.append("sessionId: ").append(event.sessionId()).append('\n');
        sb.append("reason: ").append(event.reason()).append('\n');
        sb.append("riskLevel: ").append(event.riskLevel()).append('\n');
        sb.append("cumulativeRisk: ").append(event.cumulativeRisk()).append('\n');
        sb.append("injectionAttempts: ").append(event.injectionAttempts()).append('\n');
        sb.append("highRiskCount: ").append(event.highRiskCount()).append('\n');
        sb.append("eventCount: ").append(event.eventCount()).append('\n');
        if (includeContentSample) {
            sb.append("lastContentSample: ").append(event.lastContentSample()).append('\n');
        }
        return sb.toString();
    }
}
