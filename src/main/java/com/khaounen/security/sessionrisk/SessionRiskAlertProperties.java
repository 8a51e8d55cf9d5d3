package com.khaounen.security.sessionrisk;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "session-risk.alert")
public class SessionRiskAlertProperties {

    private boolean includeContentSample = false;
    private RiskLevel minimumRiskLevel = RiskLevel.LOW;
    private Webhook webhook = new Webhook();
    private Mail mail = new Mail();

    public boolean shouldAlert(RiskLevel riskLevel) {
        return riskLevel != null && riskLevel.compareTo(minimumRiskLevel) >= 0;
    }

    @Data
    public static class Webhook {
        private String url;
        private Duration connectTimeout = Duration.ofSeconds(1);
        private Duration requestTimeout = Duration.ofSeconds(2);
        private Map<String, String> headers = new LinkedHashMap<>();

        public boolean isConfigured() {
            return url != null && !url.isBlank();
        }
    }

    @Data
    public static class Mail {
        private String from;
        private List<String> recipients = new ArrayList<>();
        private String subjectPrefix = "[session-risk]";

        public boolean isConfigured() {
            return from != null && !from.isBlank() && !recipients.isEmpty();
        }

        public String subjectFor(SessionBlockEvent event) {
            return subjectPrefix + " session " + event.sessionId() + " blocked (" + event.riskLevel().label() + ")";
        }
    }
}
