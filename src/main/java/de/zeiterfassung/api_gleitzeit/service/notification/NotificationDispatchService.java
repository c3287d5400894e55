package de.zeiterfassung.api_gleitzeit.service.notification;

import de.zeiterfassung.api_gleitzeit.entity.employee.Employee;
import de.zeiterfassung.api_gleitzeit.entity.notification.Notification;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Leitet neu angelegte Benachrichtigungen an einen externen Webhook weiter,
 * sofern einer konfiguriert ist. Gesendet wird erst nach dem Commit.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationDispatchService {

    private final RestTemplate restTemplate;
    private final NotificationTextRenderer textRenderer;

    @Value("${gleitzeit.notifications.webhook-url:}")
    private String webhookUrl;

    public boolean isEnabled() {
        return webhookUrl != null && !webhookUrl.isBlank();
    }

    public void dispatchAfterCommit(Employee employee, Notification notification) {
        if (!isEnabled()) {
            return;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("employeeId", employee.getId());
        payload.put("employeeName", employee.getName());
        payload.put("code", notification.getCode().getCode());
        payload.put("date", notification.getNotificationDate().toString());
        payload.put("message", textRenderer.render(notification));

        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    send(payload);
                }
            });
        } else {
            send(payload);
        }
    }

    void send(Map<String, Object> payload) {
        try {
            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);
            HttpEntity<Map<String, Object>> request = new HttpEntity<>(payload, headers);

            log.info("Sende Benachrichtigung (Code {}) an {}", payload.get("code"), webhookUrl);
            ResponseEntity<String> response = restTemplate.exchange(webhookUrl, HttpMethod.POST, request, String.class);

            if (!response.getStatusCode().is2xxSuccessful()) {
                log.warn("Webhook antwortete mit {}", response.getStatusCode());
            }
        } catch (RestClientException e) {
            log.error("Benachrichtigung konnte nicht gesendet werden: {}", e.getMessage(), e);
        }
    }
}
