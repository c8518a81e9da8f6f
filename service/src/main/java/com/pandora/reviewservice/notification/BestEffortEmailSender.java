package com.pandora.reviewservice.notification;

import com.pandora.reviewservice.config.NotificationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * At-most-once email delivery. Failures are logged for operators and never reach the caller;
 * there is no retry.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BestEffortEmailSender {

    private final EmailTransport emailTransport;
    private final NotificationProperties properties;

    public EmailDeliveryResult send(String recipientAddress, String subject, String body) {
        NotificationProperties.Email config = properties.getEmail();
        if (!config.isEnabled()) {
            return EmailDeliveryResult.skipped("email disabled");
        }
        if (recipientAddress == null || recipientAddress.isBlank()) {
            log.debug("Skipping email '{}': recipient has no address", subject);
            return EmailDeliveryResult.skipped("no recipient address");
        }

        EmailDeliveryResult result = emailTransport.send(recipientAddress, config.getSubjectPrefix() + subject, body);
        if (result.status() == EmailDeliveryResult.Status.FAILED) {
            log.warn("Email to {} not delivered ('{}'): {}", recipientAddress, subject, result.detail());
        }
        return result;
    }
}
