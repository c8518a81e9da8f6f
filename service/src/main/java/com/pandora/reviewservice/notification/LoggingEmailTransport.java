package com.pandora.reviewservice.notification;

import lombok.extern.slf4j.Slf4j;

/**
 * Used when no SMTP server is configured: the message goes to the log instead of the wire.
 */
@Slf4j
public class LoggingEmailTransport implements EmailTransport {

    @Override
    public EmailDeliveryResult send(String recipientAddress, String subject, String body) {
        log.info("Email to {} | {} | {}", recipientAddress, subject, body);
        return EmailDeliveryResult.delivered();
    }
}
