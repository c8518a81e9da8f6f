package com.pandora.reviewservice.notification;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Sends the email copy of a notification once the transition that created it has committed,
 * so a rolled-back transition never emails anyone.
 */
@Component
@RequiredArgsConstructor
public class EmailNotificationListener {

    private final BestEffortEmailSender emailSender;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onNotificationCreated(NotificationCreatedEvent event) {
        emailSender.send(event.recipientEmail(), event.title(), event.message());
    }
}
