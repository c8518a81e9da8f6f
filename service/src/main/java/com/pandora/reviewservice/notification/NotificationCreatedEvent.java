package com.pandora.reviewservice.notification;

/**
 * Published after an in-app notification row is written; carries everything the email step needs
 * so that the listener does not touch the persistence context after commit.
 */
public record NotificationCreatedEvent(Long notificationId, Long recipientId, String recipientEmail,
                                       String title, String message) {
}
