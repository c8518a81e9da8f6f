package com.pandora.reviewservice.notification;

public interface EmailTransport {

    /** Must not throw for delivery problems; return {@link EmailDeliveryResult#failed} instead. */
    EmailDeliveryResult send(String recipientAddress, String subject, String body);
}
