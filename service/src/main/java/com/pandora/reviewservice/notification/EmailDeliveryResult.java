package com.pandora.reviewservice.notification;

/**
 * Outcome of one email attempt. Transports report failures through this type instead of throwing.
 */
public record EmailDeliveryResult(Status status, String detail) {

    public enum Status {
        DELIVERED,
        FAILED,
        SKIPPED
    }

    public static EmailDeliveryResult delivered() {
        return new EmailDeliveryResult(Status.DELIVERED, null);
    }

    public static EmailDeliveryResult failed(String detail) {
        return new EmailDeliveryResult(Status.FAILED, detail);
    }

    public static EmailDeliveryResult skipped(String detail) {
        return new EmailDeliveryResult(Status.SKIPPED, detail);
    }

    public boolean isDelivered() {
        return status == Status.DELIVERED;
    }
}
