package com.pandora.reviewservice.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Entity
@Table(name = "notifications")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Notification {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "recipient_id", nullable = false, updatable = false)
    private User recipient;

    @Column(nullable = false, length = 200, updatable = false)
    private String title;

    @Column(nullable = false, columnDefinition = "text", updatable = false)
    private String message;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "submission_id", updatable = false)
    private Submission submission;

    @Column(name = "is_read", nullable = false)
    private boolean read;

    // unique per recipient, makes re-dispatch of the same event a no-op
    @Column(name = "event_key", nullable = false, length = 100, updatable = false)
    private String eventKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    public static Notification create(User recipient, String title, String message,
                                      Submission submission, String eventKey, OffsetDateTime createdAt) {
        Notification n = new Notification();
        n.recipient = recipient;
        n.title = title;
        n.message = message;
        n.submission = submission;
        n.eventKey = eventKey;
        n.createdAt = createdAt;
        return n;
    }

    public boolean isAddressedTo(User user) {
        return user != null && recipient != null && recipient.getId().equals(user.getId());
    }

    public void markRead() {
        this.read = true;
    }
}
