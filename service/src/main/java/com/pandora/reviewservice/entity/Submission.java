package com.pandora.reviewservice.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Content submitted by a MAC officer for review.
 *
 * <p>Workflow fields (status, review stamps, publication) have no public setters; they change
 * only through the transition methods below, which refuse edges that {@link SubmissionEvent}
 * does not define.
 */
@Entity
@Table(name = "submissions")
@Getter
@Setter
public class Submission {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 300)
    private String title;

    @Enumerated(EnumType.STRING)
    @Column(name = "content_type", nullable = false, length = 20)
    private ContentType contentType;

    @Column(nullable = false, columnDefinition = "text")
    private String description;

    @Column(length = 500)
    private String tags;

    @Column(name = "artifact_ref", nullable = false, length = 500)
    private String artifactRef;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "mac_id", nullable = false)
    private Mac mac;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "submitted_by_id")
    private User submittedBy;

    @Setter(AccessLevel.NONE)
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "reviewed_by_id")
    private User reviewedBy;

    @Setter(AccessLevel.NONE)
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private SubmissionStatus status = SubmissionStatus.PENDING;

    @Setter(AccessLevel.NONE)
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Priority priority = Priority.MEDIUM;

    @Column(name = "is_confidential", nullable = false)
    private boolean confidential;

    @Setter(AccessLevel.NONE)
    @Column(name = "is_published", nullable = false)
    private boolean published;

    @Setter(AccessLevel.NONE)
    @Column(name = "reviewer_comments", columnDefinition = "text")
    private String reviewerComments;

    @Setter(AccessLevel.NONE)
    @Column(name = "denial_reason", columnDefinition = "text")
    private String denialReason;

    @Column(name = "submitted_at", nullable = false, updatable = false)
    private OffsetDateTime submittedAt;

    @Setter(AccessLevel.NONE)
    @Column(name = "reviewed_at")
    private OffsetDateTime reviewedAt;

    @Setter(AccessLevel.NONE)
    @Column(name = "approved_at")
    private OffsetDateTime approvedAt;

    @Setter(AccessLevel.NONE)
    @Column(name = "published_at")
    private OffsetDateTime publishedAt;

    @Setter(AccessLevel.NONE)
    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    @Version
    @Setter(AccessLevel.NONE)
    private Long version;

    @OneToMany(mappedBy = "submission", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.LAZY)
    @OrderBy("createdAt DESC")
    private List<Comment> comments = new ArrayList<>();

    public boolean isSubmittedBy(User user) {
        return user != null && submittedBy != null && Objects.equals(submittedBy.getId(), user.getId());
    }

    public boolean belongsTo(Mac other) {
        return other != null && mac != null && Objects.equals(mac.getId(), other.getId());
    }

    public void markUpdated(OffsetDateTime at) {
        this.updatedAt = at;
    }

    // ── Transitions ───────────────────────────────────────────────────────────

    public void recordReview(User reviewer, OffsetDateTime at, String comments, Priority newPriority) {
        this.reviewedBy = reviewer;
        this.reviewedAt = at;
        this.reviewerComments = comments;
        this.updatedAt = at;
        if (newPriority != null) {
            this.priority = newPriority;
        }
    }

    public void startReview() {
        apply(SubmissionEvent.START_REVIEW);
    }

    public void approve(OffsetDateTime at, boolean publish) {
        apply(SubmissionEvent.APPROVE);
        this.approvedAt = at;
        this.published = publish;
        if (publish) {
            this.publishedAt = at;
        }
    }

    public void deny(String reason) {
        apply(SubmissionEvent.DENY);
        this.denialReason = reason;
    }

    public void returnForEdits() {
        apply(SubmissionEvent.RETURN);
    }

    /** An edit of a returned submission puts it back in the review queue. */
    public void reopenIfReturned() {
        if (status == SubmissionStatus.RETURNED) {
            apply(SubmissionEvent.RESUBMIT);
        }
    }

    private void apply(SubmissionEvent event) {
        if (!event.isAllowedFrom(status)) {
            throw new IllegalStateException(
                    String.format("Submission %d: %s not allowed from %s", id, event, status));
        }
        this.status = event.getTarget();
    }
}
