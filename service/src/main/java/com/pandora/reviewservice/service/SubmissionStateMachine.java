package com.pandora.reviewservice.service;

import com.pandora.reviewservice.access.AccessAction;
import com.pandora.reviewservice.access.AccessEvaluator;
import com.pandora.reviewservice.audit.AuditLogSink;
import com.pandora.reviewservice.entity.*;
import com.pandora.reviewservice.exception.ConflictException;
import com.pandora.reviewservice.exception.InvalidStatusTransitionException;
import com.pandora.reviewservice.exception.SubmissionValidationException;
import com.pandora.reviewservice.notification.NotificationDispatcher;
import com.pandora.reviewservice.repository.NotificationRepository;
import com.pandora.reviewservice.repository.SubmissionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Applies lifecycle transitions to submissions.
 *
 * <p>Each method runs in the caller's transaction (or its own): the access check comes first,
 * then the status guard, the mutation, a flushed save that fails on a stale {@code @Version},
 * the audit entry and finally the notifications. Any exception rolls back all of it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SubmissionStateMachine {

    private final AccessEvaluator accessEvaluator;
    private final SubmissionRepository submissionRepository;
    private final NotificationRepository notificationRepository;
    private final AuditLogSink auditLogSink;
    private final NotificationDispatcher notificationDispatcher;
    private final Clock clock;

    // ── Create ────────────────────────────────────────────────────────────────

    @Transactional
    public Submission create(User actor, Mac mac, SubmissionContent content, String origin) {
        accessEvaluator.check(actor, AccessAction.CREATE_SUBMISSION, null,
                "Only MAC officers of an active agency can create submissions");
        if (content.artifactRef() == null || content.artifactRef().isBlank()) {
            throw new SubmissionValidationException(List.of("An artifact reference is required"));
        }

        OffsetDateTime at = now();
        Submission submission = new Submission();
        content.applyTo(submission);
        submission.setMac(mac);
        submission.setSubmittedBy(actor);
        submission.setSubmittedAt(at);
        submission.markUpdated(at);

        Submission saved = submissionRepository.saveAndFlush(submission);
        auditLogSink.record(actor, AuditAction.SUBMISSION_CREATED, saved.getId(),
                "Created submission: " + saved.getTitle(), origin);
        notificationDispatcher.notifyActiveReviewers(
                "New Submission",
                String.format("%s submitted: %s", mac.getAcronym(), saved.getTitle()),
                saved, eventKey(AuditAction.SUBMISSION_CREATED, saved));

        log.info("Submission {} created by user {} for {}", saved.getId(), actor.getId(), mac.getAcronym());
        return saved;
    }

    // ── Edit ──────────────────────────────────────────────────────────────────

    @Transactional
    public Submission edit(User actor, Submission submission, SubmissionContent content, String origin) {
        accessEvaluator.check(actor, AccessAction.EDIT_SUBMISSION, submission,
                "You can only edit your own submissions while they are pending or returned");

        SubmissionStatus before = submission.getStatus();
        content.applyTo(submission);
        submission.reopenIfReturned();
        submission.markUpdated(now());

        Submission saved = save(submission);
        auditLogSink.record(actor, AuditAction.SUBMISSION_UPDATED, saved.getId(),
                "Updated submission: " + saved.getTitle(), origin);

        log.info("Submission {} edited by user {} ({} -> {})", saved.getId(), actor.getId(), before, saved.getStatus());
        return saved;
    }

    // ── Review ────────────────────────────────────────────────────────────────

    @Transactional
    public Submission startReview(User actor, Submission submission, String origin) {
        accessEvaluator.check(actor, AccessAction.REVIEW_SUBMISSION, submission,
                "Only MICAT reviewers can review submissions");
        requireTransition(submission, SubmissionEvent.START_REVIEW);

        submission.recordReview(actor, now(), submission.getReviewerComments(), null);
        submission.startReview();

        Submission saved = save(submission);
        auditLogSink.record(actor, AuditAction.SUBMISSION_REVIEWED, saved.getId(),
                "Started review of submission: " + saved.getTitle(), origin);
        notifySubmitter(saved, AuditAction.SUBMISSION_REVIEWED, "Submission Under Review",
                String.format("Your submission '%s' is now under review by MICAT.", saved.getTitle()));

        log.info("Submission {} under review by user {}", saved.getId(), actor.getId());
        return saved;
    }

    @Transactional
    public Submission review(User actor, Submission submission, ReviewDecision decision, String origin) {
        accessEvaluator.check(actor, AccessAction.REVIEW_SUBMISSION, submission,
                "Only MICAT reviewers can review submissions");
        validate(decision);
        ReviewOutcome outcome = decision.outcome();
        requireTransition(submission, outcome.getEvent());

        OffsetDateTime at = now();
        submission.recordReview(actor, at, decision.reviewerComments(), decision.priority());

        String title;
        String message;
        String description;
        switch (outcome) {
            case APPROVE -> {
                submission.approve(at, decision.publish());
                title = "Submission Approved";
                message = decision.publish()
                        ? String.format("Your submission '%s' has been approved and published.", submission.getTitle())
                        : String.format("Your submission '%s' has been approved.", submission.getTitle());
                description = "Approved submission: " + submission.getTitle();
            }
            case RETURN -> {
                submission.returnForEdits();
                title = "Submission Returned for Edits";
                message = String.format("Please review and update your submission '%s'. Comments: %s",
                        submission.getTitle(), nullToEmpty(decision.reviewerComments()));
                description = "Returned submission for edits: " + submission.getTitle();
            }
            case DENY -> {
                submission.deny(decision.denialReason().trim());
                title = "Submission Denied";
                message = String.format("Your submission '%s' has been denied. Reason: %s",
                        submission.getTitle(), submission.getDenialReason());
                description = "Denied submission: " + submission.getTitle();
            }
            default -> throw new IllegalArgumentException("Unknown review outcome: " + outcome);
        }

        Submission saved = save(submission);
        auditLogSink.record(actor, outcome.getAuditAction(), saved.getId(), description, origin);
        notifySubmitter(saved, outcome.getAuditAction(), title, message);

        log.info("Submission {} {} by user {}", saved.getId(), saved.getStatus(), actor.getId());
        return saved;
    }

    // ── Delete ────────────────────────────────────────────────────────────────

    @Transactional
    public void delete(User actor, Submission submission, String origin) {
        accessEvaluator.check(actor, AccessAction.DELETE_SUBMISSION, submission,
                "You can only delete your own submissions while they are pending");

        Long id = submission.getId();
        String acronym = submission.getMac() != null ? submission.getMac().getAcronym() : "unknown agency";
        auditLogSink.record(actor, AuditAction.SUBMISSION_DELETED, id,
                String.format("Deleted submission #%d: %s from %s", id, submission.getTitle(), acronym), origin);

        int removed = notificationRepository.deleteAllBySubmissionId(id);
        try {
            submissionRepository.delete(submission);
            submissionRepository.flush();
        } catch (OptimisticLockingFailureException e) {
            throw ConflictException.concurrentModification(id);
        }
        log.info("Submission {} deleted by user {} ({} notifications removed)", id, actor.getId(), removed);
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private void requireTransition(Submission submission, SubmissionEvent event) {
        if (!event.isAllowedFrom(submission.getStatus())) {
            throw new InvalidStatusTransitionException(submission.getId(), submission.getStatus(), event);
        }
    }

    private void validate(ReviewDecision decision) {
        if (decision.outcome() == null) {
            throw new SubmissionValidationException(List.of("Review action is required"));
        }
        if (decision.outcome() == ReviewOutcome.DENY
                && (decision.denialReason() == null || decision.denialReason().isBlank())) {
            throw new SubmissionValidationException(List.of("A denial reason is required"));
        }
    }

    private Submission save(Submission submission) {
        try {
            return submissionRepository.saveAndFlush(submission);
        } catch (OptimisticLockingFailureException e) {
            throw ConflictException.concurrentModification(submission.getId());
        }
    }

    private void notifySubmitter(Submission submission, AuditAction action, String title, String message) {
        User submitter = submission.getSubmittedBy();
        if (submitter == null) {
            log.warn("Submission {} has no submitter, skipping '{}' notification", submission.getId(), title);
            return;
        }
        notificationDispatcher.notify(submitter, title, message, submission, eventKey(action, submission));
    }

    static String eventKey(AuditAction action, Submission submission) {
        return action.name() + ":" + submission.getId() + ":" + submission.getVersion();
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
