package com.pandora.reviewservice.service;

import com.pandora.reviewservice.access.AccessAction;
import com.pandora.reviewservice.access.AccessEvaluator;
import com.pandora.reviewservice.audit.AuditLogSink;
import com.pandora.reviewservice.entity.AuditAction;
import com.pandora.reviewservice.entity.Comment;
import com.pandora.reviewservice.entity.Submission;
import com.pandora.reviewservice.entity.User;
import com.pandora.reviewservice.exception.SubmissionValidationException;
import com.pandora.reviewservice.notification.NotificationDispatcher;
import com.pandora.reviewservice.repository.CommentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Reviewer comments on a submission. Internal comments stay within MICAT and notify nobody.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CommentService {

    private final AccessEvaluator accessEvaluator;
    private final CommentRepository commentRepository;
    private final AuditLogSink auditLogSink;
    private final NotificationDispatcher notificationDispatcher;
    private final Clock clock;

    @Transactional
    public Comment addComment(User actor, Submission submission, String text, boolean internal, String origin) {
        accessEvaluator.check(actor, AccessAction.ADD_COMMENT, submission, "Only MICAT reviewers can add comments");
        if (text == null || text.isBlank()) {
            throw new SubmissionValidationException(List.of("Comment text is required"));
        }

        Comment comment = new Comment();
        comment.setSubmission(submission);
        comment.setAuthor(actor);
        comment.setText(text.trim());
        comment.setInternal(internal);
        comment.setCreatedAt(OffsetDateTime.now(clock));
        Comment saved = commentRepository.saveAndFlush(comment);

        auditLogSink.record(actor, AuditAction.COMMENT_ADDED, submission.getId(),
                String.format("Added comment on '%s'", submission.getTitle()), origin);

        User submitter = submission.getSubmittedBy();
        if (!internal && submitter != null) {
            notificationDispatcher.notify(submitter, "New Comment",
                    String.format("MICAT added a comment on '%s'", submission.getTitle()),
                    submission, AuditAction.COMMENT_ADDED.name() + ":" + submission.getId() + ":" + saved.getId());
        }

        log.info("Comment {} ({}) added to submission {} by user {}",
                saved.getId(), internal ? "internal" : "public", submission.getId(), actor.getId());
        return saved;
    }
}
