package com.pandora.reviewservice.service;

import com.pandora.reviewservice.access.SubmissionScope;
import com.pandora.reviewservice.access.VisibilityFilter;
import com.pandora.reviewservice.dto.*;
import com.pandora.reviewservice.entity.*;
import com.pandora.reviewservice.exception.PermissionDeniedException;
import com.pandora.reviewservice.exception.ResourceNotFoundException;
import com.pandora.reviewservice.exception.SubmissionValidationException;
import com.pandora.reviewservice.repository.CommentRepository;
import com.pandora.reviewservice.repository.MacRepository;
import com.pandora.reviewservice.repository.SubmissionRepository;
import com.pandora.reviewservice.repository.SubmissionSpecification;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Entry point for the REST layer: resolves ids to entities (not-found before any permission
 * check), delegates transitions to {@link SubmissionStateMachine} and maps results.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SubmissionService {

    private final SubmissionRepository submissionRepository;
    private final MacRepository macRepository;
    private final CommentRepository commentRepository;
    private final ActorResolver actorResolver;
    private final VisibilityFilter visibilityFilter;
    private final SubmissionStateMachine stateMachine;
    private final CommentService commentService;
    private final SubmissionMapper mapper;

    // ── Transitions ───────────────────────────────────────────────────────────

    @Transactional
    public SubmissionResponse create(RequestContext ctx, SubmissionRequest req) {
        User actor = actorResolver.resolve(ctx);

        Mac mac;
        if (actor.hasRole(UserRole.ADMIN)) {
            if (req.getMacId() == null) {
                throw new SubmissionValidationException(List.of("An agency must be selected"));
            }
            mac = macRepository.findById(req.getMacId())
                    .orElseThrow(() -> ResourceNotFoundException.mac(req.getMacId()));
        } else {
            mac = actor.getMac();
        }

        Submission created = stateMachine.create(actor, mac, SubmissionContent.from(req), ctx.originAddress());
        return toDetail(actor, created);
    }

    @Transactional
    public SubmissionResponse update(RequestContext ctx, Long id, SubmissionRequest req) {
        User actor = actorResolver.resolve(ctx);
        Submission submission = findSubmission(id);
        Submission saved = stateMachine.edit(actor, submission, SubmissionContent.from(req), ctx.originAddress());
        return toDetail(actor, saved);
    }

    @Transactional
    public void delete(RequestContext ctx, Long id) {
        User actor = actorResolver.resolve(ctx);
        Submission submission = findSubmission(id);
        stateMachine.delete(actor, submission, ctx.originAddress());
    }

    @Transactional
    public SubmissionResponse startReview(RequestContext ctx, Long id) {
        User actor = actorResolver.resolve(ctx);
        Submission submission = findSubmission(id);
        return toDetail(actor, stateMachine.startReview(actor, submission, ctx.originAddress()));
    }

    @Transactional
    public SubmissionResponse review(RequestContext ctx, Long id, ReviewRequest req) {
        User actor = actorResolver.resolve(ctx);
        Submission submission = findSubmission(id);
        return toDetail(actor, stateMachine.review(actor, submission, ReviewDecision.from(req), ctx.originAddress()));
    }

    @Transactional
    public CommentResponse addComment(RequestContext ctx, Long id, CommentRequest req) {
        User actor = actorResolver.resolve(ctx);
        Submission submission = findSubmission(id);
        Comment comment = commentService.addComment(actor, submission, req.getText(), req.isInternal(),
                ctx.originAddress());
        return mapper.toCommentResponse(comment);
    }

    // ── Read ──────────────────────────────────────────────────────────────────

    @Transactional(readOnly = true)
    public SubmissionResponse get(RequestContext ctx, Long id) {
        User actor = actorResolver.resolve(ctx);
        Submission submission = findSubmission(id);
        boolean visible = visibilityFilter.canSee(actor, submission)
                || visibilityFilter.publicScope().matches(submission);
        if (!visible) {
            throw new PermissionDeniedException("You do not have access to submission " + id);
        }
        return toDetail(actor, submission);
    }

    @Transactional(readOnly = true)
    public Page<SubmissionResponse> search(RequestContext ctx, SubmissionSearchRequest req, Pageable pageable) {
        User actor = actorResolver.resolve(ctx);
        SubmissionScope scope = visibilityFilter.scopeFor(actor);
        Specification<Submission> filters = Specification
                .where(SubmissionSpecification.hasStatus(req.getStatus()))
                .and(SubmissionSpecification.hasContentType(req.getContentType()))
                .and(SubmissionSpecification.hasMac(req.getMacId()))
                .and(SubmissionSpecification.matchesText(req.getSearch()));

        log.debug("Searching submissions for user {} within {}", actor.getId(), scope);
        return submissionRepository.findByScope(scope, filters, pageable)
                .map(s -> mapper.toResponse(s, null));
    }

    /** Approved and published content, open to every authenticated actor. */
    @Transactional(readOnly = true)
    public Page<SubmissionResponse> library(RequestContext ctx, SubmissionSearchRequest req, Pageable pageable) {
        actorResolver.resolve(ctx);
        Specification<Submission> filters = Specification
                .where(SubmissionSpecification.hasContentType(req.getContentType()))
                .and(SubmissionSpecification.hasMac(req.getMacId()))
                .and(SubmissionSpecification.matchesText(req.getSearch()));

        return submissionRepository.findByScope(visibilityFilter.publicScope(), filters, pageable)
                .map(s -> mapper.toResponse(s, null));
    }

    @Transactional(readOnly = true)
    public StatusCountsResponse stats(RequestContext ctx) {
        User actor = actorResolver.resolve(ctx);
        return StatusCountsResponse.of(submissionRepository.countPerStatus(visibilityFilter.scopeFor(actor)));
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private Submission findSubmission(Long id) {
        return submissionRepository.findById(id)
                .orElseThrow(() -> ResourceNotFoundException.submission(id));
    }

    private SubmissionResponse toDetail(User actor, Submission submission) {
        List<Comment> comments = commentRepository.findAllBySubmissionIdOrderByCreatedAtDesc(submission.getId());
        return mapper.toResponse(submission, visibilityFilter.visibleComments(actor, submission, comments));
    }
}
