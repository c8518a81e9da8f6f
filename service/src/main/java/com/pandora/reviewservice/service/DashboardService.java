package com.pandora.reviewservice.service;

import com.pandora.reviewservice.access.SubmissionScope;
import com.pandora.reviewservice.access.VisibilityFilter;
import com.pandora.reviewservice.audit.AuditLogService;
import com.pandora.reviewservice.dto.DashboardResponse;
import com.pandora.reviewservice.dto.StatusCountsResponse;
import com.pandora.reviewservice.entity.Submission;
import com.pandora.reviewservice.entity.SubmissionStatus;
import com.pandora.reviewservice.entity.User;
import com.pandora.reviewservice.repository.MacRepository;
import com.pandora.reviewservice.repository.NotificationRepository;
import com.pandora.reviewservice.repository.SubmissionRepository;
import com.pandora.reviewservice.repository.SubmissionSpecification;
import com.pandora.reviewservice.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.EnumSet;
import java.util.Set;

/**
 * Landing-page overview. Officers see their agency, reviewers the open review queue,
 * administrators everything plus account and agency totals.
 */
@Service
@RequiredArgsConstructor
public class DashboardService {

    static final int RECENT_LIMIT = 10;

    private static final Set<SubmissionStatus> REVIEW_QUEUE =
            EnumSet.of(SubmissionStatus.PENDING, SubmissionStatus.UNDER_REVIEW);

    private final SubmissionRepository submissionRepository;
    private final UserRepository userRepository;
    private final MacRepository macRepository;
    private final NotificationRepository notificationRepository;
    private final AuditLogService auditLogService;
    private final ActorResolver actorResolver;
    private final VisibilityFilter visibilityFilter;
    private final SubmissionMapper mapper;
    private final Clock clock;

    @Transactional(readOnly = true)
    public DashboardResponse dashboard(RequestContext ctx) {
        User actor = actorResolver.resolve(ctx);
        SubmissionScope scope = visibilityFilter.scopeFor(actor);

        DashboardResponse resp = new DashboardResponse();
        resp.setRole(actor.getRole());
        resp.setCounts(StatusCountsResponse.of(submissionRepository.countPerStatus(scope)));
        resp.setUnreadNotifications(notificationRepository.countByRecipientIdAndReadFalse(actor.getId()));

        Specification<Submission> recentFilter = Specification.where(null);
        switch (actor.getRole()) {
            case MICAT_REVIEWER -> {
                resp.setMyReviews(submissionRepository.countByScope(scope,
                        SubmissionSpecification.reviewedBy(actor.getId())));
                recentFilter = SubmissionSpecification.hasStatusIn(REVIEW_QUEUE);
            }
            case ADMIN -> {
                OffsetDateTime startOfToday = LocalDate.now(clock).atStartOfDay(clock.getZone()).toOffsetDateTime();
                resp.setActiveUsers(userRepository.countByActiveTrue());
                resp.setActiveMacs(macRepository.countByActiveTrue());
                resp.setApprovedToday(submissionRepository.countByScope(scope,
                        SubmissionSpecification.approvedSince(startOfToday)));
            }
            default -> { }
        }

        PageRequest newest = PageRequest.of(0, RECENT_LIMIT, Sort.by(Sort.Direction.DESC, "submittedAt"));
        resp.setRecentSubmissions(submissionRepository.findByScope(scope, recentFilter, newest)
                .map(s -> mapper.toResponse(s, null))
                .getContent());
        resp.setRecentActivity(auditLogService.latest(actor, RECENT_LIMIT));
        return resp;
    }
}
