package com.pandora.reviewservice.service;

import com.pandora.reviewservice.access.AccessAction;
import com.pandora.reviewservice.access.AccessEvaluator;
import com.pandora.reviewservice.access.SubmissionScope;
import com.pandora.reviewservice.dto.AnalyticsResponse;
import com.pandora.reviewservice.entity.SubmissionStatus;
import com.pandora.reviewservice.entity.User;
import com.pandora.reviewservice.entity.UserRole;
import com.pandora.reviewservice.exception.SubmissionValidationException;
import com.pandora.reviewservice.repository.MacRepository;
import com.pandora.reviewservice.repository.SubmissionRepository;
import com.pandora.reviewservice.repository.SubmissionSpecification;
import com.pandora.reviewservice.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * System-wide figures for administrators. Counts ignore agency scopes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalyticsService {

    public static final int DEFAULT_DAYS = 30;
    static final int MAX_DAYS = 365;
    static final int TOP_LIMIT = 10;

    private final SubmissionRepository submissionRepository;
    private final UserRepository userRepository;
    private final MacRepository macRepository;
    private final ActorResolver actorResolver;
    private final AccessEvaluator accessEvaluator;
    private final Clock clock;

    @Transactional(readOnly = true)
    public AnalyticsResponse analytics(RequestContext ctx, int days) {
        User actor = actorResolver.resolve(ctx);
        accessEvaluator.check(actor, AccessAction.VIEW_ANALYTICS, null, "Only administrators can view analytics");
        if (days < 1 || days > MAX_DAYS) {
            throw new SubmissionValidationException(List.of("days must be between 1 and " + MAX_DAYS));
        }

        OffsetDateTime since = OffsetDateTime.now(clock).minusDays(days);
        SubmissionScope all = SubmissionScope.all();
        Map<SubmissionStatus, Long> byStatus = submissionRepository.countPerStatus(all);
        Pageable top = PageRequest.of(0, TOP_LIMIT);

        AnalyticsResponse resp = new AnalyticsResponse();
        resp.setDays(days);
        resp.setActiveUsers(userRepository.countByActiveTrue());
        resp.setActiveMacs(macRepository.countByActiveTrue());
        resp.setTotalSubmissions(byStatus.values().stream().mapToLong(Long::longValue).sum());
        resp.setByStatus(byStatus);
        resp.setApprovalRate(approvalRate(byStatus.get(SubmissionStatus.APPROVED), byStatus.get(SubmissionStatus.DENIED)));
        resp.setRecentSubmissions(submissionRepository.countByScope(all, SubmissionSpecification.submittedSince(since)));
        resp.setRecentApprovals(submissionRepository.countByScope(all, SubmissionSpecification.approvedSince(since)));
        resp.setSubmissionTrend(trend(submissionRepository.findSubmittedAtSince(since)));
        resp.setByMac(submissionRepository.tallyPerMac(SubmissionStatus.APPROVED, SubmissionStatus.PENDING, top).stream()
                .map(t -> new AnalyticsResponse.MacCount(t.getMacId(), t.getAcronym(), t.getName(),
                        zeroIfNull(t.getTotal()), zeroIfNull(t.getApproved()), zeroIfNull(t.getPending())))
                .toList());
        resp.setByContentType(submissionRepository.tallyPerContentType().stream()
                .map(t -> new AnalyticsResponse.ContentTypeCount(t.getContentType(), zeroIfNull(t.getTotal())))
                .toList());
        resp.setTopSubmitters(submissionRepository.tallySubmitters(UserRole.MAC_OFFICER, top).stream()
                .map(t -> new AnalyticsResponse.UserCount(t.getUserId(), t.getFullName(), zeroIfNull(t.getTotal())))
                .toList());
        resp.setTopReviewers(submissionRepository.tallyReviewers(UserRole.MICAT_REVIEWER, top).stream()
                .map(t -> new AnalyticsResponse.UserCount(t.getUserId(), t.getFullName(), zeroIfNull(t.getTotal())))
                .toList());

        log.debug("Analytics over {} days for user {}", days, actor.getId());
        return resp;
    }

    static double approvalRate(Long approved, Long denied) {
        long a = zeroIfNull(approved);
        long decided = a + zeroIfNull(denied);
        if (decided == 0) {
            return 0.0;
        }
        return Math.round(a * 1000.0 / decided) / 10.0;
    }

    private static Map<LocalDate, Long> trend(List<OffsetDateTime> submittedAt) {
        Map<LocalDate, Long> perDay = new TreeMap<>();
        for (OffsetDateTime at : submittedAt) {
            perDay.merge(at.withOffsetSameInstant(ZoneOffset.UTC).toLocalDate(), 1L, Long::sum);
        }
        return perDay;
    }

    private static long zeroIfNull(Long value) {
        return value == null ? 0L : value;
    }
}
