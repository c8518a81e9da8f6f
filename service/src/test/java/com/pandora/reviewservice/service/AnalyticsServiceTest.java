package com.pandora.reviewservice.service;

import com.pandora.reviewservice.access.AccessEvaluator;
import com.pandora.reviewservice.dto.AnalyticsResponse;
import com.pandora.reviewservice.entity.ContentType;
import com.pandora.reviewservice.entity.SubmissionStatus;
import com.pandora.reviewservice.entity.UserRole;
import com.pandora.reviewservice.exception.PermissionDeniedException;
import com.pandora.reviewservice.exception.SubmissionValidationException;
import com.pandora.reviewservice.repository.MacRepository;
import com.pandora.reviewservice.repository.SubmissionRepository;
import com.pandora.reviewservice.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.projection.ProjectionFactory;
import org.springframework.data.projection.SpelAwareProxyProjectionFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.pandora.reviewservice.TestFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AnalyticsServiceTest {

    @Mock private SubmissionRepository submissionRepository;
    @Mock private UserRepository userRepository;
    @Mock private MacRepository macRepository;
    @Mock private ActorResolver actorResolver;

    private final ProjectionFactory projections = new SpelAwareProxyProjectionFactory();
    private final RequestContext ctx = new RequestContext(30L, null);
    private final PageRequest top = PageRequest.of(0, AnalyticsService.TOP_LIMIT);

    private AnalyticsService analyticsService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(), ZoneOffset.UTC);
        analyticsService = new AnalyticsService(submissionRepository, userRepository, macRepository,
                actorResolver, new AccessEvaluator(), clock);
    }

    private Map<SubmissionStatus, Long> statusCounts(long pending, long approved, long denied) {
        Map<SubmissionStatus, Long> counts = new EnumMap<>(SubmissionStatus.class);
        for (SubmissionStatus status : SubmissionStatus.values()) {
            counts.put(status, 0L);
        }
        counts.put(SubmissionStatus.PENDING, pending);
        counts.put(SubmissionStatus.APPROVED, approved);
        counts.put(SubmissionStatus.DENIED, denied);
        return counts;
    }

    @Test
    void analytics_admin_collectsSystemWideFigures() {
        when(actorResolver.resolve(ctx)).thenReturn(admin(30L));
        when(submissionRepository.countPerStatus(any())).thenReturn(statusCounts(3, 6, 2));
        when(userRepository.countByActiveTrue()).thenReturn(12L);
        when(macRepository.countByActiveTrue()).thenReturn(4L);
        when(submissionRepository.countByScope(any(), any())).thenReturn(5L, 2L);
        when(submissionRepository.findSubmittedAtSince(NOW.minusDays(30))).thenReturn(List.of(
                NOW.minusDays(2), NOW.minusDays(2).plusHours(3), NOW.minusDays(1)));
        when(submissionRepository.tallyPerMac(SubmissionStatus.APPROVED, SubmissionStatus.PENDING, top))
                .thenReturn(List.of(projections.createProjection(SubmissionRepository.MacTally.class, Map.of(
                        "macId", 1L, "acronym", "MOH", "name", "Ministry of Health",
                        "total", 7L, "approved", 4L, "pending", 2L))));
        when(submissionRepository.tallyPerContentType())
                .thenReturn(List.of(projections.createProjection(SubmissionRepository.ContentTypeTally.class,
                        Map.of("contentType", ContentType.PRESS_RELEASE, "total", 9L))));
        when(submissionRepository.tallySubmitters(UserRole.MAC_OFFICER, top))
                .thenReturn(List.of(projections.createProjection(SubmissionRepository.UserTally.class,
                        Map.of("userId", 10L, "fullName", "John Doe", "total", 7L))));
        when(submissionRepository.tallyReviewers(UserRole.MICAT_REVIEWER, top)).thenReturn(List.of());

        AnalyticsResponse resp = analyticsService.analytics(ctx, AnalyticsService.DEFAULT_DAYS);

        assertThat(resp.getDays()).isEqualTo(30);
        assertThat(resp.getActiveUsers()).isEqualTo(12L);
        assertThat(resp.getActiveMacs()).isEqualTo(4L);
        assertThat(resp.getTotalSubmissions()).isEqualTo(11L);
        assertThat(resp.getApprovalRate()).isEqualTo(75.0);
        assertThat(resp.getRecentSubmissions()).isEqualTo(5L);
        assertThat(resp.getRecentApprovals()).isEqualTo(2L);
        assertThat(resp.getSubmissionTrend()).containsExactly(
                Map.entry(LocalDate.of(2024, 3, 13), 2L),
                Map.entry(LocalDate.of(2024, 3, 14), 1L));
        assertThat(resp.getByMac()).singleElement().satisfies(m -> {
            assertThat(m.getAcronym()).isEqualTo("MOH");
            assertThat(m.getApproved()).isEqualTo(4L);
            assertThat(m.getPending()).isEqualTo(2L);
        });
        assertThat(resp.getByContentType()).extracting(AnalyticsResponse.ContentTypeCount::getContentType)
                .containsExactly(ContentType.PRESS_RELEASE);
        assertThat(resp.getTopSubmitters()).extracting(AnalyticsResponse.UserCount::getFullName)
                .containsExactly("John Doe");
        assertThat(resp.getTopReviewers()).isEmpty();
    }

    @Test
    void analytics_reviewer_forbidden() {
        when(actorResolver.resolve(ctx)).thenReturn(reviewer(20L));

        assertThatThrownBy(() -> analyticsService.analytics(ctx, 30))
                .isInstanceOf(PermissionDeniedException.class);
        verifyNoInteractions(submissionRepository, userRepository, macRepository);
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -5, 366})
    void analytics_periodOutOfRange_validationError(int days) {
        when(actorResolver.resolve(ctx)).thenReturn(admin(30L));

        assertThatThrownBy(() -> analyticsService.analytics(ctx, days))
                .isInstanceOf(SubmissionValidationException.class);
        verifyNoInteractions(submissionRepository);
    }

    @Test
    void approvalRate_roundsToOneDecimal_andIsZeroWithoutDecisions() {
        assertThat(AnalyticsService.approvalRate(2L, 1L)).isEqualTo(66.7);
        assertThat(AnalyticsService.approvalRate(0L, 0L)).isEqualTo(0.0);
        assertThat(AnalyticsService.approvalRate(null, null)).isEqualTo(0.0);
        assertThat(AnalyticsService.approvalRate(3L, 0L)).isEqualTo(100.0);
    }
}
