package com.pandora.reviewservice.audit;

import com.pandora.reviewservice.access.AccessEvaluator;
import com.pandora.reviewservice.entity.AuditAction;
import com.pandora.reviewservice.entity.AuditLogEntry;
import com.pandora.reviewservice.entity.User;
import com.pandora.reviewservice.repository.AuditLogRepository;
import com.pandora.reviewservice.service.ActorResolver;
import com.pandora.reviewservice.service.RequestContext;
import com.pandora.reviewservice.service.SubmissionMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageRequest;

import java.util.List;

import static com.pandora.reviewservice.TestFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AuditLogServiceTest {

    @Mock private AuditLogRepository auditLogRepository;
    @Mock private ActorResolver actorResolver;

    private AuditLogService auditLogService;

    private final RequestContext ctx = new RequestContext(1L, null);

    @BeforeEach
    void setUp() {
        auditLogService = new AuditLogService(auditLogRepository, new AccessEvaluator(), actorResolver,
                new SubmissionMapper());
    }

    @Test
    void recent_admin_seesLatestHundredOfEveryone() {
        User admin = admin(30L);
        when(actorResolver.resolve(ctx)).thenReturn(admin);
        AuditLogEntry entry = AuditLogEntry.of(reviewer(20L), AuditAction.SUBMISSION_APPROVED, 5L,
                "Approved submission: Flood Update", "10.0.0.9", NOW);
        when(auditLogRepository.findAllByOrderByCreatedAtDescIdDesc(PageRequest.of(0, AuditLogService.ADMIN_LIMIT)))
                .thenReturn(List.of(entry));

        assertThat(auditLogService.recent(ctx))
                .singleElement()
                .satisfies(r -> {
                    assertThat(r.getActorId()).isEqualTo(20L);
                    assertThat(r.getAction()).isEqualTo(AuditAction.SUBMISSION_APPROVED);
                    assertThat(r.getOriginAddress()).isEqualTo("10.0.0.9");
                });
        verify(auditLogRepository, never()).findAllByActorIdOrderByCreatedAtDescIdDesc(anyLong(), any());
    }

    @Test
    void recent_reviewer_seesOwnLatestFifty() {
        User reviewer = reviewer(20L);
        when(actorResolver.resolve(ctx)).thenReturn(reviewer);
        when(auditLogRepository.findAllByActorIdOrderByCreatedAtDescIdDesc(20L, PageRequest.of(0, AuditLogService.OWN_LIMIT)))
                .thenReturn(List.of());

        assertThat(auditLogService.recent(ctx)).isEmpty();
        verify(auditLogRepository, never()).findAllByOrderByCreatedAtDescIdDesc(any());
    }

    @Test
    void latest_officer_limitedToOwnEntries() {
        User officer = officer(10L, mac(1L, "MOH"));
        when(auditLogRepository.findAllByActorIdOrderByCreatedAtDescIdDesc(10L, PageRequest.of(0, 10)))
                .thenReturn(List.of(AuditLogEntry.of(officer, AuditAction.SUBMISSION_CREATED, 5L,
                        "Created submission: Flood Update", null, NOW)));

        assertThat(auditLogService.latest(officer, 10))
                .extracting(r -> r.getDescription())
                .containsExactly("Created submission: Flood Update");
        verifyNoInteractions(actorResolver);
    }
}
