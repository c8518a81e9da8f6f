package com.pandora.reviewservice.audit;

import com.pandora.reviewservice.access.AccessAction;
import com.pandora.reviewservice.access.AccessEvaluator;
import com.pandora.reviewservice.dto.AuditLogEntryResponse;
import com.pandora.reviewservice.entity.AuditLogEntry;
import com.pandora.reviewservice.entity.User;
import com.pandora.reviewservice.repository.AuditLogRepository;
import com.pandora.reviewservice.service.ActorResolver;
import com.pandora.reviewservice.service.RequestContext;
import com.pandora.reviewservice.service.SubmissionMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Read side of the audit trail: administrators see the latest entries of everyone,
 * other actors only their own.
 */
@Service
@RequiredArgsConstructor
public class AuditLogService {

    static final int ADMIN_LIMIT = 100;
    static final int OWN_LIMIT = 50;

    private final AuditLogRepository auditLogRepository;
    private final AccessEvaluator accessEvaluator;
    private final ActorResolver actorResolver;
    private final SubmissionMapper mapper;

    @Transactional(readOnly = true)
    public List<AuditLogEntryResponse> recent(RequestContext ctx) {
        User actor = actorResolver.resolve(ctx);
        return latest(actor, seesEveryone(actor) ? ADMIN_LIMIT : OWN_LIMIT);
    }

    /** The newest {@code limit} entries the actor may read. */
    @Transactional(readOnly = true)
    public List<AuditLogEntryResponse> latest(User actor, int limit) {
        List<AuditLogEntry> entries = seesEveryone(actor)
                ? auditLogRepository.findAllByOrderByCreatedAtDescIdDesc(PageRequest.of(0, limit))
                : auditLogRepository.findAllByActorIdOrderByCreatedAtDescIdDesc(actor.getId(), PageRequest.of(0, limit));
        return entries.stream()
                .map(mapper::toAuditResponse)
                .toList();
    }

    private boolean seesEveryone(User actor) {
        return accessEvaluator.canPerform(actor, AccessAction.VIEW_ALL_AUDIT_LOG, null);
    }
}
