package com.pandora.reviewservice.audit;

import com.pandora.reviewservice.entity.AuditAction;
import com.pandora.reviewservice.entity.AuditLogEntry;
import com.pandora.reviewservice.entity.User;
import com.pandora.reviewservice.repository.AuditLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * Appends entries to the audit trail inside the caller's transaction.
 *
 * <p>The write is flushed immediately so a failure surfaces here and rolls back the whole
 * transition. Entries are never updated or deleted.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AuditLogSink {

    private final AuditLogRepository auditLogRepository;
    private final Clock clock;

    public AuditLogEntry record(User actor, AuditAction action, Long submissionId,
                                String description, String originAddress) {
        AuditLogEntry entry = AuditLogEntry.of(actor, action, submissionId, description, originAddress,
                OffsetDateTime.now(clock));
        AuditLogEntry saved = auditLogRepository.saveAndFlush(entry);
        log.debug("Audit {} by user {} on submission {}: {}",
                action, actor != null ? actor.getId() : null, submissionId, description);
        return saved;
    }
}
