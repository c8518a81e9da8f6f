package com.pandora.reviewservice.repository;

import com.pandora.reviewservice.entity.AuditLogEntry;
import org.springframework.data.domain.Pageable;
import org.springframework.data.repository.Repository;

import java.util.List;

/**
 * Append-only access to the audit trail. Extends the bare {@link Repository} so that no
 * update or delete method is ever generated.
 */
public interface AuditLogRepository extends Repository<AuditLogEntry, Long> {

    <S extends AuditLogEntry> S saveAndFlush(S entry);

    List<AuditLogEntry> findAllByOrderByCreatedAtDescIdDesc(Pageable pageable);

    List<AuditLogEntry> findAllByActorIdOrderByCreatedAtDescIdDesc(Long actorId, Pageable pageable);

    List<AuditLogEntry> findAllBySubmissionIdOrderByIdAsc(Long submissionId);

    long count();
}
