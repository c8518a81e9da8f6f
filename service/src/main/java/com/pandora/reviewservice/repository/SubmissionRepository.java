package com.pandora.reviewservice.repository;

import com.pandora.reviewservice.access.SubmissionScope;
import com.pandora.reviewservice.entity.ContentType;
import com.pandora.reviewservice.entity.Submission;
import com.pandora.reviewservice.entity.SubmissionStatus;
import com.pandora.reviewservice.entity.UserRole;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.OffsetDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public interface SubmissionRepository extends JpaRepository<Submission, Long>, JpaSpecificationExecutor<Submission> {

    default Page<Submission> findByScope(SubmissionScope scope, Specification<Submission> filters, Pageable pageable) {
        return findAll(scope.toSpecification().and(filters), pageable);
    }

    default List<Submission> findAllByScope(SubmissionScope scope, Specification<Submission> filters, Sort sort) {
        return findAll(scope.toSpecification().and(filters), sort);
    }

    default long countByScope(SubmissionScope scope, Specification<Submission> filters) {
        return count(scope.toSpecification().and(filters));
    }

    /** One entry per status, zero included. */
    default Map<SubmissionStatus, Long> countPerStatus(SubmissionScope scope) {
        Map<SubmissionStatus, Long> counts = new EnumMap<>(SubmissionStatus.class);
        for (SubmissionStatus status : SubmissionStatus.values()) {
            counts.put(status, countByScope(scope, SubmissionSpecification.hasStatus(status)));
        }
        return counts;
    }

    // ── Aggregates ────────────────────────────────────────────────────────────

    interface MacTally {
        Long getMacId();
        String getAcronym();
        String getName();
        Long getTotal();
        Long getApproved();
        Long getPending();
    }

    interface ContentTypeTally {
        ContentType getContentType();
        Long getTotal();
    }

    interface UserTally {
        Long getUserId();
        String getFullName();
        Long getTotal();
    }

    @Query("SELECT m.id AS macId, m.acronym AS acronym, m.name AS name, COUNT(s.id) AS total, "
            + "SUM(CASE WHEN s.status = :approved THEN 1 ELSE 0 END) AS approved, "
            + "SUM(CASE WHEN s.status = :pending THEN 1 ELSE 0 END) AS pending "
            + "FROM Mac m LEFT JOIN Submission s ON s.mac = m "
            + "GROUP BY m.id, m.acronym, m.name "
            + "ORDER BY COUNT(s.id) DESC, m.acronym ASC")
    List<MacTally> tallyPerMac(@Param("approved") SubmissionStatus approved,
                               @Param("pending") SubmissionStatus pending,
                               Pageable pageable);

    @Query("SELECT s.contentType AS contentType, COUNT(s.id) AS total FROM Submission s "
            + "GROUP BY s.contentType ORDER BY COUNT(s.id) DESC")
    List<ContentTypeTally> tallyPerContentType();

    @Query("SELECT u.id AS userId, u.fullName AS fullName, COUNT(s.id) AS total "
            + "FROM User u LEFT JOIN Submission s ON s.submittedBy = u "
            + "WHERE u.role = :role "
            + "GROUP BY u.id, u.fullName "
            + "ORDER BY COUNT(s.id) DESC, u.fullName ASC")
    List<UserTally> tallySubmitters(@Param("role") UserRole role, Pageable pageable);

    @Query("SELECT u.id AS userId, u.fullName AS fullName, COUNT(s.id) AS total "
            + "FROM User u LEFT JOIN Submission s ON s.reviewedBy = u "
            + "WHERE u.role = :role "
            + "GROUP BY u.id, u.fullName "
            + "ORDER BY COUNT(s.id) DESC, u.fullName ASC")
    List<UserTally> tallyReviewers(@Param("role") UserRole role, Pageable pageable);

    @Query("SELECT s.submittedAt FROM Submission s WHERE s.submittedAt >= :since")
    List<OffsetDateTime> findSubmittedAtSince(@Param("since") OffsetDateTime since);
}
