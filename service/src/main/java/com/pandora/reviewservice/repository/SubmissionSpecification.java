package com.pandora.reviewservice.repository;

import com.pandora.reviewservice.entity.ContentType;
import com.pandora.reviewservice.entity.Submission;
import com.pandora.reviewservice.entity.SubmissionStatus;
import org.springframework.data.jpa.domain.Specification;

import java.time.OffsetDateTime;
import java.util.Collection;

public class SubmissionSpecification {

    public static Specification<Submission> hasStatus(SubmissionStatus status) {
        return (root, query, cb) ->
                status == null ? cb.conjunction() : cb.equal(root.get("status"), status);
    }

    public static Specification<Submission> hasStatusIn(Collection<SubmissionStatus> statuses) {
        return (root, query, cb) ->
                statuses == null || statuses.isEmpty() ? cb.conjunction() : root.get("status").in(statuses);
    }

    public static Specification<Submission> hasMac(Long macId) {
        return (root, query, cb) ->
                macId == null ? cb.conjunction() : cb.equal(root.get("mac").get("id"), macId);
    }

    public static Specification<Submission> hasContentType(ContentType contentType) {
        return (root, query, cb) ->
                contentType == null ? cb.conjunction() : cb.equal(root.get("contentType"), contentType);
    }

    public static Specification<Submission> reviewedBy(Long userId) {
        return (root, query, cb) -> cb.equal(root.get("reviewedBy").get("id"), userId);
    }

    public static Specification<Submission> submittedSince(OffsetDateTime since) {
        return (root, query, cb) -> cb.greaterThanOrEqualTo(root.get("submittedAt"), since);
    }

    public static Specification<Submission> approvedSince(OffsetDateTime since) {
        return (root, query, cb) -> cb.greaterThanOrEqualTo(root.get("approvedAt"), since);
    }

    public static Specification<Submission> isPublished() {
        return (root, query, cb) -> cb.equal(root.get("published"), true);
    }

    /** Case-insensitive match on title, description or tags. */
    public static Specification<Submission> matchesText(String search) {
        return (root, query, cb) -> {
            if (search == null || search.isBlank()) {
                return cb.conjunction();
            }
            String pattern = "%" + search.trim().toLowerCase() + "%";
            return cb.or(
                    cb.like(cb.lower(root.get("title")), pattern),
                    cb.like(cb.lower(root.get("description")), pattern),
                    cb.like(cb.lower(root.get("tags")), pattern));
        };
    }
}
