package com.pandora.reviewservice.access;

import com.pandora.reviewservice.entity.Submission;
import com.pandora.reviewservice.entity.SubmissionStatus;
import com.pandora.reviewservice.repository.SubmissionSpecification;
import org.springframework.data.jpa.domain.Specification;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * The set of submissions an actor may read, expressed twice: as an in-memory predicate
 * and as the equivalent JPA specification for repository queries.
 */
public final class SubmissionScope {

    private final String name;
    private final Predicate<Submission> predicate;
    private final Specification<Submission> specification;

    private SubmissionScope(String name, Predicate<Submission> predicate, Specification<Submission> specification) {
        this.name = name;
        this.predicate = predicate;
        this.specification = specification;
    }

    public static SubmissionScope all() {
        return new SubmissionScope("all", s -> true, (root, query, cb) -> cb.conjunction());
    }

    public static SubmissionScope none() {
        return new SubmissionScope("none", s -> false, (root, query, cb) -> cb.disjunction());
    }

    public static SubmissionScope agency(Long macId) {
        Objects.requireNonNull(macId, "macId");
        return new SubmissionScope("agency:" + macId,
                s -> s.getMac() != null && macId.equals(s.getMac().getId()),
                SubmissionSpecification.hasMac(macId));
    }

    /** Approved and published content, readable by every authenticated actor. */
    public static SubmissionScope publicLibrary() {
        return new SubmissionScope("public",
                s -> s.getStatus() == SubmissionStatus.APPROVED && s.isPublished(),
                SubmissionSpecification.hasStatus(SubmissionStatus.APPROVED).and(SubmissionSpecification.isPublished()));
    }

    public boolean matches(Submission submission) {
        return submission != null && predicate.test(submission);
    }

    public Specification<Submission> toSpecification() {
        return specification;
    }

    @Override
    public String toString() {
        return "SubmissionScope[" + name + "]";
    }
}
