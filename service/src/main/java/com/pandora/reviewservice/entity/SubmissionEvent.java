package com.pandora.reviewservice.entity;

import java.util.EnumSet;
import java.util.Set;

/**
 * Status-changing events of a submission together with the states each one may leave.
 * Creation (always PENDING) and deletion (row removed) are not status edges and are not listed.
 */
public enum SubmissionEvent {
    START_REVIEW(SubmissionStatus.UNDER_REVIEW, EnumSet.of(SubmissionStatus.PENDING)),
    APPROVE(SubmissionStatus.APPROVED, EnumSet.of(SubmissionStatus.PENDING, SubmissionStatus.UNDER_REVIEW)),
    DENY(SubmissionStatus.DENIED, EnumSet.of(SubmissionStatus.PENDING, SubmissionStatus.UNDER_REVIEW)),
    RETURN(SubmissionStatus.RETURNED, EnumSet.of(SubmissionStatus.PENDING, SubmissionStatus.UNDER_REVIEW)),
    RESUBMIT(SubmissionStatus.PENDING, EnumSet.of(SubmissionStatus.RETURNED));

    private final SubmissionStatus target;
    private final Set<SubmissionStatus> sources;

    SubmissionEvent(SubmissionStatus target, Set<SubmissionStatus> sources) {
        this.target = target;
        this.sources = sources;
    }

    public SubmissionStatus getTarget() {
        return target;
    }

    public Set<SubmissionStatus> getSources() {
        return EnumSet.copyOf(sources);
    }

    public boolean isAllowedFrom(SubmissionStatus current) {
        return current != null && sources.contains(current);
    }
}
