package com.pandora.reviewservice.exception;

import com.pandora.reviewservice.entity.SubmissionEvent;
import com.pandora.reviewservice.entity.SubmissionStatus;

public class InvalidStatusTransitionException extends ConflictException {
    public InvalidStatusTransitionException(Long id, SubmissionStatus current, SubmissionEvent event) {
        super(String.format("Submission %d: invalid transition %s -> %s (event %s)",
                id, current, event.getTarget(), event));
    }
}
