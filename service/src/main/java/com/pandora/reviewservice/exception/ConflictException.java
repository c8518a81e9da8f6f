package com.pandora.reviewservice.exception;

/**
 * The submission changed under the caller. Re-fetch and retry.
 */
public class ConflictException extends RuntimeException {

    public ConflictException(String message) {
        super(message);
    }

    public static ConflictException concurrentModification(Long submissionId) {
        return new ConflictException(
                String.format("Submission %d was modified concurrently, reload and try again", submissionId));
    }
}
