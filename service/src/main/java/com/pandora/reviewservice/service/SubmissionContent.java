package com.pandora.reviewservice.service;

import com.pandora.reviewservice.dto.SubmissionRequest;
import com.pandora.reviewservice.entity.ContentType;
import com.pandora.reviewservice.entity.Submission;

/**
 * The officer-editable part of a submission.
 */
public record SubmissionContent(String title, ContentType contentType, String description,
                                String tags, String artifactRef, boolean confidential) {

    public static SubmissionContent from(SubmissionRequest req) {
        return new SubmissionContent(
                req.getTitle() != null ? req.getTitle().trim() : null,
                req.getContentType(),
                req.getDescription(),
                req.getTags(),
                req.getArtifactRef(),
                req.isConfidential());
    }

    /** A blank artifact reference on edit keeps the stored one. */
    public void applyTo(Submission submission) {
        submission.setTitle(title);
        submission.setContentType(contentType);
        submission.setDescription(description);
        submission.setTags(tags);
        if (artifactRef != null && !artifactRef.isBlank()) {
            submission.setArtifactRef(artifactRef);
        }
        submission.setConfidential(confidential);
    }
}
