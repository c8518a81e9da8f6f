package com.pandora.reviewservice.dto;

import com.pandora.reviewservice.entity.ContentType;
import com.pandora.reviewservice.entity.Priority;
import com.pandora.reviewservice.entity.SubmissionStatus;
import lombok.Data;

import java.time.OffsetDateTime;
import java.util.List;

@Data
public class SubmissionResponse {
    private Long id;
    private String title;
    private ContentType contentType;
    private String description;
    private String tags;
    private List<String> tagList;
    private String artifactRef;
    private Long macId;
    private String macAcronym;
    private Long submittedById;
    private String submittedByName;
    private Long reviewedById;
    private String reviewedByName;
    private SubmissionStatus status;
    private Priority priority;
    private boolean confidential;
    private boolean published;
    private String reviewerComments;
    private String denialReason;
    private OffsetDateTime submittedAt;
    private OffsetDateTime reviewedAt;
    private OffsetDateTime approvedAt;
    private OffsetDateTime publishedAt;
    private OffsetDateTime updatedAt;
    private List<CommentResponse> comments;
}
