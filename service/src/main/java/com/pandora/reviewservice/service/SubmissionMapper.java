package com.pandora.reviewservice.service;

import com.pandora.reviewservice.dto.*;
import com.pandora.reviewservice.entity.*;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

@Component
public class SubmissionMapper {

    public SubmissionResponse toResponse(Submission s, List<Comment> visibleComments) {
        SubmissionResponse resp = new SubmissionResponse();
        resp.setId(s.getId());
        resp.setTitle(s.getTitle());
        resp.setContentType(s.getContentType());
        resp.setDescription(s.getDescription());
        resp.setTags(s.getTags());
        resp.setTagList(parseTags(s.getTags()));
        resp.setArtifactRef(s.getArtifactRef());
        if (s.getMac() != null) {
            resp.setMacId(s.getMac().getId());
            resp.setMacAcronym(s.getMac().getAcronym());
        }
        if (s.getSubmittedBy() != null) {
            resp.setSubmittedById(s.getSubmittedBy().getId());
            resp.setSubmittedByName(s.getSubmittedBy().getFullName());
        }
        if (s.getReviewedBy() != null) {
            resp.setReviewedById(s.getReviewedBy().getId());
            resp.setReviewedByName(s.getReviewedBy().getFullName());
        }
        resp.setStatus(s.getStatus());
        resp.setPriority(s.getPriority());
        resp.setConfidential(s.isConfidential());
        resp.setPublished(s.isPublished());
        resp.setReviewerComments(s.getReviewerComments());
        resp.setDenialReason(s.getDenialReason());
        resp.setSubmittedAt(s.getSubmittedAt());
        resp.setReviewedAt(s.getReviewedAt());
        resp.setApprovedAt(s.getApprovedAt());
        resp.setPublishedAt(s.getPublishedAt());
        resp.setUpdatedAt(s.getUpdatedAt());

        if (visibleComments != null) {
            resp.setComments(visibleComments.stream().map(this::toCommentResponse).toList());
        } else {
            resp.setComments(Collections.emptyList());
        }
        return resp;
    }

    public CommentResponse toCommentResponse(Comment c) {
        CommentResponse r = new CommentResponse();
        r.setId(c.getId());
        if (c.getAuthor() != null) {
            r.setAuthorId(c.getAuthor().getId());
            r.setAuthorName(c.getAuthor().getFullName());
        }
        r.setText(c.getText());
        r.setInternal(c.isInternal());
        r.setCreatedAt(c.getCreatedAt());
        return r;
    }

    public NotificationResponse toNotificationResponse(Notification n) {
        NotificationResponse r = new NotificationResponse();
        r.setId(n.getId());
        r.setTitle(n.getTitle());
        r.setMessage(n.getMessage());
        r.setSubmissionId(n.getSubmission() != null ? n.getSubmission().getId() : null);
        r.setRead(n.isRead());
        r.setCreatedAt(n.getCreatedAt());
        return r;
    }

    public AuditLogEntryResponse toAuditResponse(AuditLogEntry e) {
        AuditLogEntryResponse r = new AuditLogEntryResponse();
        r.setId(e.getId());
        if (e.getActor() != null) {
            r.setActorId(e.getActor().getId());
            r.setActorName(e.getActor().getFullName());
        }
        r.setAction(e.getAction());
        r.setSubmissionId(e.getSubmissionId());
        r.setDescription(e.getDescription());
        r.setOriginAddress(e.getOriginAddress());
        r.setCreatedAt(e.getCreatedAt());
        return r;
    }

    /** Splits the comma-delimited tag string, dropping blanks. */
    public static List<String> parseTags(String tags) {
        if (tags == null || tags.isBlank()) {
            return Collections.emptyList();
        }
        return Arrays.stream(tags.split(","))
                .map(String::trim)
                .filter(t -> !t.isEmpty())
                .toList();
    }
}
