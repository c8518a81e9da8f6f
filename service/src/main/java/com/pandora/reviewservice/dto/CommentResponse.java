package com.pandora.reviewservice.dto;

import lombok.Data;

import java.time.OffsetDateTime;

@Data
public class CommentResponse {
    private Long id;
    private Long authorId;
    private String authorName;
    private String text;
    private boolean internal;
    private OffsetDateTime createdAt;
}
