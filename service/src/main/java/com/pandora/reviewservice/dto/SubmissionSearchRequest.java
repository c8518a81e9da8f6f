package com.pandora.reviewservice.dto;

import com.pandora.reviewservice.entity.ContentType;
import com.pandora.reviewservice.entity.SubmissionStatus;
import lombok.Data;

@Data
public class SubmissionSearchRequest {
    private SubmissionStatus status;
    private ContentType contentType;
    private Long macId;
    private String search;
}
