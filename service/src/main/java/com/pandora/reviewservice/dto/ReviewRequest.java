package com.pandora.reviewservice.dto;

import com.pandora.reviewservice.entity.Priority;
import com.pandora.reviewservice.entity.ReviewOutcome;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class ReviewRequest {

    @NotNull(message = "Review action is required")
    private ReviewOutcome action;

    private String reviewerComments;

    private Priority priority;

    private boolean publish;

    private String denialReason;
}
