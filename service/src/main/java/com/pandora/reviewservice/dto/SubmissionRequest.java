package com.pandora.reviewservice.dto;

import com.pandora.reviewservice.entity.ContentType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * Body of create and edit requests. {@code artifactRef} is mandatory on create only;
 * {@code macId} is read only when an administrator creates on behalf of an agency.
 */
@Data
public class SubmissionRequest {

    @NotBlank(message = "Title is required")
    @Size(max = 300, message = "Title must be at most 300 characters")
    private String title;

    @NotNull(message = "Content type is required")
    private ContentType contentType;

    @NotBlank(message = "Description is required")
    private String description;

    @Size(max = 500, message = "Tags must be at most 500 characters")
    private String tags;

    @Size(max = 500, message = "Artifact reference must be at most 500 characters")
    private String artifactRef;

    private boolean confidential;

    private Long macId;
}
