package com.pandora.reviewservice.exception;

import lombok.Getter;

import java.util.List;

@Getter
public class SubmissionValidationException extends RuntimeException {

    private final List<String> errors;

    public SubmissionValidationException(List<String> errors) {
        super(String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }
}
