package com.pandora.reviewservice.exception;

public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String resource, Long id) {
        super(resource + " not found: " + id);
    }

    public static ResourceNotFoundException submission(Long id) {
        return new ResourceNotFoundException("Submission", id);
    }

    public static ResourceNotFoundException user(Long id) {
        return new ResourceNotFoundException("User", id);
    }

    public static ResourceNotFoundException mac(Long id) {
        return new ResourceNotFoundException("MAC", id);
    }

    public static ResourceNotFoundException notification(Long id) {
        return new ResourceNotFoundException("Notification", id);
    }
}
