package com.pandora.reviewservice.access;

public enum AccessAction {
    CREATE_SUBMISSION,
    VIEW_SUBMISSION,
    EDIT_SUBMISSION,
    DELETE_SUBMISSION,
    REVIEW_SUBMISSION,
    ADD_COMMENT,
    VIEW_COMMENTS,
    VIEW_INTERNAL_COMMENTS,
    EXPORT_SUBMISSIONS,
    VIEW_ALL_AUDIT_LOG,
    VIEW_ANALYTICS
}
