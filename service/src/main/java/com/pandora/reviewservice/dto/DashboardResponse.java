package com.pandora.reviewservice.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.pandora.reviewservice.entity.UserRole;
import lombok.Data;

import java.util.List;

/**
 * Role-dependent overview. Reviewer and admin figures are left null, and omitted from the
 * JSON, for the roles they do not apply to.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DashboardResponse {
    private UserRole role;
    private StatusCountsResponse counts;
    private Long myReviews;
    private Long activeUsers;
    private Long activeMacs;
    private Long approvedToday;
    private long unreadNotifications;
    private List<SubmissionResponse> recentSubmissions;
    private List<AuditLogEntryResponse> recentActivity;
}
