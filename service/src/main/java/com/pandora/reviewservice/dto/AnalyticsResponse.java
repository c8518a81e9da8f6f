package com.pandora.reviewservice.dto;

import com.pandora.reviewservice.entity.ContentType;
import com.pandora.reviewservice.entity.SubmissionStatus;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@Data
public class AnalyticsResponse {
    private int days;
    private long activeUsers;
    private long activeMacs;
    private long totalSubmissions;
    private Map<SubmissionStatus, Long> byStatus;
    /** Percentage of decided submissions that were approved, one decimal; 0 when none decided. */
    private double approvalRate;
    private long recentSubmissions;
    private long recentApprovals;
    /** Submissions per UTC day within the period, days without submissions omitted. */
    private Map<LocalDate, Long> submissionTrend;
    private List<MacCount> byMac;
    private List<ContentTypeCount> byContentType;
    private List<UserCount> topSubmitters;
    private List<UserCount> topReviewers;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MacCount {
        private Long macId;
        private String acronym;
        private String name;
        private long total;
        private long approved;
        private long pending;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ContentTypeCount {
        private ContentType contentType;
        private long total;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class UserCount {
        private Long userId;
        private String fullName;
        private long total;
    }
}
