package com.pandora.reviewservice.dto;

import com.pandora.reviewservice.entity.SubmissionStatus;
import lombok.Data;

import java.util.Map;

@Data
public class StatusCountsResponse {
    private long total;
    private Map<SubmissionStatus, Long> byStatus;

    public static StatusCountsResponse of(Map<SubmissionStatus, Long> byStatus) {
        StatusCountsResponse resp = new StatusCountsResponse();
        resp.setByStatus(byStatus);
        resp.setTotal(byStatus.values().stream().mapToLong(Long::longValue).sum());
        return resp;
    }
}
