package com.pandora.reviewservice.controller;

import com.pandora.reviewservice.audit.AuditLogService;
import com.pandora.reviewservice.dto.AuditLogEntryResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/audit-log")
@RequiredArgsConstructor
public class AuditLogController {

    private final AuditLogService auditLogService;

    @GetMapping
    public List<AuditLogEntryResponse> getAuditLog(
            @RequestHeader(RequestContexts.ACTOR_HEADER) Long actorId,
            HttpServletRequest request) {
        return auditLogService.recent(RequestContexts.of(actorId, request));
    }
}
