package com.pandora.reviewservice.controller;

import com.pandora.reviewservice.dto.AnalyticsResponse;
import com.pandora.reviewservice.service.AnalyticsService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/analytics")
@RequiredArgsConstructor
public class AnalyticsController {

    private final AnalyticsService analyticsService;

    @GetMapping
    public AnalyticsResponse getAnalytics(
            @RequestHeader(RequestContexts.ACTOR_HEADER) Long actorId,
            @RequestParam(name = "days", defaultValue = "" + AnalyticsService.DEFAULT_DAYS) int days,
            HttpServletRequest request) {
        return analyticsService.analytics(RequestContexts.of(actorId, request), days);
    }
}
