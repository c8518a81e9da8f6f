package com.pandora.reviewservice.controller;

import com.pandora.reviewservice.dto.DashboardResponse;
import com.pandora.reviewservice.service.DashboardService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/dashboard")
@RequiredArgsConstructor
public class DashboardController {

    private final DashboardService dashboardService;

    @GetMapping
    public DashboardResponse getDashboard(
            @RequestHeader(RequestContexts.ACTOR_HEADER) Long actorId,
            HttpServletRequest request) {
        return dashboardService.dashboard(RequestContexts.of(actorId, request));
    }
}
