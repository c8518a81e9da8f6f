package com.pandora.reviewservice.controller;

import com.pandora.reviewservice.dto.NotificationResponse;
import com.pandora.reviewservice.dto.UnreadCountResponse;
import com.pandora.reviewservice.service.NotificationService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.web.PageableDefault;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/notifications")
@RequiredArgsConstructor
public class NotificationController {

    private final NotificationService notificationService;

    @GetMapping
    public Page<NotificationResponse> getNotifications(
            @RequestHeader(RequestContexts.ACTOR_HEADER) Long actorId,
            @PageableDefault(size = 20) Pageable pageable,
            HttpServletRequest request) {
        return notificationService.list(RequestContexts.of(actorId, request), pageable);
    }

    @GetMapping("/unread-count")
    public UnreadCountResponse getUnreadCount(
            @RequestHeader(RequestContexts.ACTOR_HEADER) Long actorId,
            HttpServletRequest request) {
        return notificationService.unreadCount(RequestContexts.of(actorId, request));
    }

    @PostMapping("/{id}/read")
    public NotificationResponse markRead(
            @RequestHeader(RequestContexts.ACTOR_HEADER) Long actorId,
            @PathVariable("id") Long id,
            HttpServletRequest request) {
        return notificationService.markRead(RequestContexts.of(actorId, request), id);
    }
}
