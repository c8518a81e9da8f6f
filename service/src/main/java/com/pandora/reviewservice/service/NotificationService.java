package com.pandora.reviewservice.service;

import com.pandora.reviewservice.dto.NotificationResponse;
import com.pandora.reviewservice.dto.UnreadCountResponse;
import com.pandora.reviewservice.entity.Notification;
import com.pandora.reviewservice.entity.User;
import com.pandora.reviewservice.exception.PermissionDeniedException;
import com.pandora.reviewservice.exception.ResourceNotFoundException;
import com.pandora.reviewservice.repository.NotificationRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class NotificationService {

    private final NotificationRepository notificationRepository;
    private final ActorResolver actorResolver;
    private final SubmissionMapper mapper;

    @Transactional(readOnly = true)
    public Page<NotificationResponse> list(RequestContext ctx, Pageable pageable) {
        User actor = actorResolver.resolve(ctx);
        return notificationRepository.findAllByRecipientIdOrderByCreatedAtDesc(actor.getId(), pageable)
                .map(mapper::toNotificationResponse);
    }

    @Transactional(readOnly = true)
    public UnreadCountResponse unreadCount(RequestContext ctx) {
        User actor = actorResolver.resolve(ctx);
        return new UnreadCountResponse(notificationRepository.countByRecipientIdAndReadFalse(actor.getId()));
    }

    /** Idempotent; only the recipient may mark a notification read. Not audited. */
    @Transactional
    public NotificationResponse markRead(RequestContext ctx, Long notificationId) {
        User actor = actorResolver.resolve(ctx);
        Notification notification = notificationRepository.findById(notificationId)
                .orElseThrow(() -> ResourceNotFoundException.notification(notificationId));
        if (!notification.isAddressedTo(actor)) {
            throw new PermissionDeniedException("Notification " + notificationId + " belongs to another user");
        }
        if (!notification.isRead()) {
            notification.markRead();
            notificationRepository.save(notification);
        }
        return mapper.toNotificationResponse(notification);
    }
}
