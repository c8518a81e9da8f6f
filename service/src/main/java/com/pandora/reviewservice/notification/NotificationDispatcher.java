package com.pandora.reviewservice.notification;

import com.pandora.reviewservice.entity.Notification;
import com.pandora.reviewservice.entity.Submission;
import com.pandora.reviewservice.entity.User;
import com.pandora.reviewservice.entity.UserRole;
import com.pandora.reviewservice.repository.NotificationRepository;
import com.pandora.reviewservice.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Creates in-app notifications and queues their email copies.
 *
 * <p>The notification row is written in the caller's transaction and flushed, so a persistence
 * failure aborts the transition. Email goes out after commit through {@link EmailNotificationListener}.
 * A second call with the same (recipient, eventKey) is a no-op.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationDispatcher {

    private final NotificationRepository notificationRepository;
    private final UserRepository userRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * @return {@code true} if a new notification was created, {@code false} if this event
     * had already been delivered to the recipient
     */
    public boolean notify(User recipient, String title, String message, Submission submission, String eventKey) {
        if (notificationRepository.existsByRecipientIdAndEventKey(recipient.getId(), eventKey)) {
            log.debug("Notification {} already dispatched to user {}", eventKey, recipient.getId());
            return false;
        }

        Notification saved = notificationRepository.saveAndFlush(
                Notification.create(recipient, title, message, submission, eventKey, OffsetDateTime.now(clock)));

        eventPublisher.publishEvent(new NotificationCreatedEvent(
                saved.getId(), recipient.getId(), recipient.getEmail(), title, message));
        return true;
    }

    /** Fans out to every active MICAT reviewer. Returns the number of notifications created. */
    public int notifyActiveReviewers(String title, String message, Submission submission, String eventKey) {
        List<User> reviewers = userRepository.findAllByRoleAndActiveTrue(UserRole.MICAT_REVIEWER);
        int created = 0;
        for (User reviewer : reviewers) {
            if (notify(reviewer, title, message, submission, eventKey)) {
                created++;
            }
        }
        log.info("Notified {} of {} active reviewers: {}", created, reviewers.size(), eventKey);
        return created;
    }
}
