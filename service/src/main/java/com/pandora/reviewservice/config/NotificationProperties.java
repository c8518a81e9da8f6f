package com.pandora.reviewservice.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Notification settings bound from {@code app.notifications}:
 * <pre>
 * app:
 *   notifications:
 *     email:
 *       enabled: true
 *       from: noreply@pandorabox.gov.lr
 *       subject-prefix: "[Pandora Box] "
 * </pre>
 * SMTP connection settings stay under the standard {@code spring.mail.*} keys.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "app.notifications")
public class NotificationProperties {

    private Email email = new Email();

    @Getter
    @Setter
    public static class Email {

        /** Master switch for outgoing email; in-app notifications are always created. */
        private boolean enabled = true;

        private String from = "noreply@pandorabox.gov.lr";

        private String subjectPrefix = "[Pandora Box] ";
    }
}
