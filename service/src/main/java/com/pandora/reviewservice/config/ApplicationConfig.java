package com.pandora.reviewservice.config;

import com.pandora.reviewservice.notification.EmailTransport;
import com.pandora.reviewservice.notification.LoggingEmailTransport;
import com.pandora.reviewservice.notification.SmtpEmailTransport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.mail.javamail.JavaMailSender;

import java.time.Clock;

@Slf4j
@Configuration
@EnableConfigurationProperties(NotificationProperties.class)
public class ApplicationConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public EmailTransport emailTransport(ObjectProvider<JavaMailSender> mailSender, NotificationProperties properties) {
        JavaMailSender sender = mailSender.getIfAvailable();
        if (sender == null) {
            log.info("No SMTP server configured (spring.mail.host); notification emails will be logged only");
            return new LoggingEmailTransport();
        }
        return new SmtpEmailTransport(sender, properties.getEmail().getFrom());
    }
}
