package com.pandora.reviewservice.notification;

import lombok.RequiredArgsConstructor;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

@RequiredArgsConstructor
public class SmtpEmailTransport implements EmailTransport {

    private final JavaMailSender mailSender;
    private final String fromAddress;

    @Override
    public EmailDeliveryResult send(String recipientAddress, String subject, String body) {
        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(fromAddress);
        message.setTo(recipientAddress);
        message.setSubject(subject);
        message.setText(body);
        try {
            mailSender.send(message);
            return EmailDeliveryResult.delivered();
        } catch (MailException e) {
            return EmailDeliveryResult.failed(e.getMessage());
        }
    }
}
