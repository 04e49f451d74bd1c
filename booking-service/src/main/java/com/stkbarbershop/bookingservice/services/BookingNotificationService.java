package com.stkbarbershop.bookingservice.services;

import com.stkbarbershop.bookingservice.configurations.BookingProperties;
import com.stkbarbershop.bookingservice.dto.email.EmailRequest;
import com.stkbarbershop.bookingservice.exceptions.MailDeliveryException;
import com.stkbarbershop.bookingservice.models.ValidatedAppointment;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.JavaMailSenderImpl;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.thymeleaf.ITemplateEngine;
import org.thymeleaf.context.Context;

import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders a booking into an HTML email and hands it to the SMTP relay.
 * Delivery is synchronous and never retried; any failure surfaces as a
 * {@link MailDeliveryException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BookingNotificationService {

    static final String TEMPLATE_NAME = "appointment-notification";

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm");
    private static final DateTimeFormatter SUBJECT_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");
    private static final String PLACEHOLDER = "-";

    private final JavaMailSender mailSender;
    private final ITemplateEngine templateEngine;
    private final BookingProperties properties;

    public void sendAppointmentNotification(ValidatedAppointment appointment) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("fullName", appointment.getFullName());
        variables.put("phone", appointment.getPhone());
        variables.put("email", orPlaceholder(appointment.getEmail()));
        variables.put("service", titleCase(appointment.getService()));
        variables.put("date", appointment.getDate().format(DATE_FORMAT));
        variables.put("time", appointment.getTime().format(TIME_FORMAT));
        variables.put("message", orPlaceholder(appointment.getMessage()));

        EmailRequest request = EmailRequest.builder()
                .to(properties.getMail().getTo())
                .subject(buildSubject(appointment))
                .templateName(TEMPLATE_NAME)
                .templateVariables(variables)
                .replyTo(appointment.getEmail())
                .build();

        send(request);
    }

    String buildSubject(ValidatedAppointment appointment) {
        return String.format("Programare nouă: %s - %s",
                appointment.getFullName(), appointment.getDateTime().format(SUBJECT_FORMAT));
    }

    private void send(EmailRequest request) {
        BookingProperties.Mail mail = properties.getMail();
        if (!isConfigured(mail)) {
            log.error("SMTP configuration incomplete; cannot send booking notification");
            throw new MailDeliveryException("Configurare SMTP incompletă");
        }

        try {
            MimeMessage mimeMessage = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(
                    mimeMessage,
                    MimeMessageHelper.MULTIPART_MODE_MIXED_RELATED,
                    StandardCharsets.UTF_8.name());

            if (StringUtils.hasText(mail.getSenderName())) {
                helper.setFrom(mail.getFrom(), mail.getSenderName());
            } else {
                helper.setFrom(mail.getFrom());
            }
            helper.setTo(request.getTo());
            helper.setSubject(request.getSubject());

            if (request.getReplyTo() != null) {
                helper.setReplyTo(request.getReplyTo());
            }

            helper.setText(processTemplate(request.getTemplateName(), request.getTemplateVariables()), true);

            mailSender.send(mimeMessage);

            log.info("Booking notification sent to: {}", request.getTo());
        } catch (MailException | MessagingException | UnsupportedEncodingException e) {
            log.error("Failed to send booking notification to: {} - Error: {}", request.getTo(), e.getMessage(), e);
            throw new MailDeliveryException("Email sending failed", e);
        }
    }

    private boolean isConfigured(BookingProperties.Mail mail) {
        if (!StringUtils.hasText(mail.getFrom()) || !StringUtils.hasText(mail.getTo())) {
            return false;
        }
        if (mailSender instanceof JavaMailSenderImpl sender) {
            return StringUtils.hasText(sender.getHost()) && sender.getPort() > 0;
        }
        return true;
    }

    private String processTemplate(String templateName, Map<String, Object> variables) {
        Context context = new Context();
        if (variables != null) {
            context.setVariables(variables);
        }
        return templateEngine.process(templateName, context);
    }

    private static String orPlaceholder(String value) {
        return value != null ? value : PLACEHOLDER;
    }

    static String titleCase(String value) {
        return Arrays.stream(value.split(" "))
                .filter(word -> !word.isEmpty())
                .map(word -> Character.toUpperCase(word.charAt(0)) + word.substring(1))
                .collect(Collectors.joining(" "));
    }
}
