package com.stkbarbershop.bookingservice.controllers;

import jakarta.mail.Session;
import jakarta.mail.internet.MimeMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.mail.MailSendException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.RequestPostProcessor;

import java.time.LocalDate;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = "booking.mail.from=programari@stkbarbershop.ro")
@AutoConfigureMockMvc
class AppointmentControllerTest {

    private static final String TOMORROW = LocalDate.now(ZoneId.of("Europe/Bucharest")).plusDays(1).toString();

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private JavaMailSender mailSender;

    @BeforeEach
    void setup() {
        when(mailSender.createMimeMessage()).thenReturn(new MimeMessage((Session) null));
    }

    // The limiter is shared across tests in this context, so each test uses its own address
    private static RequestPostProcessor from(String address) {
        return request -> {
            request.setRemoteAddr(address);
            return request;
        };
    }

    private static String payload(String service, int captchaResult) {
        return """
                {
                  "full_name": "Ion Popescu",
                  "phone": "0712345678",
                  "service": "%s",
                  "date": "%s",
                  "time": "14:30",
                  "captcha_a": 2,
                  "captcha_b": 2,
                  "captcha_result": %d
                }
                """.formatted(service, TOMORROW, captchaResult);
    }

    @Test
    void validBooking_fromFreshClient_isAcceptedAndMailed() throws Exception {
        mockMvc.perform(post("/api/appointment")
                        .with(from("192.0.2.1"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(payload("Tuns", 4)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.message").value("Programarea a fost trimisă cu succes."));

        ArgumentCaptor<MimeMessage> messageCaptor = ArgumentCaptor.forClass(MimeMessage.class);
        verify(mailSender).send(messageCaptor.capture());
        assertThat(messageCaptor.getValue().getSubject())
                .isEqualTo("Programare nouă: Ion Popescu - " + TOMORROW + " 14:30");
    }

    @Test
    void secondBookingWithinShortWindow_isRateLimited() throws Exception {
        mockMvc.perform(post("/api/appointment")
                        .with(from("192.0.2.2"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(payload("Tuns", 4)))
                .andExpect(status().isOk());

        mockMvc.perform(post("/api/appointment")
                        .with(from("192.0.2.2"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(payload("Tuns", 4)))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().exists("Retry-After"))
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("Prea multe cereri. Încearcă din nou mai târziu."));
    }

    @Test
    void rateLimit_isAppliedBeforeThePayloadIsRead() throws Exception {
        mockMvc.perform(post("/api/appointment")
                        .with(from("192.0.2.3"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(post("/api/appointment")
                        .with(from("192.0.2.3"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("not json"))
                .andExpect(status().isTooManyRequests());
    }

    @Test
    void invalidService_isRejectedWithFieldAndReason() throws Exception {
        mockMvc.perform(post("/api/appointment")
                        .with(from("192.0.2.4"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(payload("masaj", 4)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.field").value("service"))
                .andExpect(jsonPath("$.reason").value("INVALID_SERVICE"))
                .andExpect(jsonPath("$.message").value("Serviciu invalid"));

        verify(mailSender, never()).send(any(MimeMessage.class));
    }

    @Test
    void wrongCaptcha_isRejected() throws Exception {
        mockMvc.perform(post("/api/appointment")
                        .with(from("192.0.2.5"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(payload("Tuns", 5)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.reason").value("CAPTCHA_FAILED"));
    }

    @Test
    void missingField_isReportedAsMissing() throws Exception {
        mockMvc.perform(post("/api/appointment")
                        .with(from("192.0.2.6"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"full_name\": \"Ion Popescu\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("phone"))
                .andExpect(jsonPath("$.reason").value("MISSING_FIELD"));
    }

    @Test
    void nonNumericCaptcha_isReportedAsMalformed() throws Exception {
        String body = payload("Tuns", 4).replace("\"captcha_a\": 2", "\"captcha_a\": \"doi\"");

        mockMvc.perform(post("/api/appointment")
                        .with(from("192.0.2.7"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("captcha_a"))
                .andExpect(jsonPath("$.reason").value("MALFORMED_FIELD"));
    }

    @Test
    void fractionalCaptcha_isReportedAsMalformed() throws Exception {
        String body = payload("Tuns", 4).replace("\"captcha_a\": 2", "\"captcha_a\": 2.9");

        mockMvc.perform(post("/api/appointment")
                        .with(from("192.0.2.9"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("captcha_a"))
                .andExpect(jsonPath("$.reason").value("MALFORMED_FIELD"));

        verify(mailSender, never()).send(any(MimeMessage.class));
    }

    @Test
    void numericPhone_isReportedAsMalformed() throws Exception {
        String body = payload("Tuns", 4).replace("\"phone\": \"0712345678\"", "\"phone\": 712345678");

        mockMvc.perform(post("/api/appointment")
                        .with(from("192.0.2.10"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("phone"))
                .andExpect(jsonPath("$.reason").value("MALFORMED_FIELD"));
    }

    @Test
    void numericName_isReportedAsMalformed() throws Exception {
        String body = payload("Tuns", 4).replace("\"full_name\": \"Ion Popescu\"", "\"full_name\": 42");

        mockMvc.perform(post("/api/appointment")
                        .with(from("192.0.2.11"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("full_name"))
                .andExpect(jsonPath("$.reason").value("MALFORMED_FIELD"));
    }

    @Test
    void emptyBody_isReportedAsMissing() throws Exception {
        mockMvc.perform(post("/api/appointment")
                        .with(from("192.0.2.12"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(""))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("body"))
                .andExpect(jsonPath("$.reason").value("MISSING_FIELD"));
    }

    @Test
    void mailRelayFailure_isReportedAsBadGatewayWithoutDetails() throws Exception {
        doThrow(new MailSendException("535 Authentication failed for smtp-user"))
                .when(mailSender).send(any(MimeMessage.class));

        mockMvc.perform(post("/api/appointment")
                        .with(from("192.0.2.8"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(payload("Tuns", 4)))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("Eroare la trimiterea emailului."));
    }

    @Test
    void root_reportsServiceStatus() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.service").value("Stk Barbershop API"))
                .andExpect(jsonPath("$.status").value("ok"));
    }

    @Test
    void liveness_isUp() throws Exception {
        mockMvc.perform(get("/api/health/live"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.trackedClients").isNumber());
    }
}
