package com.stkbarbershop.bookingservice.exceptions;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.stkbarbershop.bookingservice.dto.ErrorResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Clock;
import java.util.List;

/**
 * Maps booking failures to client responses.
 * <p>
 * Rate limiting and validation failures are caused by the client and are not
 * logged as faults. Mail delivery failures are dependency faults: logged at
 * ERROR, answered with 502 and a message that carries no transport detail.
 */
@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    static final String DELIVERY_FAILED_MESSAGE = "Eroare la trimiterea emailului.";

    // Prefix Spring MVC uses when a required @RequestBody is absent
    private static final String MISSING_BODY_PREFIX = "Required request body is missing";

    private final Clock clock;

    @ExceptionHandler(BookingValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(BookingValidationException ex) {
        log.debug("Booking rejected: field={} reason={}", ex.getField(), ex.getReason());
        return ResponseEntity.badRequest().body(validationError(ex.getField(), ex.getReason(), ex.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        String field = "body";
        if (ex.getCause() == null && ex.getMessage() != null && ex.getMessage().startsWith(MISSING_BODY_PREFIX)) {
            log.debug("Booking rejected: empty request body");
            return ResponseEntity.badRequest().body(validationError(field, ValidationReason.MISSING_FIELD,
                    ValidationReason.MISSING_FIELD.getDefaultMessage() + ": " + field));
        }
        if (ex.getCause() instanceof JsonMappingException mappingException) {
            List<JsonMappingException.Reference> path = mappingException.getPath();
            if (!path.isEmpty() && path.get(path.size() - 1).getFieldName() != null) {
                field = path.get(path.size() - 1).getFieldName();
            }
        }
        log.debug("Unreadable booking payload at {}: {}", field, ex.getMostSpecificCause().getMessage());
        return ResponseEntity.badRequest().body(validationError(field, ValidationReason.MALFORMED_FIELD,
                ValidationReason.MALFORMED_FIELD.getDefaultMessage() + ": " + field));
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<ErrorResponse> handleRateLimit(RateLimitExceededException ex) {
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getRetryAfterSeconds()))
                .body(ErrorResponse.builder()
                        .success(false)
                        .message(ex.getMessage())
                        .retryAfter(ex.getRetryAfterSeconds())
                        .timestamp(clock.instant())
                        .build());
    }

    @ExceptionHandler(MailDeliveryException.class)
    public ResponseEntity<ErrorResponse> handleMailDelivery(MailDeliveryException ex) {
        log.error("Booking notification delivery failed: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(ErrorResponse.builder()
                        .success(false)
                        .message(DELIVERY_FAILED_MESSAGE)
                        .timestamp(clock.instant())
                        .build());
    }

    private ErrorResponse validationError(String field, ValidationReason reason, String message) {
        return ErrorResponse.builder()
                .success(false)
                .message(message)
                .field(field)
                .reason(reason.name())
                .timestamp(clock.instant())
                .build();
    }
}
