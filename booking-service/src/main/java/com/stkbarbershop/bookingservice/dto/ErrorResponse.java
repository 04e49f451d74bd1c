package com.stkbarbershop.bookingservice.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
@Data
@Builder
public class ErrorResponse {

    private boolean success;
    private String message;
    private String field;
    private String reason;
    private Long retryAfter;
    private Instant timestamp;
}
