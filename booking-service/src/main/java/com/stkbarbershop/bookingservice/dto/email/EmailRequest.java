package com.stkbarbershop.bookingservice.dto.email;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EmailRequest {

    private String to;

    private String subject;

    private String templateName;

    private Map<String, Object> templateVariables;

    private String replyTo;

}
