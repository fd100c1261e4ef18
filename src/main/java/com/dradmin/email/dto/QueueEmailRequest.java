package com.dradmin.email.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueEmailRequest {

    // falls back to dradmin.email.from
    private String from;

    @NotBlank
    private String to;

    private String cc;
    private String bcc;

    @NotBlank
    @Size(max = 500)
    private String subject;

    private String bodyText;
    private String bodyHtml;

    private Long customerId;
    private String relatedEntityType;
    private Long relatedEntityId;
}
