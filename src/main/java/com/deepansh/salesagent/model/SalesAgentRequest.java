package com.deepansh.salesagent.model;

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
public class SalesAgentRequest {

    @NotBlank(message = "message must not be blank")
    @Size(max = 4000, message = "message must be at most 4000 characters")
    private String message;

    @NotBlank(message = "sessionId is required")
    @Size(max = 128)
    private String sessionId;

    @NotBlank(message = "userId is required")
    @Size(max = 64)
    private String userId;
}
