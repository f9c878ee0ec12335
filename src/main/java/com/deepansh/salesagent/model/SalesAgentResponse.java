package com.deepansh.salesagent.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SalesAgentResponse {
    private String sessionId;
    private String response;
    private ExecutionTrace executionTrace;
}
