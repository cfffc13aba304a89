package com.fintech.bankrec.dto;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class ErrorResponse {
    String error;
    String message;
    Map<String, Object> details;
    Instant timestamp;
}
