package com.fintech.bankrec.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-run overrides. Unset fields fall back to the configured defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunRequest {

    private Boolean dryRun;
    private Boolean backup;
    private Long amountToleranceCents;
    private Integer dateWindowDays;

    public static RunRequest defaults() {
        return new RunRequest();
    }
}
