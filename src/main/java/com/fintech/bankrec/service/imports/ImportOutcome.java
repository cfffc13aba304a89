package com.fintech.bankrec.service.imports;

public enum ImportOutcome {
    INSERTED,
    SKIPPED_DUPLICATE,
    FAILED
}
