package com.fintech.bankrec.service.duplicate;

public enum DuplicateVerdict {
    TRUE_DUPLICATE,
    LEGITIMATE_RECURRING,
    PROTECTED_FEE,
    NOT_DUPLICATE
}
