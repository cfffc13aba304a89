package com.fintech.bankrec.entity;

/**
 * Kind of action recorded in the audit log.
 */
public enum AuditActionType {
    INSERT,
    UPDATE,
    LINK,
    DELETE,
    SPLIT_ASSIGN,

    /**
     * A decision that changed nothing: left unmatched, ambiguous, protected.
     */
    REVIEW
}
