package com.cred.freestyle.commerce.service;

/**
 * Kinds of audited administrative change.
 */
public enum AuditAction {
    CREATE,
    UPDATE,
    DELETE,
    STOCK_ADJUST,
    STATUS_CHANGE
}
