package com.quikdb.core.domain;

/**
 * Privileges a caller identity may hold.
 */
public enum Capability {
    CALCULATE,
    DISTRIBUTE,
    SLASH,
    ADMIN
}
