package io.mersel.services.patterns.application.enums;

/**
 * Çalıştırma türü.
 */
public enum RunKind {
    DISCOVERY,
    IDENTIFY
}
