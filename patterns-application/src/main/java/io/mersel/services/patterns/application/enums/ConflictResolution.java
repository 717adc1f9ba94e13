package io.mersel.services.patterns.application.enums;

/**
 * Ebeveyn/çocuk section çakışmasında uygulanacak politika.
 */
public enum ConflictResolution {
    /** Sadece raporla, iki pattern de aktif kalır. */
    KEEP_BOTH,
    /** Ebeveyn section pattern'i çocuk pattern tarafından supersede edilir. */
    SUPERSEDE_PARENT
}
