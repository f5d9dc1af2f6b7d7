package com.auditeng.backend.rules;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Calibration validity compared on UTC calendar dates; the time of day never matters.
 */
public final class CalibrationDates {

    private CalibrationDates() {
    }

    /** The certificate expired on a day before the measurement. */
    public static boolean isExpired(LocalDate expiry, LocalDate measured) {
        return expiry.isBefore(measured);
    }

    /** The certificate expires on the measurement day itself. */
    public static boolean isExpiringToday(LocalDate expiry, LocalDate measured) {
        return expiry.isEqual(measured);
    }

    public static boolean isExpired(Instant expiry, Instant measured) {
        return isExpired(utcDate(expiry), utcDate(measured));
    }

    public static boolean isExpiringToday(Instant expiry, Instant measured) {
        return isExpiringToday(utcDate(expiry), utcDate(measured));
    }

    static LocalDate utcDate(Instant instant) {
        return instant.atZone(ZoneOffset.UTC).toLocalDate();
    }
}
