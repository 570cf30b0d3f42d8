package com.example.servicerota.availability;

import java.util.Locale;
import java.util.Optional;

/**
 * Normalizes availability cells. Only case-insensitive {@code yes}/{@code no} are recognised.
 */
public final class AvailabilityFlag {

    public static final String YES = "Yes";
    public static final String NO = "No";

    private AvailabilityFlag() {
    }

    /**
     * @return {@code true} for yes, {@code false} for no, empty for anything else (blank included)
     */
    public static Optional<Boolean> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "yes" -> Optional.of(Boolean.TRUE);
            case "no" -> Optional.of(Boolean.FALSE);
            default -> Optional.empty();
        };
    }

    public static String format(boolean available) {
        return available ? YES : NO;
    }
}
