package dev.pekelund.zuvp.normalization;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Inclusive period of public-space use.
 */
public record UsagePeriod(LocalDate start, LocalDate end) {

    public UsagePeriod {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Period end " + end + " precedes start " + start);
        }
    }

    public int days() {
        return Math.toIntExact(ChronoUnit.DAYS.between(start, end) + 1);
    }
}
