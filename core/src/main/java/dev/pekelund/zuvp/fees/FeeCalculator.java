package dev.pekelund.zuvp.fees;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Computes the statutory fee for a public-space use: {@code floor(area * days * rate)} in whole CZK.
 * A result that does not fit in a {@code long} raises {@link FeeCalculationException}.
 */
public class FeeCalculator {

    private final BigDecimal ratePerSqmDay;

    public FeeCalculator(BigDecimal ratePerSqmDay) {
        Objects.requireNonNull(ratePerSqmDay, "ratePerSqmDay");
        if (ratePerSqmDay.signum() < 0) {
            throw new IllegalArgumentException("ratePerSqmDay must not be negative");
        }
        this.ratePerSqmDay = ratePerSqmDay;
    }

    public BigDecimal ratePerSqmDay() {
        return ratePerSqmDay;
    }

    public long computeFee(BigDecimal areaSqm, int durationDays) {
        return computeFee(areaSqm, durationDays, ratePerSqmDay);
    }

    public static long computeFee(BigDecimal areaSqm, int durationDays, BigDecimal ratePerSqmDay) {
        Objects.requireNonNull(areaSqm, "areaSqm");
        Objects.requireNonNull(ratePerSqmDay, "ratePerSqmDay");
        if (areaSqm.signum() < 0 || durationDays < 0 || ratePerSqmDay.signum() < 0) {
            throw new IllegalArgumentException("Fee inputs must not be negative (area=" + areaSqm
                + ", days=" + durationDays + ", rate=" + ratePerSqmDay + ")");
        }
        BigDecimal fee = areaSqm
            .multiply(BigDecimal.valueOf(durationDays))
            .multiply(ratePerSqmDay)
            .setScale(0, RoundingMode.FLOOR);
        try {
            return fee.longValueExact();
        } catch (ArithmeticException ex) {
            throw new FeeCalculationException("Fee " + fee.toPlainString() + " CZK is out of range (area="
                + areaSqm + ", days=" + durationDays + ", rate=" + ratePerSqmDay + ")", ex);
        }
    }
}
