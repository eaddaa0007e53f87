package dev.pekelund.zuvp.fees;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class FeeCalculatorTest {

    private final FeeCalculator calculator = new FeeCalculator(BigDecimal.TEN);

    @Test
    void multipliesAreaDaysAndRate() {
        assertThat(calculator.computeFee(new BigDecimal("12.5"), 10)).isEqualTo(1250);
    }

    @Test
    void floorsFractionalFees() {
        assertThat(calculator.computeFee(new BigDecimal("3.33"), 3)).isEqualTo(99);
    }

    @Test
    void zeroAreaOrZeroDaysCostNothing() {
        assertThat(calculator.computeFee(BigDecimal.ZERO, 30)).isZero();
        assertThat(calculator.computeFee(new BigDecimal("20"), 0)).isZero();
    }

    @Test
    void usesConfiguredRate() {
        assertThat(FeeCalculator.computeFee(new BigDecimal("4"), 5, new BigDecimal("2.5"))).isEqualTo(50);
    }

    @Test
    void rejectsNegativeInputs() {
        assertThatThrownBy(() -> calculator.computeFee(new BigDecimal("-1"), 5))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> calculator.computeFee(BigDecimal.ONE, -5))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new FeeCalculator(new BigDecimal("-0.5")))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void reportsFeesBeyondLongRange() {
        FeeCalculator expensive = new FeeCalculator(new BigDecimal("1e12"));

        assertThatThrownBy(() -> expensive.computeFee(new BigDecimal("1000000"), 3660))
            .isInstanceOf(FeeCalculationException.class)
            .hasMessageContaining("out of range")
            .hasCauseInstanceOf(ArithmeticException.class);
    }

    @Test
    void largestAcceptedAreaAndPeriodStillFit() {
        assertThat(calculator.computeFee(new BigDecimal("1000000"), 3660)).isEqualTo(36_600_000_000L);
        assertThat(calculator.computeFee(new BigDecimal("1000000"), Integer.MAX_VALUE))
            .isEqualTo(21_474_836_470_000_000L);
    }
}
