package dev.pekelund.zuvp.permits;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Shared sample records for tests.
 */
public final class PermitFixtures {

    private PermitFixtures() {
    }

    public static CanonicalRecord chargedRecord() {
        return new CanonicalRecord("Jan Novák", "12345678", "phone: +420 777 123 456", "Předzahrádka",
            "Náměstí Míru 1", "2025-07-01 - 2025-07-10", LocalDate.of(2025, 7, 1), LocalDate.of(2025, 7, 10), 10,
            new BigDecimal("12.5"), true, 1250, "8354147304");
    }
}
