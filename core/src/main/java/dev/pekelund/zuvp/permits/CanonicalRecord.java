package dev.pekelund.zuvp.permits;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Normalized permit data, independent of the extractor's vocabulary.
 *
 * <p>{@code feeCzk} and {@code variableSymbol} are not extracted; they stay {@code 0}/{@code null} until
 * {@link #withCharges(long, String)} attaches them after validation.
 *
 * @param applicantName   applicant name or {@code null} when absent
 * @param companyId       company identification number (IČO) or {@code null}
 * @param contactDetails  flattened contact details or {@code null}
 * @param purposeOfUse    declared purpose of the public-space use or {@code null}
 * @param location        address or plot of the used space or {@code null}
 * @param statedDuration  duration as stated in the submission, {@code null} when absent
 * @param startDate       first day of use when it could be parsed
 * @param endDate         last day of use when it could be parsed
 * @param durationDays    inclusive day count, or the configured fallback
 * @param areaSqm         used area in square meters, {@code 0} when absent
 * @param areaStated      whether the submission stated an area at all
 * @param feeCzk          statutory fee in CZK
 * @param variableSymbol  10-digit payment reference
 */
public record CanonicalRecord(
    String applicantName,
    String companyId,
    String contactDetails,
    String purposeOfUse,
    String location,
    String statedDuration,
    LocalDate startDate,
    LocalDate endDate,
    int durationDays,
    BigDecimal areaSqm,
    boolean areaStated,
    long feeCzk,
    String variableSymbol
) {

    public CanonicalRecord {
        if (durationDays < 0) {
            throw new IllegalArgumentException("durationDays must not be negative");
        }
        if (areaSqm == null) {
            areaSqm = BigDecimal.ZERO;
        }
        if (areaSqm.signum() < 0) {
            throw new IllegalArgumentException("areaSqm must not be negative");
        }
        if (feeCzk < 0) {
            throw new IllegalArgumentException("feeCzk must not be negative");
        }
    }

    public CanonicalRecord withCharges(long fee, String symbol) {
        return new CanonicalRecord(applicantName, companyId, contactDetails, purposeOfUse, location, statedDuration,
            startDate, endDate, durationDays, areaSqm, areaStated, fee, symbol);
    }

    /**
     * Returns the value backing the given canonical field, or {@code null} when the submission did not provide it.
     */
    public Object valueOf(CanonicalField field) {
        return switch (field) {
            case APPLICANT_NAME -> applicantName;
            case PURPOSE_OF_USE -> purposeOfUse;
            case LOCATION -> location;
            case COMPANY_ID -> companyId;
            case CONTACT_DETAILS -> contactDetails;
            case DURATION -> statedDuration;
            case AREA -> areaStated ? areaSqm : null;
        };
    }
}
