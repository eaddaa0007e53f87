package dev.pekelund.zuvp.normalization;

import dev.pekelund.zuvp.permits.CanonicalField;
import dev.pekelund.zuvp.permits.CanonicalRecord;
import dev.pekelund.zuvp.permits.ExtractionResult;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps the extractor's heterogeneous key names and duration representations onto a {@link CanonicalRecord}.
 *
 * <p>Every canonical field is resolved through the alias table declared on {@link CanonicalField}. The first
 * alias holding a non-placeholder value wins; exact key matches take precedence over case-insensitive ones.
 * Malformed input never raises, it degrades to defaults and is left for the validator to flag.
 */
public class FieldNormalizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(FieldNormalizer.class);

    private static final Set<String> PLACEHOLDERS = Set.of("", "n/a", "none", "null");
    static final BigDecimal MAX_AREA_SQM = new BigDecimal("1000000");

    private static final Pattern AREA_UNIT = Pattern.compile("(?i)\\s*(m2|m²|m\\^2|sqm|m)\\s*$");

    private final DurationParser durationParser;
    private final int fallbackDurationDays;

    public FieldNormalizer(int fallbackDurationDays) {
        this(new DurationParser(), fallbackDurationDays);
    }

    public FieldNormalizer(DurationParser durationParser, int fallbackDurationDays) {
        if (fallbackDurationDays < 0) {
            throw new IllegalArgumentException("fallbackDurationDays must not be negative");
        }
        this.durationParser = Objects.requireNonNull(durationParser, "durationParser");
        this.fallbackDurationDays = fallbackDurationDays;
    }

    public CanonicalRecord normalize(ExtractionResult extraction) {
        Map<String, Object> fields = extraction != null && !extraction.failed()
            ? extraction.fields()
            : Map.of();

        Optional<Object> duration = resolve(fields, CanonicalField.DURATION);
        Optional<UsagePeriod> period = duration.flatMap(durationParser::parse);
        int durationDays = period.map(UsagePeriod::days).orElse(fallbackDurationDays);
        if (duration.isPresent() && period.isEmpty()) {
            LOGGER.debug("Duration '{}' could not be parsed; using fallback of {} days", duration.get(),
                fallbackDurationDays);
        }

        Optional<BigDecimal> area = resolve(fields, CanonicalField.AREA).flatMap(FieldNormalizer::parseArea);

        return new CanonicalRecord(
            resolveText(fields, CanonicalField.APPLICANT_NAME),
            resolveText(fields, CanonicalField.COMPANY_ID),
            resolveText(fields, CanonicalField.CONTACT_DETAILS),
            resolveText(fields, CanonicalField.PURPOSE_OF_USE),
            resolveText(fields, CanonicalField.LOCATION),
            duration.map(value -> describeDuration(value, period)).orElse(null),
            period.map(UsagePeriod::start).orElse(null),
            period.map(UsagePeriod::end).orElse(null),
            durationDays,
            area.orElse(BigDecimal.ZERO),
            area.isPresent(),
            0L,
            null);
    }

    /**
     * Returns the value of the first alias of {@code field} that is present and not a placeholder.
     */
    public Optional<Object> resolve(Map<String, Object> fields, CanonicalField field) {
        if (fields == null || fields.isEmpty()) {
            return Optional.empty();
        }
        for (String alias : field.aliases()) {
            Object value = fields.get(alias);
            if (isPresent(value)) {
                return Optional.of(value);
            }
        }
        for (String alias : field.aliases()) {
            for (Map.Entry<String, Object> entry : fields.entrySet()) {
                if (entry.getKey() != null && entry.getKey().trim().equalsIgnoreCase(alias)
                    && isPresent(entry.getValue())) {
                    return Optional.of(entry.getValue());
                }
            }
        }
        return Optional.empty();
    }

    private String resolveText(Map<String, Object> fields, CanonicalField field) {
        return resolve(fields, field).map(FieldNormalizer::toText).orElse(null);
    }

    static boolean isPresent(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof CharSequence text) {
            return !PLACEHOLDERS.contains(text.toString().trim().toLowerCase(Locale.ROOT));
        }
        if (value instanceof Map<?, ?> map) {
            return map.values().stream().anyMatch(FieldNormalizer::isPresent);
        }
        if (value instanceof Collection<?> collection) {
            return collection.stream().anyMatch(FieldNormalizer::isPresent);
        }
        return true;
    }

    static String toText(Object value) {
        if (value instanceof Map<?, ?> map) {
            return map.entrySet().stream()
                .filter(entry -> isPresent(entry.getValue()))
                .map(entry -> entry.getKey() + ": " + toText(entry.getValue()))
                .collect(Collectors.joining(", "));
        }
        if (value instanceof Collection<?> collection) {
            return collection.stream()
                .filter(FieldNormalizer::isPresent)
                .map(FieldNormalizer::toText)
                .collect(Collectors.joining(", "));
        }
        return value.toString().trim();
    }

    private static String describeDuration(Object value, Optional<UsagePeriod> period) {
        if (period.isPresent() && value instanceof Map<?, ?>) {
            LocalDate start = period.get().start();
            LocalDate end = period.get().end();
            return start + " - " + end;
        }
        return toText(value);
    }

    static Optional<BigDecimal> parseArea(Object value) {
        String candidate;
        if (value instanceof Number number) {
            candidate = number.toString();
        } else if (value instanceof CharSequence text) {
            candidate = AREA_UNIT.matcher(text.toString().trim()).replaceAll("")
                .replace('\u00A0', ' ')
                .replace(" ", "")
                .replace(',', '.');
        } else {
            return Optional.empty();
        }
        BigDecimal area;
        try {
            area = new BigDecimal(candidate);
        } catch (NumberFormatException ex) {
            LOGGER.debug("Area value '{}' is not numeric", value);
            return Optional.empty();
        }
        if (area.compareTo(MAX_AREA_SQM) > 0) {
            LOGGER.warn("Area value '{}' exceeds {} m2; treating it as missing", value, MAX_AREA_SQM);
            return Optional.empty();
        }
        return Optional.of(area.signum() < 0 ? BigDecimal.ZERO : area);
    }
}
