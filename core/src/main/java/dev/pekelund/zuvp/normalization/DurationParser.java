package dev.pekelund.zuvp.normalization;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Parses the duration shapes the extractor is known to return into a {@link UsagePeriod}.
 *
 * <p>Accepted shapes are an object with {@code start_date}/{@code end_date} (or {@code start}/{@code end}),
 * and a single {@code "<start> - <end>"} string with day-first or ISO dates. Anything else yields an
 * empty result so the caller can apply its fallback. Periods longer than ten years are treated as garbled.
 */
public class DurationParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(DurationParser.class);

    private static final List<String> START_KEYS = List.of("start_date", "start", "startDate", "from", "od");
    private static final List<String> END_KEYS = List.of("end_date", "end", "endDate", "to", "do");

    static final long MAX_PERIOD_DAYS = 3660;

    private static final DateTimeFormatter DAY_FIRST = DateTimeFormatter.ofPattern("d.M.uuuu")
        .withResolverStyle(ResolverStyle.STRICT);
    private static final Pattern ISO_PREFIX = Pattern.compile("^(\\d{4}-\\d{2}-\\d{2})(?:T.*)?$");

    // "01.01.2025 - 10.01.2025", "2025-01-01 – 2025-01-10", "01.01.2025-10.01.2025"
    private static final Pattern RANGE = Pattern.compile(
        "^(?<start>.+?)(?:\\s+[-–—]\\s+|\\s*[–—]\\s*|(?<=\\.\\d{4})-(?=\\s*\\d)|\\s+do\\s+)(?<end>.+)$");

    public Optional<UsagePeriod> parse(Object duration) {
        if (duration instanceof Map<?, ?> map) {
            return parseMap(map);
        }
        if (duration instanceof CharSequence text) {
            return parseRange(text.toString());
        }
        return Optional.empty();
    }

    private Optional<UsagePeriod> parseMap(Map<?, ?> map) {
        Optional<LocalDate> start = firstDate(map, START_KEYS);
        Optional<LocalDate> end = firstDate(map, END_KEYS);
        if (start.isEmpty() || end.isEmpty()) {
            return Optional.empty();
        }
        return period(start.get(), end.get());
    }

    private Optional<LocalDate> firstDate(Map<?, ?> map, List<String> keys) {
        for (String key : keys) {
            Object value = map.get(key);
            if (value != null) {
                Optional<LocalDate> date = parseDate(value.toString());
                if (date.isPresent()) {
                    return date;
                }
            }
        }
        return Optional.empty();
    }

    Optional<UsagePeriod> parseRange(String text) {
        if (!StringUtils.hasText(text)) {
            return Optional.empty();
        }
        Matcher matcher = RANGE.matcher(text.trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        Optional<LocalDate> start = parseDate(matcher.group("start"));
        Optional<LocalDate> end = parseDate(matcher.group("end"));
        if (start.isEmpty() || end.isEmpty()) {
            return Optional.empty();
        }
        return period(start.get(), end.get());
    }

    static Optional<LocalDate> parseDate(String value) {
        if (!StringUtils.hasText(value)) {
            return Optional.empty();
        }
        String compact = value.trim().replaceAll("\\s+", "");
        Matcher iso = ISO_PREFIX.matcher(compact);
        try {
            if (iso.matches()) {
                return Optional.of(LocalDate.parse(iso.group(1)));
            }
            return Optional.of(LocalDate.parse(compact, DAY_FIRST));
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }

    private Optional<UsagePeriod> period(LocalDate start, LocalDate end) {
        if (end.isBefore(start)) {
            return Optional.empty();
        }
        if (ChronoUnit.DAYS.between(start, end) >= MAX_PERIOD_DAYS) {
            LOGGER.warn("Period {} - {} is longer than {} days; ignoring it", start, end, MAX_PERIOD_DAYS);
            return Optional.empty();
        }
        return Optional.of(new UsagePeriod(start, end));
    }
}
