package dev.pekelund.zuvp.processor;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import org.springframework.util.StringUtils;

/**
 * Configuration values resolved for the permit processing service. Built once at startup and handed to
 * each component explicitly.
 */
public record PermitProcessingSettings(
    BigDecimal ratePerSqmDay,
    int fallbackDurationDays,
    Path dataDirectory,
    Path inboxDirectory,
    Duration extractionTimeout,
    String paymentAccount,
    boolean folderWatchEnabled
) {

    static final BigDecimal DEFAULT_RATE_PER_SQM_DAY = BigDecimal.TEN;
    static final int DEFAULT_FALLBACK_DURATION_DAYS = 7;
    static final String DEFAULT_INBOX_FOLDER = "Zadosti";
    static final long DEFAULT_EXTRACTION_TIMEOUT_SECONDS = 120;
    static final String DEFAULT_PAYMENT_ACCOUNT = "123456789/0100";

    public PermitProcessingSettings {
        Objects.requireNonNull(ratePerSqmDay, "ratePerSqmDay");
        Objects.requireNonNull(dataDirectory, "dataDirectory");
        Objects.requireNonNull(inboxDirectory, "inboxDirectory");
        Objects.requireNonNull(extractionTimeout, "extractionTimeout");
        if (ratePerSqmDay.signum() < 0) {
            throw new IllegalStateException("PERMIT_RATE_PER_SQM_DAY must not be negative");
        }
        if (fallbackDurationDays <= 0) {
            throw new IllegalStateException("PERMIT_FALLBACK_DURATION_DAYS must be positive");
        }
        if (extractionTimeout.isNegative() || extractionTimeout.isZero()) {
            throw new IllegalStateException("PERMIT_EXTRACTION_TIMEOUT_SECONDS must be positive");
        }
    }

    public static PermitProcessingSettings fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    static PermitProcessingSettings fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");

        BigDecimal rate = parseDecimal(env, "PERMIT_RATE_PER_SQM_DAY", DEFAULT_RATE_PER_SQM_DAY);
        int fallbackDays = parseInt(env, "PERMIT_FALLBACK_DURATION_DAYS", DEFAULT_FALLBACK_DURATION_DAYS);
        long timeoutSeconds = parseLong(env, "PERMIT_EXTRACTION_TIMEOUT_SECONDS", DEFAULT_EXTRACTION_TIMEOUT_SECONDS);

        Path dataDirectory = Path.of(firstNonEmpty(env.get("PERMIT_DATA_DIR"), ".")).toAbsolutePath().normalize();
        String inbox = firstNonEmpty(env.get("PERMIT_INBOX_DIR"), DEFAULT_INBOX_FOLDER);
        Path inboxDirectory = dataDirectory.resolve(inbox).normalize();

        String account = firstNonEmpty(env.get("PERMIT_PAYMENT_ACCOUNT"), DEFAULT_PAYMENT_ACCOUNT);
        boolean watchEnabled = Boolean.parseBoolean(env.getOrDefault("PERMIT_FOLDER_WATCH_ENABLED", "false").trim());

        return new PermitProcessingSettings(rate, fallbackDays, dataDirectory, inboxDirectory,
            Duration.ofSeconds(timeoutSeconds), account, watchEnabled);
    }

    public Path uploadsDirectory() {
        return dataDirectory.resolve("uploads");
    }

    public Path draftsDirectory() {
        return dataDirectory.resolve("drafts");
    }

    public Path cacheDirectory() {
        return dataDirectory.resolve("extracted_text_cache");
    }

    public Path outputDirectory() {
        return dataDirectory.resolve("output");
    }

    private static BigDecimal parseDecimal(Map<String, String> env, String name, BigDecimal defaultValue) {
        String value = env.get(name);
        if (!StringUtils.hasText(value)) {
            return defaultValue;
        }
        try {
            return new BigDecimal(value.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalStateException(String.format("%s must be a decimal number but was '%s'", name, value), ex);
        }
    }

    private static int parseInt(Map<String, String> env, String name, int defaultValue) {
        long value = parseLong(env, name, defaultValue);
        try {
            return Math.toIntExact(value);
        } catch (ArithmeticException ex) {
            throw new IllegalStateException(String.format("%s is out of range: %d", name, value), ex);
        }
    }

    private static long parseLong(Map<String, String> env, String name, long defaultValue) {
        String value = env.get(name);
        if (!StringUtils.hasText(value)) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalStateException(String.format("%s must be a whole number but was '%s'", name, value), ex);
        }
    }

    private static String firstNonEmpty(String... values) {
        if (values == null) {
            return null;
        }
        for (String value : values) {
            if (StringUtils.hasText(value)) {
                return value.trim();
            }
        }
        return null;
    }
}
