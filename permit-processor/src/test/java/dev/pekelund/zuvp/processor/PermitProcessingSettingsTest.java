package dev.pekelund.zuvp.processor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PermitProcessingSettingsTest {

    @Test
    void fromEnvironmentAppliesDefaults() {
        PermitProcessingSettings settings = PermitProcessingSettings.fromEnvironment(Map.of());

        assertThat(settings.ratePerSqmDay()).isEqualByComparingTo(BigDecimal.TEN);
        assertThat(settings.fallbackDurationDays()).isEqualTo(7);
        assertThat(settings.extractionTimeout()).isEqualTo(Duration.ofSeconds(120));
        assertThat(settings.paymentAccount()).isEqualTo("123456789/0100");
        assertThat(settings.folderWatchEnabled()).isFalse();
        assertThat(settings.inboxDirectory()).isEqualTo(settings.dataDirectory().resolve("Zadosti"));
    }

    @Test
    void fromEnvironmentUsesExplicitValues() {
        Map<String, String> env = new HashMap<>();
        env.put("PERMIT_RATE_PER_SQM_DAY", "12.50");
        env.put("PERMIT_FALLBACK_DURATION_DAYS", "30");
        env.put("PERMIT_DATA_DIR", "/var/lib/zuvp");
        env.put("PERMIT_INBOX_DIR", "inbox");
        env.put("PERMIT_EXTRACTION_TIMEOUT_SECONDS", "45");
        env.put("PERMIT_PAYMENT_ACCOUNT", "19-2000145399/0800");
        env.put("PERMIT_FOLDER_WATCH_ENABLED", "true");

        PermitProcessingSettings settings = PermitProcessingSettings.fromEnvironment(env);

        assertThat(settings.ratePerSqmDay()).isEqualByComparingTo("12.5");
        assertThat(settings.fallbackDurationDays()).isEqualTo(30);
        assertThat(settings.dataDirectory()).isEqualTo(Path.of("/var/lib/zuvp"));
        assertThat(settings.inboxDirectory()).isEqualTo(Path.of("/var/lib/zuvp/inbox"));
        assertThat(settings.draftsDirectory()).isEqualTo(Path.of("/var/lib/zuvp/drafts"));
        assertThat(settings.cacheDirectory()).isEqualTo(Path.of("/var/lib/zuvp/extracted_text_cache"));
        assertThat(settings.extractionTimeout()).isEqualTo(Duration.ofSeconds(45));
        assertThat(settings.paymentAccount()).isEqualTo("19-2000145399/0800");
        assertThat(settings.folderWatchEnabled()).isTrue();
    }

    @Test
    void fromEnvironmentThrowsWhenRateIsNotNumeric() {
        assertThatThrownBy(() -> PermitProcessingSettings.fromEnvironment(Map.of("PERMIT_RATE_PER_SQM_DAY", "ten")))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("PERMIT_RATE_PER_SQM_DAY");
    }

    @Test
    void fromEnvironmentThrowsWhenRateIsNegative() {
        assertThatThrownBy(() -> PermitProcessingSettings.fromEnvironment(Map.of("PERMIT_RATE_PER_SQM_DAY", "-1")))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("must not be negative");
    }

    @Test
    void fromEnvironmentThrowsWhenTimeoutIsNotPositive() {
        assertThatThrownBy(() -> PermitProcessingSettings.fromEnvironment(
            Map.of("PERMIT_EXTRACTION_TIMEOUT_SECONDS", "0")))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("PERMIT_EXTRACTION_TIMEOUT_SECONDS");
    }

    @Test
    void fromEnvironmentThrowsWhenFallbackDurationIsNotPositive() {
        assertThatThrownBy(() -> PermitProcessingSettings.fromEnvironment(
            Map.of("PERMIT_FALLBACK_DURATION_DAYS", "0")))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("PERMIT_FALLBACK_DURATION_DAYS must be positive");
        assertThatThrownBy(() -> PermitProcessingSettings.fromEnvironment(
            Map.of("PERMIT_FALLBACK_DURATION_DAYS", "-3")))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("must be positive");
    }

    @Test
    void fromEnvironmentThrowsWhenFallbackDurationDoesNotFitAnInt() {
        // 2^32 + 7 would silently become 7 if narrowed with a cast.
        assertThatThrownBy(() -> PermitProcessingSettings.fromEnvironment(
            Map.of("PERMIT_FALLBACK_DURATION_DAYS", "4294967303")))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("PERMIT_FALLBACK_DURATION_DAYS is out of range")
            .hasCauseInstanceOf(ArithmeticException.class);
    }
}
