package com.samsung.ees.infra.sli.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Settings bound from the {@code sli.*} namespace.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "sli")
public class IndicatorValueProperties {

    @Valid
    private final Values values = new Values();

    @Valid
    private final Storage storage = new Storage();

    @Data
    public static class Values {
        /** Smallest magnitude a non-zero compacted value is stored with. */
        @NotNull
        @DecimalMin(value = "0", inclusive = false, message = "min-value must be positive.")
        @Digits(integer = 18, fraction = 3, message = "min-value cannot have more than 3 fractional digits.")
        private BigDecimal minValue = new BigDecimal("0.1");
    }

    @Data
    public static class Storage {
        @NotNull
        private StorageDialect dialect = StorageDialect.H2;

        /** Apply {@code schema/<dialect>.sql} on startup. */
        private boolean initializeSchema = false;

        @Valid
        private final RetrySettings retry = new RetrySettings();
    }

    @Data
    public static class RetrySettings {
        @Min(0)
        private long maxRetries = 3;

        @NotNull
        private Duration minBackoff = Duration.ofMillis(50);

        @NotNull
        private Duration maxBackoff = Duration.ofSeconds(1);
    }
}
