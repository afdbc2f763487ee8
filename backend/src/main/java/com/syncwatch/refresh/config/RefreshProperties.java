package com.syncwatch.refresh.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Refresh job polling, timeout and retention settings. Documented in application.yml.
 */
@ConfigurationProperties(prefix = "syncwatch.refresh")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class RefreshProperties {

    /** Delay before the first probe and until the first backoff step. Default 1s. */
    @NotNull
    private Duration initialInterval = Duration.ofSeconds(1);

    /** Backoff ceiling. Default 5s. */
    @NotNull
    private Duration maxInterval = Duration.ofSeconds(5);

    /** Multiplier applied at each backoff step. Default 1.5. */
    @DecimalMin("1.0")
    private double backoffFactor = 1.5;

    /** Interval grows only after this many consecutive probes. Default 3. */
    @Min(1)
    private int growthEveryChecks = 3;

    /** Wait timeout used when the caller does not supply one. Default 5 min. */
    @NotNull
    private Duration defaultTimeout = Duration.ofMinutes(5);

    /** Terminal jobs older than this are removed from the registry. Default 1h. */
    @NotNull
    private Duration retention = Duration.ofHours(1);

    /** How often (ms) the registry cleanup runs. Default 10 min. */
    @Min(1)
    private long cleanupIntervalMs = 600_000;
}
