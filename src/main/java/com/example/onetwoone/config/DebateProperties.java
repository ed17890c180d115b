package com.example.onetwoone.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/** Settings of debate rooms ({@code app.debate.*}). */
@Validated
@ConfigurationProperties(prefix = "app.debate")
public record DebateProperties(
        @NotNull @DefaultValue("120s") Duration segmentDuration,
        @NotNull @DefaultValue("600s") Duration qnaDuration,
        @NotNull @DefaultValue("1s") Duration tickInterval,
        @Min(1) @DefaultValue("1") int minSegments,
        @Min(1) @DefaultValue("20") int maxSegments,
        @Min(1) @DefaultValue("6") int defaultSegments,
        @Min(1) @DefaultValue("3") int maxDrawAttempts,
        @Min(0) @DefaultValue("200") int chatHistory) {

    public DebateProperties {
        if (minSegments > maxSegments) {
            throw new IllegalArgumentException("app.debate.min-segments must not exceed max-segments");
        }
        if (defaultSegments < minSegments || defaultSegments > maxSegments) {
            throw new IllegalArgumentException("app.debate.default-segments must lie within min/max");
        }
    }

    public static DebateProperties defaults() {
        return new DebateProperties(Duration.ofSeconds(120), Duration.ofSeconds(600), Duration.ofSeconds(1),
                1, 20, 6, 3, 200);
    }
}
