package com.example.onetwoone.config;

import com.example.onetwoone.model.SkipPolicy;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/** Settings of 1:1 rooms ({@code app.chat.*}). */
@Validated
@ConfigurationProperties(prefix = "app.chat")
public record ChatProperties(
        @NotNull @DefaultValue("60s") Duration segmentDuration,
        @NotNull @DefaultValue("2s") Duration advanceTolerance,
        @NotNull @DefaultValue("AUTHORITY_ONLY") SkipPolicy skipPolicy) {

    public ChatProperties {
        if (segmentDuration != null && (segmentDuration.isZero() || segmentDuration.isNegative())) {
            throw new IllegalArgumentException("app.chat.segment-duration must be positive");
        }
        if (advanceTolerance != null && advanceTolerance.isNegative()) {
            throw new IllegalArgumentException("app.chat.advance-tolerance must not be negative");
        }
    }

    public static ChatProperties defaults() {
        return new ChatProperties(Duration.ofSeconds(60), Duration.ofSeconds(2), SkipPolicy.AUTHORITY_ONLY);
    }
}
