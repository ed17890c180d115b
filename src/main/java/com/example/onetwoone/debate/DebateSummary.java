package com.example.onetwoone.debate;

import java.time.Instant;

/** Row of the public debate browser. */
public record DebateSummary(String code,
                            String title,
                            DebatePhase phase,
                            int totalSegments,
                            int debaters,
                            int viewers,
                            Instant createdAt) {
}
