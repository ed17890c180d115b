package com.example.onetwoone.debate;

import java.time.Instant;

public record DebateQuestion(String id, String viewerId, String viewerName, String text, Instant submittedAt) { }
