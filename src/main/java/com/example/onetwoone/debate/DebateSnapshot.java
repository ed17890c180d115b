package com.example.onetwoone.debate;

import com.example.onetwoone.model.ChatMessage;

import java.util.List;

/** Full debate state as pushed to clients on every change and every tick. */
public record DebateSnapshot(String code,
                             String title,
                             DebatePhase phase,
                             int totalSegments,
                             int currentSegment,
                             Speaker speaker,
                             long remainingSeconds,
                             DebateSeat debater1,
                             DebateSeat debater2,
                             List<DebateSeat> viewers,
                             int pendingQuestions,
                             DebateQuestion currentQuestion,
                             List<ChatMessage> recentChat) {
}
