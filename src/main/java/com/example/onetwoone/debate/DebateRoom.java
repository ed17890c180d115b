package com.example.onetwoone.debate;

import com.example.onetwoone.error.ProtocolViolationException;
import com.example.onetwoone.model.ChatMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Two debater slots, any number of viewers, and a forward-only phase machine.
 * DebateService synchronizes all access, so this class itself does not add extra locking.
 */
public class DebateRoom {

    // ---------------------------------------------------------------------
    // Identity
    // ---------------------------------------------------------------------

    private final String code;
    private final String title;
    private final int totalSegments;
    private final Instant createdAt;

    // ---------------------------------------------------------------------
    // Phase machine
    // ---------------------------------------------------------------------

    private DebatePhase phase = DebatePhase.LOBBY;
    private int currentSegment = 0;
    private Speaker speaker = Speaker.DEBATER1;
    private Instant segmentDeadline;
    private Instant qnaDeadline;

    // ---------------------------------------------------------------------
    // Members
    // ---------------------------------------------------------------------

    private DebateSeat debater1;
    private DebateSeat debater2;

    /** Viewer id → name, join order preserved. */
    private final Map<String, String> viewers = new LinkedHashMap<>();

    // ---------------------------------------------------------------------
    // Q&A and chat
    // ---------------------------------------------------------------------

    private final Map<String, Deque<DebateQuestion>> pendingQuestions = new LinkedHashMap<>();
    private final QuestionPicker picker;
    private DebateQuestion currentQuestion;

    private final Deque<ChatMessage> chat = new ArrayDeque<>();

    public DebateRoom(String code, String title, int totalSegments, QuestionPicker picker, Instant now) {
        this.code = Objects.requireNonNull(code, "code");
        this.title = (title == null || title.isBlank()) ? null : title.trim();
        if (totalSegments < 1) throw new IllegalArgumentException("totalSegments must be >= 1");
        this.totalSegments = totalSegments;
        this.picker = Objects.requireNonNull(picker, "picker");
        this.createdAt = Objects.requireNonNull(now, "now");
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public String getCode() { return code; }
    public String getTitle() { return title; }
    public int getTotalSegments() { return totalSegments; }
    public Instant getCreatedAt() { return createdAt; }
    public DebatePhase getPhase() { return phase; }
    public int getCurrentSegment() { return currentSegment; }
    public Speaker getSpeaker() { return speaker; }
    public Instant getSegmentDeadline() { return segmentDeadline; }
    public Instant getQnaDeadline() { return qnaDeadline; }
    public DebateSeat getDebater1() { return debater1; }
    public DebateSeat getDebater2() { return debater2; }
    public DebateQuestion getCurrentQuestion() { return currentQuestion; }

    // ---------------------------------------------------------------------
    // Membership
    // ---------------------------------------------------------------------

    /** Role of the connection, or null when it is not in this room. */
    public DebateRole roleOf(String connectionId) {
        if (connectionId == null) return null;
        if (debater1 != null && debater1.connectionId().equals(connectionId)) return DebateRole.DEBATER1;
        if (debater2 != null && debater2.connectionId().equals(connectionId)) return DebateRole.DEBATER2;
        if (viewers.containsKey(connectionId)) return DebateRole.VIEWER;
        return null;
    }

    public boolean isMember(String connectionId) {
        return roleOf(connectionId) != null;
    }

    public String nameOf(String connectionId) {
        DebateRole role = roleOf(connectionId);
        if (role == null) return null;
        switch (role) {
            case DEBATER1: return debater1.name();
            case DEBATER2: return debater2.name();
            default:       return viewers.get(connectionId);
        }
    }

    /** Debaters first, then viewers in join order. */
    public List<String> members() {
        List<String> out = new ArrayList<>(debaterIds());
        out.addAll(viewers.keySet());
        return out;
    }

    public List<String> debaterIds() {
        List<String> out = new ArrayList<>(2);
        if (debater1 != null) out.add(debater1.connectionId());
        if (debater2 != null) out.add(debater2.connectionId());
        return out;
    }

    public int viewerCount() {
        return viewers.size();
    }

    public boolean bothSeated() {
        return debater1 != null && debater2 != null;
    }

    public boolean isEmpty() {
        return debater1 == null && debater2 == null && viewers.isEmpty();
    }

    /**
     * Seats a debater. {@code preferred == null} takes the first free slot.
     * Slots are first-come and only claimable in the lobby.
     */
    public DebateRole claimSlot(String connectionId, String name, DebateRole preferred) {
        if (phase != DebatePhase.LOBBY) {
            throw new ProtocolViolationException("debate-started", "debater slots are closed once the debate starts");
        }
        if (preferred == DebateRole.VIEWER) {
            throw new IllegalArgumentException("viewer is not a debater slot");
        }
        DebateSeat seat = new DebateSeat(connectionId, name);
        if ((preferred == null || preferred == DebateRole.DEBATER1) && debater1 == null) {
            debater1 = seat;
            return DebateRole.DEBATER1;
        }
        if ((preferred == null || preferred == DebateRole.DEBATER2) && debater2 == null) {
            debater2 = seat;
            return DebateRole.DEBATER2;
        }
        throw new ProtocolViolationException("slot-taken",
                preferred == null ? "both debater slots are taken" : preferred.wire() + " is taken");
    }

    public void addViewer(String connectionId, String name) {
        if (phase == DebatePhase.ENDED) {
            throw new ProtocolViolationException("debate-ended", "debate " + code + " has ended");
        }
        viewers.put(connectionId, name);
    }

    /**
     * Removes a member of any role; a leaving viewer's pending questions go with them.
     * @return the role the connection held, or null when it was not a member
     */
    public DebateRole removeMember(String connectionId) {
        DebateRole role = roleOf(connectionId);
        if (role == null) return null;
        switch (role) {
            case DEBATER1 -> debater1 = null;
            case DEBATER2 -> debater2 = null;
            case VIEWER -> {
                viewers.remove(connectionId);
                pendingQuestions.remove(connectionId);
                picker.forget(connectionId);
            }
        }
        return role;
    }

    // ---------------------------------------------------------------------
    // Phase machine
    // ---------------------------------------------------------------------

    public void start(Instant now, Duration segmentDuration) {
        if (phase != DebatePhase.LOBBY) {
            throw new ProtocolViolationException("bad-phase", "debate can only start from the lobby");
        }
        if (!bothSeated()) {
            throw new ProtocolViolationException("slot-empty", "both debater slots must be filled");
        }
        moveTo(DebatePhase.DEBATE);
        currentSegment = 0;
        speaker = Speaker.forSegment(0);
        segmentDeadline = now.plus(segmentDuration);
    }

    /**
     * Ends the running segment. After the last one the room enters Q&amp;A with both mics open.
     * @return the phase after the advance
     */
    public DebatePhase advanceSegment(Instant now, Duration segmentDuration, Duration qnaDuration) {
        if (phase != DebatePhase.DEBATE) {
            throw new ProtocolViolationException("bad-phase", "segments only advance while debating");
        }
        if (currentSegment + 1 >= totalSegments) {
            moveTo(DebatePhase.QNA);
            speaker = Speaker.BOTH;
            segmentDeadline = null;
            qnaDeadline = now.plus(qnaDuration);
        } else {
            currentSegment++;
            speaker = Speaker.forSegment(currentSegment);
            segmentDeadline = now.plus(segmentDuration);
        }
        return phase;
    }

    public void restartQna(Instant now, Duration qnaDuration) {
        if (phase != DebatePhase.QNA) {
            throw new ProtocolViolationException("bad-phase", "Q&A is not running");
        }
        qnaDeadline = now.plus(qnaDuration);
    }

    /** Idempotent. */
    public void end() {
        if (phase == DebatePhase.ENDED) return;
        moveTo(DebatePhase.ENDED);
        segmentDeadline = null;
        qnaDeadline = null;
        currentQuestion = null;
    }

    public boolean isDeadlinePassed(Instant now) {
        Instant deadline = currentDeadline();
        return deadline != null && !now.isBefore(deadline);
    }

    public Duration remaining(Instant now) {
        Instant deadline = currentDeadline();
        if (deadline == null) return Duration.ZERO;
        Duration d = Duration.between(now, deadline);
        return d.isNegative() ? Duration.ZERO : d;
    }

    private Instant currentDeadline() {
        switch (phase) {
            case DEBATE: return segmentDeadline;
            case QNA:    return qnaDeadline;
            default:     return null;
        }
    }

    private void moveTo(DebatePhase next) {
        if (!phase.canMoveTo(next)) {
            throw new IllegalStateException("phase regression " + phase + " -> " + next + " in " + code);
        }
        phase = next;
    }

    // ---------------------------------------------------------------------
    // Q&A
    // ---------------------------------------------------------------------

    public DebateQuestion addQuestion(String viewerId, String text, Instant now) {
        if (roleOf(viewerId) != DebateRole.VIEWER) {
            throw new ProtocolViolationException("not-a-viewer", "only viewers submit questions");
        }
        if (phase == DebatePhase.ENDED) {
            throw new ProtocolViolationException("debate-ended", "debate " + code + " has ended");
        }
        DebateQuestion q = new DebateQuestion(UUID.randomUUID().toString(), viewerId, viewers.get(viewerId),
                ChatMessage.cleanText(text), now);
        pendingQuestions.computeIfAbsent(viewerId, k -> new ArrayDeque<>()).addLast(q);
        return q;
    }

    public Optional<DebateQuestion> selectNextQuestion(int maxReshuffles) {
        if (phase != DebatePhase.QNA) {
            throw new ProtocolViolationException("bad-phase", "questions are drawn during Q&A only");
        }
        Optional<DebateQuestion> next = picker.next(pendingQuestions, maxReshuffles);
        next.ifPresent(q -> currentQuestion = q);
        return next;
    }

    public void clearCurrentQuestion() {
        currentQuestion = null;
    }

    public int pendingQuestionCount() {
        int n = 0;
        for (Deque<DebateQuestion> q : pendingQuestions.values()) n += q.size();
        return n;
    }

    // ---------------------------------------------------------------------
    // Chat
    // ---------------------------------------------------------------------

    public void addChat(ChatMessage message, int historyLimit) {
        chat.addLast(message);
        while (chat.size() > historyLimit) chat.pollFirst();
    }

    public List<ChatMessage> recentChat() {
        return new ArrayList<>(chat);
    }

    // ---------------------------------------------------------------------
    // Views
    // ---------------------------------------------------------------------

    /** Full state; chat history only on request (join), ticks carry it empty. */
    public DebateSnapshot snapshot(Instant now, boolean withChat) {
        List<DebateSeat> viewerSeats = new ArrayList<>();
        for (Map.Entry<String, String> e : viewers.entrySet()) {
            viewerSeats.add(new DebateSeat(e.getKey(), e.getValue()));
        }
        return new DebateSnapshot(code, title, phase, totalSegments, currentSegment, speaker,
                remaining(now).toSeconds(), debater1, debater2, viewerSeats,
                pendingQuestionCount(), currentQuestion, withChat ? recentChat() : List.of());
    }

    public DebateSummary summary() {
        return new DebateSummary(code, title, phase, totalSegments, debaterIds().size(), viewers.size(), createdAt);
    }
}
