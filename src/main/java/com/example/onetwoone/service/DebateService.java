package com.example.onetwoone.service;

import com.example.onetwoone.config.DebateProperties;
import com.example.onetwoone.debate.*;
import com.example.onetwoone.error.NotFoundException;
import com.example.onetwoone.error.ProtocolViolationException;
import com.example.onetwoone.model.ChatMessage;
import com.example.onetwoone.model.Connection;
import com.example.onetwoone.service.RoomEventSink.CloseReason;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static com.example.onetwoone.service.Outbox.fields;

/**
 * Debate rooms: two debaters, N viewers, server-driven segment clock and Q&amp;A draw.
 * Own lock, independent of the 1:1 session store; one fixed-rate ticker per running debate.
 */
@Service
public class DebateService {

    private static final Logger log = LoggerFactory.getLogger(DebateService.class);

    private static final String CODE_CHARS = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";
    private static final int CODE_LENGTH = 8;
    private static final int BROWSE_LIMIT = 50;

    private final DebateProperties props;
    private final ClientGateway gateway;
    private final RoomEventSink sink;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final Random random;

    // --- in-memory state, guarded by lock ---
    private final Object lock = new Object();
    private final Map<String, DebateRoom> debates = new LinkedHashMap<>();
    private final Map<String, String> membership = new HashMap<>(); // connection id -> debate code

    private final Map<String, ScheduledFuture<?>> tickers = new ConcurrentHashMap<>();

    public DebateService(DebateProperties props,
                         ClientGateway gateway,
                         RoomEventSink sink,
                         ScheduledExecutorService scheduler,
                         Clock clock,
                         Random debateRandom) {
        this.props = props;
        this.gateway = gateway;
        this.sink = sink;
        this.scheduler = scheduler;
        this.clock = clock;
        this.random = debateRandom;
    }

    // ========================================================================
    //  CREATE / JOIN
    // ========================================================================

    /** Creates a debate with the caller seated as debater1. Null segment count means the default. */
    public DebateSnapshot create(String connectionId, String name, Integer segmentCount, String title) {
        int segments = (segmentCount == null) ? props.defaultSegments() : segmentCount;
        if (segments < props.minSegments() || segments > props.maxSegments()) {
            throw new ProtocolViolationException("bad-segment-count",
                    "segment count must be between " + props.minSegments() + " and " + props.maxSegments());
        }
        Outbox out = new Outbox();
        DebateSnapshot snap;
        synchronized (lock) {
            requireNotInDebate(connectionId);
            Instant now = clock.instant();
            DebateRoom room = new DebateRoom(newCode(), title, segments, new QuestionPicker(random), now);
            room.claimSlot(connectionId, Connection.normalizeName(name), DebateRole.DEBATER1);
            debates.put(room.getCode(), room);
            membership.put(connectionId, room.getCode());

            snap = room.snapshot(now, true);
            out.to(connectionId, "debate-created", fields("code", room.getCode()));
            out.to(connectionId, "debate-joined", fields("code", room.getCode(),
                    "role", DebateRole.DEBATER1.wire(), "state", snap));
            log.info("DEBATE CREATED code={} segments={} by={}", room.getCode(), segments, connectionId);
            out.flush(gateway);
        }
        return snap;
    }

    /**
     * Joins as viewer or debater. {@code role} is {@code viewer}, {@code debater} (first free slot),
     * {@code debater1} or {@code debater2}.
     */
    public DebateRole join(String connectionId, String code, String role, String name) {
        DebateRole requested = DebateRole.fromJoinRequest(role);
        String cleanName = Connection.normalizeName(name);
        Outbox out = new Outbox();
        DebateRole granted;
        synchronized (lock) {
            DebateRoom room = require(code);
            if (room.getPhase() == DebatePhase.ENDED) {
                throw new ProtocolViolationException("debate-ended", "debate " + code + " has ended");
            }
            requireNotInDebate(connectionId);

            if (requested == DebateRole.VIEWER) {
                room.addViewer(connectionId, cleanName);
                granted = DebateRole.VIEWER;
                for (String debater : room.debaterIds()) {
                    out.to(debater, "viewer-joined", fields("code", code, "viewerId", connectionId, "name", cleanName));
                }
            } else {
                granted = room.claimSlot(connectionId, cleanName, requested);
            }
            membership.put(connectionId, code);

            Instant now = clock.instant();
            out.to(connectionId, "debate-joined", fields("code", code, "role", granted.wire(),
                    "state", room.snapshot(now, true)));
            pushState(room, out);
            log.info("DEBATE JOIN code={} conn={} role={}", code, connectionId, granted);
            out.flush(gateway);
        }
        return granted;
    }

    // ========================================================================
    //  PHASES
    // ========================================================================

    public DebateSnapshot start(String connectionId, String code) {
        Outbox out = new Outbox();
        DebateSnapshot snap;
        synchronized (lock) {
            DebateRoom room = require(code);
            requireDebater(room, connectionId);
            Instant now = clock.instant();
            room.start(now, props.segmentDuration());
            startTicker(code);
            pushState(room, out);
            snap = room.snapshot(now, false);
            log.info("DEBATE STARTED code={} by={}", code, connectionId);
            out.flush(gateway);
        }
        return snap;
    }

    /** Debater ends the running segment early; during Q&amp;A the countdown restarts. */
    public DebateSnapshot advance(String connectionId, String code) {
        Outbox out = new Outbox();
        DebateSnapshot snap;
        synchronized (lock) {
            DebateRoom room = require(code);
            requireDebater(room, connectionId);
            Instant now = clock.instant();
            switch (room.getPhase()) {
                case DEBATE -> advanceSegment(room, now);
                case QNA -> room.restartQna(now, props.qnaDuration());
                default -> throw new ProtocolViolationException("bad-phase",
                        "cannot advance a debate in phase " + room.getPhase().wire());
            }
            pushState(room, out);
            snap = room.snapshot(now, false);
            out.flush(gateway);
        }
        return snap;
    }

    /** Caller holds the lock. */
    private void advanceSegment(DebateRoom room, Instant now) {
        DebatePhase after = room.advanceSegment(now, props.segmentDuration(), props.qnaDuration());
        if (after == DebatePhase.QNA) {
            log.info("DEBATE QNA code={} qnaSeconds={}", room.getCode(), props.qnaDuration().toSeconds());
        } else {
            log.debug("DEBATE SEGMENT code={} segment={} speaker={}",
                    room.getCode(), room.getCurrentSegment(), room.getSpeaker());
        }
    }

    /** Ticker callback: recompute deadlines and push the full state. No-op for gone or idle rooms. */
    public void tick(String code) {
        Outbox out = new Outbox();
        List<RoomEventSink.RoomClosed> closed = new ArrayList<>();
        try {
            synchronized (lock) {
                DebateRoom room = debates.get(code);
                if (room == null || !room.getPhase().isRunning()) {
                    cancelTicker(code);
                    return;
                }
                Instant now = clock.instant();
                if (room.isDeadlinePassed(now)) {
                    if (room.getPhase() == DebatePhase.DEBATE) {
                        advanceSegment(room, now);
                    } else {
                        endDebate(room, "qna-finished", null, out, closed);
                    }
                }
                if (room.getPhase().isRunning()) pushState(room, out);
                out.flush(gateway);
            }
            publish(closed);
        } catch (RuntimeException e) {
            log.error("Debate tick failed (code={})", code, e);
        }
    }

    // ========================================================================
    //  CHAT / QUESTIONS
    // ========================================================================

    public ChatMessage chat(String connectionId, String code, String text) {
        Outbox out = new Outbox();
        ChatMessage msg;
        synchronized (lock) {
            DebateRoom room = require(code);
            requireMember(room, connectionId);
            requireNotEnded(room);
            msg = ChatMessage.of(connectionId, room.nameOf(connectionId), text, clock.millis());
            room.addChat(msg, props.chatHistory());
            Map<String, Object> payload = fields("code", code, "message", msg);
            for (String member : room.members()) out.to(member, "debate-chat", payload);
            out.flush(gateway);
        }
        return msg;
    }

    public DebateQuestion submitQuestion(String connectionId, String code, String text) {
        Outbox out = new Outbox();
        DebateQuestion q;
        synchronized (lock) {
            DebateRoom room = require(code);
            requireMember(room, connectionId);
            q = room.addQuestion(connectionId, text, clock.instant());
            pushState(room, out);
            log.debug("DEBATE QUESTION code={} from={} pending={}", code, connectionId, room.pendingQuestionCount());
            out.flush(gateway);
        }
        return q;
    }

    /** Draws the next question (debaters, Q&amp;A only). Empty when nothing is pending. */
    public Optional<DebateQuestion> nextQuestion(String connectionId, String code) {
        Outbox out = new Outbox();
        Optional<DebateQuestion> picked;
        synchronized (lock) {
            DebateRoom room = require(code);
            requireDebater(room, connectionId);
            picked = room.selectNextQuestion(props.maxDrawAttempts());
            pushState(room, out);
            out.flush(gateway);
        }
        return picked;
    }

    public void markAnswered(String connectionId, String code) {
        Outbox out = new Outbox();
        synchronized (lock) {
            DebateRoom room = require(code);
            requireDebater(room, connectionId);
            room.clearCurrentQuestion();
            pushState(room, out);
            out.flush(gateway);
        }
    }

    // ========================================================================
    //  LEAVE / DISCONNECT
    // ========================================================================

    public void leave(String connectionId, String code) {
        Outbox out = new Outbox();
        List<RoomEventSink.RoomClosed> closed = new ArrayList<>();
        synchronized (lock) {
            DebateRoom room = require(code);
            requireMember(room, connectionId);
            removeMember(room, connectionId, out, closed);
            out.flush(gateway);
        }
        publish(closed);
    }

    /** Idempotent. */
    public void disconnect(String connectionId) {
        Outbox out = new Outbox();
        List<RoomEventSink.RoomClosed> closed = new ArrayList<>();
        synchronized (lock) {
            String code = membership.get(connectionId);
            if (code == null) return;
            DebateRoom room = debates.get(code);
            if (room == null) {
                membership.remove(connectionId);
                return;
            }
            removeMember(room, connectionId, out, closed);
            out.flush(gateway);
        }
        publish(closed);
    }

    /** Caller holds the lock. Losing a debater mid-session ends it for everyone. */
    private void removeMember(DebateRoom room, String connectionId, Outbox out,
                              List<RoomEventSink.RoomClosed> closed) {
        DebateRole role = room.removeMember(connectionId);
        membership.remove(connectionId);
        log.info("DEBATE LEAVE code={} conn={} role={}", room.getCode(), connectionId, role);

        if (role != null && role.isDebater() && room.getPhase().isRunning()) {
            endDebate(room, "debater-left", connectionId, out, closed);
        }
        if (room.isEmpty()) {
            debates.remove(room.getCode());
            cancelTicker(room.getCode());
            if (closed.isEmpty()) {
                closed.add(new RoomEventSink.RoomClosed(room.getCode(), null, connectionId,
                        CloseReason.DEBATE_ENDED, room.getCreatedAt(), clock.instant()));
            }
            log.info("DEBATE DESTROYED code={}", room.getCode());
        } else {
            pushState(room, out);
        }
    }

    /** Caller holds the lock. */
    private void endDebate(DebateRoom room, String reason, String by, Outbox out,
                           List<RoomEventSink.RoomClosed> closed) {
        if (room.getPhase() == DebatePhase.ENDED) return;
        room.end();
        cancelTicker(room.getCode());
        Map<String, Object> payload = fields("code", room.getCode(), "reason", reason);
        for (String member : room.members()) out.to(member, "debate-ended", payload);
        pushState(room, out);
        closed.add(new RoomEventSink.RoomClosed(room.getCode(), null, by, CloseReason.DEBATE_ENDED,
                room.getCreatedAt(), clock.instant()));
        log.info("DEBATE ENDED code={} reason={}", room.getCode(), reason);
    }

    // ========================================================================
    //  QUERIES
    // ========================================================================

    public Optional<DebateSnapshot> find(String code) {
        synchronized (lock) {
            DebateRoom room = (code == null) ? null : debates.get(code);
            return room == null ? Optional.empty() : Optional.of(room.snapshot(clock.instant(), false));
        }
    }

    /** Members of a debate, empty when unknown. */
    public List<String> members(String code) {
        synchronized (lock) {
            DebateRoom room = (code == null) ? null : debates.get(code);
            return room == null ? List.of() : room.members();
        }
    }

    public Optional<String> debateOf(String connectionId) {
        synchronized (lock) {
            return Optional.ofNullable(membership.get(connectionId));
        }
    }

    /** Debates that are not over, newest first, optionally filtered by title or code. */
    public List<DebateSummary> openDebates(String query) {
        String q = (query == null) ? "" : query.trim().toLowerCase(Locale.ROOT);
        List<DebateSummary> out = new ArrayList<>();
        synchronized (lock) {
            for (DebateRoom room : debates.values()) {
                if (room.getPhase() == DebatePhase.ENDED) continue;
                if (!q.isEmpty() && !matches(room, q)) continue;
                out.add(room.summary());
            }
        }
        out.sort(Comparator.comparing(DebateSummary::createdAt).reversed());
        return out.size() > BROWSE_LIMIT ? new ArrayList<>(out.subList(0, BROWSE_LIMIT)) : out;
    }

    private static boolean matches(DebateRoom room, String q) {
        if (room.getCode().toLowerCase(Locale.ROOT).contains(q.replace("-", ""))) return true;
        return room.getTitle() != null && room.getTitle().toLowerCase(Locale.ROOT).contains(q);
    }

    int activeTickers() {
        return tickers.size();
    }

    // ========================================================================
    //  HELPERS
    // ========================================================================

    private void pushState(DebateRoom room, Outbox out) {
        DebateSnapshot snap = room.snapshot(clock.instant(), false);
        Map<String, Object> payload = fields("code", room.getCode(), "state", snap);
        for (String member : room.members()) out.to(member, "debate-state", payload);
    }

    private void startTicker(String code) {
        cancelTicker(code);
        long every = props.tickInterval().toMillis();
        ScheduledFuture<?> f = scheduler.scheduleAtFixedRate(() -> tick(code), every, every, TimeUnit.MILLISECONDS);
        tickers.put(code, f);
    }

    private void cancelTicker(String code) {
        ScheduledFuture<?> f = tickers.remove(code);
        if (f != null) f.cancel(false);
    }

    private void publish(List<RoomEventSink.RoomClosed> closed) {
        for (RoomEventSink.RoomClosed c : closed) {
            try { sink.roomClosed(c); }
            catch (RuntimeException e) { log.warn("Room event sink failed on debate {}: {}", c.roomId(), e.toString()); }
        }
    }

    private DebateRoom require(String code) {
        DebateRoom room = (code == null) ? null : debates.get(code);
        if (room == null) throw new NotFoundException("debate", code);
        return room;
    }

    private void requireNotInDebate(String connectionId) {
        String current = membership.get(connectionId);
        if (current != null) {
            throw new ProtocolViolationException("already-in-debate", "connection is already in debate " + current);
        }
    }

    private static void requireMember(DebateRoom room, String connectionId) {
        if (!room.isMember(connectionId)) {
            throw new ProtocolViolationException("not-a-member", "connection is not in debate " + room.getCode());
        }
    }

    private static void requireDebater(DebateRoom room, String connectionId) {
        DebateRole role = room.roleOf(connectionId);
        if (role == null || !role.isDebater()) {
            throw new ProtocolViolationException("not-a-debater", "only seated debaters may do that");
        }
    }

    private static void requireNotEnded(DebateRoom room) {
        if (room.getPhase() == DebatePhase.ENDED) {
            throw new ProtocolViolationException("debate-ended", "debate " + room.getCode() + " has ended");
        }
    }

    /** Caller holds the lock. */
    private String newCode() {
        while (true) {
            StringBuilder sb = new StringBuilder(CODE_LENGTH);
            for (int i = 0; i < CODE_LENGTH; i++) sb.append(CODE_CHARS.charAt(random.nextInt(CODE_CHARS.length())));
            String code = sb.toString();
            if (!debates.containsKey(code)) return code;
        }
    }

    @PreDestroy
    public void shutdown() {
        for (String code : new ArrayList<>(tickers.keySet())) cancelTicker(code);
    }
}
