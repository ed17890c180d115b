package com.example.onetwoone.service;

import com.example.onetwoone.config.ChatProperties;
import com.example.onetwoone.error.NotFoundException;
import com.example.onetwoone.error.ProtocolViolationException;
import com.example.onetwoone.model.*;
import com.example.onetwoone.service.RoomEventSink.CloseReason;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

import static com.example.onetwoone.service.Outbox.fields;

/**
 * Session store for 1:1 chat: connections, mode queues, paired rooms and their segment clocks.
 * Every mutation runs under one lock; notifications are delivered after the lock is released.
 */
@Service
public class ChatService {

    private static final Logger log = LoggerFactory.getLogger(ChatService.class);

    private static final String ROOM_ID_CHARS = "abcdefghijklmnopqrstuvwxyz0123456789";

    private final ChatProperties props;
    private final ClientGateway gateway;
    private final RoomEventSink sink;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;

    // --- in-memory state, guarded by lock ---
    private final Object lock = new Object();
    private final SessionRegistry sessions = new SessionRegistry();
    private final MatchQueues queues = new MatchQueues();
    private final Map<String, ChatRoom> rooms = new HashMap<>();

    // --- one segment timer per room ---
    private final Map<String, ScheduledFuture<?>> segmentTimers = new ConcurrentHashMap<>();

    public ChatService(ChatProperties props,
                       ClientGateway gateway,
                       RoomEventSink sink,
                       ScheduledExecutorService scheduler,
                       Clock clock) {
        this.props = props;
        this.gateway = gateway;
        this.sink = sink;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    // ========================================================================
    //  CONNECT
    // ========================================================================

    public void connect(String connectionId) {
        Outbox out = new Outbox();
        synchronized (lock) {
            sessions.register(connectionId);
            out.to(connectionId, "connected", fields("connectionId", connectionId));
            pushPresence(out);
            out.flush(gateway);
        }
    }

    public boolean isConnected(String connectionId) {
        synchronized (lock) {
            return sessions.find(connectionId).isPresent();
        }
    }

    // ========================================================================
    //  MATCHMAKING
    // ========================================================================

    /**
     * Pairs the caller with the oldest compatible waiting peer, or queues the caller.
     * @return the new room when a match was made, empty when the caller was queued
     */
    public Optional<RoomSnapshot> requestMatch(String connectionId, ChatMode mode, String displayName) {
        Objects.requireNonNull(mode, "mode");
        Outbox out = new Outbox();
        RoomSnapshot created = null;

        synchronized (lock) {
            Connection me = sessions.require(connectionId);
            if (me.isInRoom()) {
                throw new ProtocolViolationException("already-in-room",
                        "connection is already in room " + me.getRoomId());
            }
            me.setDisplayName(displayName);
            me.setRequestedMode(mode);

            // a connection is never waiting in two queues
            queues.remove(connectionId);

            Instant now = clock.instant();
            Connection peer = claimLivePeer(connectionId, mode);
            if (peer != null) {
                ChatMode peerMode = peer.getRequestedMode() != null ? peer.getRequestedMode() : mode;
                ChatMode resolved = ChatMode.resolve(mode, peerMode);
                ChatRoom room = new ChatRoom(newRoomId(now), resolved, me.getId(), peer.getId(),
                        props.segmentDuration(), now);
                rooms.put(room.getId(), room);
                me.setRoomId(room.getId());
                peer.setRoomId(room.getId());
                scheduleSegmentTimer(room);

                out.to(me.getId(), "match-found", matchFound(room, Role.USER1, peer));
                out.to(peer.getId(), "match-found", matchFound(room, Role.USER2, me));
                log.info("MATCH room={} mode={} user1={} ({}) user2={} ({})",
                        room.getId(), resolved, me.getId(), me.getDisplayName(), peer.getId(), peer.getDisplayName());
                created = room.snapshot(now);
            } else {
                queues.enqueue(new QueueEntry(connectionId, mode, me.getDisplayName(), now));
                out.to(connectionId, "queue-joined", fields("mode", mode.wire()));
                log.info("QUEUED conn={} ({}) mode={}", connectionId, me.getDisplayName(), mode);
            }
            pushPresence(out);
            out.flush(gateway);
        }
        return Optional.ofNullable(created);
    }

    /** Claims entries until one belongs to a still-registered connection. Stale entries are dropped. */
    private Connection claimLivePeer(String requesterId, ChatMode mode) {
        while (true) {
            Optional<QueueEntry> claimed = queues.claim(requesterId, mode);
            if (claimed.isEmpty()) return null;
            Optional<Connection> peer = sessions.find(claimed.get().connectionId());
            if (peer.isPresent() && !peer.get().isInRoom()) return peer.get();
            log.warn("Dropping stale queue entry {}", claimed.get());
        }
    }

    private Map<String, Object> matchFound(ChatRoom room, Role role, Connection peer) {
        return fields(
                "roomId", room.getId(),
                "role", role.wire(),
                "peerId", peer.getId(),
                "peerName", peer.getDisplayName(),
                "resolvedMode", room.getMode().wire(),
                "segment", room.getSegment(),
                "round", room.getRound(),
                "segmentSeconds", room.getSegmentDuration().toSeconds());
    }

    /** Idempotent: leaving while not queued is a no-op. */
    public void leaveQueue(String connectionId) {
        Outbox out = new Outbox();
        synchronized (lock) {
            if (queues.remove(connectionId)) {
                log.info("LEFT QUEUE conn={}", connectionId);
                pushPresence(out);
                out.flush(gateway);
            }
        }
    }

    // ========================================================================
    //  MESSAGES
    // ========================================================================

    public ChatMessage sendMessage(String connectionId, String roomId, String text) {
        Outbox out = new Outbox();
        ChatMessage msg;
        synchronized (lock) {
            Connection me = sessions.require(connectionId);
            ChatRoom room = requireMembership(connectionId, roomId);
            msg = ChatMessage.of(connectionId, me.getDisplayName(), text, clock.millis());
            out.to(room.peerOf(connectionId), "message-received", fields(
                    "id", msg.id(),
                    "senderId", msg.senderId(),
                    "senderName", msg.senderName(),
                    "text", msg.text(),
                    "ts", msg.ts(),
                    "roomId", roomId));
            out.flush(gateway);
        }
        return msg;
    }

    // ========================================================================
    //  SEGMENTS
    // ========================================================================

    /** Authority-driven advance; only accepted once the running segment has (nearly) elapsed. */
    public RoomSnapshot advanceSegment(String connectionId, String roomId) {
        Outbox out = new Outbox();
        RoomSnapshot snap;
        synchronized (lock) {
            ChatRoom room = requireMembership(connectionId, roomId);
            Role role = room.roleOf(connectionId);
            if (!role.isAuthority()) {
                throw new ProtocolViolationException("not-authority", "only user1 drives segment timing");
            }
            Instant now = clock.instant();
            Duration due = room.getSegmentDuration().minus(props.advanceTolerance());
            if (room.elapsed(now).compareTo(due) < 0) {
                throw new ProtocolViolationException("segment-not-elapsed",
                        "segment " + room.getSegment() + " still has " + room.remaining(now).toSeconds() + "s");
            }
            advance(room, connectionId, out);
            snap = room.snapshot(now);
            out.flush(gateway);
        }
        return snap;
    }

    public RoomSnapshot skip(String connectionId, String roomId) {
        Outbox out = new Outbox();
        RoomSnapshot snap;
        synchronized (lock) {
            ChatRoom room = requireMembership(connectionId, roomId);
            Role role = room.roleOf(connectionId);
            if (!props.skipPolicy().allows(room.getSegment(), role)) {
                throw new ProtocolViolationException("skip-not-allowed",
                        role.wire() + " may not skip segment " + room.getSegment() + " under " + props.skipPolicy());
            }
            advance(room, connectionId, out);
            snap = room.snapshot(clock.instant());
            out.flush(gateway);
        }
        return snap;
    }

    /** Caller holds the lock. initiatorId == null means the server timer. */
    private void advance(ChatRoom room, String initiatorId, Outbox out) {
        Instant now = clock.instant();
        boolean wrapped = room.advance(now);
        scheduleSegmentTimer(room);

        Map<String, Object> payload = fields(
                "roomId", room.getId(),
                "segment", room.getSegment(),
                "round", room.getRound(),
                "remainingSeconds", room.remaining(now).toSeconds());
        for (String member : room.getMembers()) {
            if (!member.equals(initiatorId)) out.to(member, "segment-changed", payload);
        }
        log.debug("SEGMENT room={} segment={} round={} wrapped={} by={}",
                room.getId(), room.getSegment(), room.getRound(), wrapped, initiatorId == null ? "timer" : initiatorId);
    }

    private void scheduleSegmentTimer(ChatRoom room) {
        cancelSegmentTimer(room.getId());
        final String roomId = room.getId();
        final long generation = room.getGeneration();
        ScheduledFuture<?> f = scheduler.schedule(() -> onSegmentTimer(roomId, generation),
                room.getSegmentDuration().toMillis(), TimeUnit.MILLISECONDS);
        segmentTimers.put(roomId, f);
    }

    private void cancelSegmentTimer(String roomId) {
        ScheduledFuture<?> f = segmentTimers.remove(roomId);
        if (f != null) f.cancel(false);
    }

    /** Timer callback. No-op when the room is gone or already moved on. */
    void onSegmentTimer(String roomId, long generation) {
        Outbox out = new Outbox();
        try {
            synchronized (lock) {
                ChatRoom room = rooms.get(roomId);
                if (room == null || room.getGeneration() != generation) {
                    log.debug("Stale segment timer ignored (room={}, generation={})", roomId, generation);
                    return;
                }
                advance(room, null, out);
                out.flush(gateway);
            }
        } catch (RuntimeException e) {
            log.error("Segment timer failed (room={})", roomId, e);
        }
    }

    // ========================================================================
    //  LEAVE / REPORT / DISCONNECT
    // ========================================================================

    public void leaveRoom(String connectionId, String roomId) {
        Outbox out = new Outbox();
        List<RoomEventSink.RoomClosed> closed = new ArrayList<>();
        synchronized (lock) {
            ChatRoom room = requireMembership(connectionId, roomId);
            tearDown(room, connectionId, CloseReason.LEFT, out, closed);
            pushPresence(out);
            out.flush(gateway);
        }
        publish(closed, null);
    }

    /**
     * Files a report against the peer and closes the room. The peer is told it was left,
     * never that it was reported.
     * @return the report id
     */
    public String report(String connectionId, String roomId, List<String> reasons, String details) {
        Outbox out = new Outbox();
        List<RoomEventSink.RoomClosed> closed = new ArrayList<>();
        RoomEventSink.ReportFiled report;
        synchronized (lock) {
            ChatRoom room = requireMembership(connectionId, roomId);
            Instant now = clock.instant();
            report = new RoomEventSink.ReportFiled(
                    "RPT-" + now.toEpochMilli(),
                    room.getId(),
                    connectionId,
                    room.peerOf(connectionId),
                    reasons == null ? List.of() : List.copyOf(reasons),
                    details,
                    now);
            tearDown(room, connectionId, CloseReason.REPORTED, out, closed);
            pushPresence(out);
            out.flush(gateway);
        }
        publish(closed, report);
        return report.reportId();
    }

    /** Idempotent; safe to race against an in-flight match for the same connection. */
    public void disconnect(String connectionId) {
        Outbox out = new Outbox();
        List<RoomEventSink.RoomClosed> closed = new ArrayList<>();
        synchronized (lock) {
            boolean dequeued = queues.remove(connectionId);
            Connection gone = sessions.remove(connectionId);
            if (gone == null && !dequeued) return;

            if (gone != null && gone.getRoomId() != null) {
                ChatRoom room = rooms.get(gone.getRoomId());
                if (room != null) tearDown(room, connectionId, CloseReason.DISCONNECTED, out, closed);
            }
            log.info("DISCONNECT conn={}", connectionId);
            pushPresence(out);
            out.flush(gateway);
        }
        publish(closed, null);
    }

    /** Caller holds the lock. Room, timer and both room links go away in one step. */
    private void tearDown(ChatRoom room, String leaverId, CloseReason reason,
                          Outbox out, List<RoomEventSink.RoomClosed> closed) {
        rooms.remove(room.getId());
        cancelSegmentTimer(room.getId());

        sessions.find(leaverId).ifPresent(c -> c.setRoomId(null));

        String peerId = room.peerOf(leaverId);
        Connection peer = sessions.find(peerId).orElse(null);
        if (peer != null) {
            peer.setRoomId(null);
            if (reason == CloseReason.DISCONNECTED) {
                ChatMode resume = peer.getRequestedMode() != null ? peer.getRequestedMode() : room.getMode();
                out.to(peerId, "peer-disconnected", fields("roomId", room.getId(), "resumeMode", resume.wire()));
            } else {
                out.to(peerId, "peer-left", fields("roomId", room.getId()));
            }
        }

        closed.add(new RoomEventSink.RoomClosed(room.getId(), room.getMode(), leaverId, reason,
                room.getCreatedAt(), clock.instant()));
        log.info("ROOM CLOSED room={} reason={} by={} peer={}", room.getId(), reason, leaverId, peerId);
    }

    private void publish(List<RoomEventSink.RoomClosed> closed, RoomEventSink.ReportFiled report) {
        if (report != null) {
            try { sink.reportFiled(report); }
            catch (RuntimeException e) { log.warn("Room event sink failed on report {}: {}", report.reportId(), e.toString()); }
        }
        for (RoomEventSink.RoomClosed c : closed) {
            try { sink.roomClosed(c); }
            catch (RuntimeException e) { log.warn("Room event sink failed on room {}: {}", c.roomId(), e.toString()); }
        }
    }

    // ========================================================================
    //  PRESENCE
    // ========================================================================

    public PresenceCounts presence() {
        synchronized (lock) {
            return computePresence();
        }
    }

    private PresenceCounts computePresence() {
        int video = queues.depth(ChatMode.VIDEO) + queues.depth(ChatMode.ANY);
        int audio = queues.depth(ChatMode.AUDIO);
        int text = queues.depth(ChatMode.TEXT);
        for (ChatRoom r : rooms.values()) {
            int n = r.getMembers().size();
            switch (r.getMode()) {
                case VIDEO -> video += n;
                case AUDIO -> audio += n;
                case TEXT -> text += n;
                default -> { }
            }
        }
        return new PresenceCounts(sessions.size(), video, audio, text);
    }

    private void pushPresence(Outbox out) {
        PresenceCounts c = computePresence();
        out.toAll("presence-counts", fields("total", c.total(), "perMode", c.perMode()));
    }

    // ========================================================================
    //  QUERIES
    // ========================================================================

    public Optional<RoomSnapshot> findRoom(String roomId) {
        synchronized (lock) {
            ChatRoom r = (roomId == null) ? null : rooms.get(roomId);
            return r == null ? Optional.empty() : Optional.of(r.snapshot(clock.instant()));
        }
    }

    public Optional<RoomSnapshot> roomOf(String connectionId) {
        synchronized (lock) {
            return sessions.find(connectionId)
                    .map(Connection::getRoomId)
                    .map(rooms::get)
                    .map(r -> r.snapshot(clock.instant()));
        }
    }

    /** Members of a live room, empty when unknown. */
    public List<String> members(String roomId) {
        synchronized (lock) {
            ChatRoom r = (roomId == null) ? null : rooms.get(roomId);
            return r == null ? List.of() : r.getMembers();
        }
    }

    public Optional<ChatMode> queuedMode(String connectionId) {
        synchronized (lock) {
            return queues.modeOf(connectionId);
        }
    }

    public Optional<String> displayName(String connectionId) {
        synchronized (lock) {
            return sessions.find(connectionId).map(Connection::getDisplayName);
        }
    }

    int activeTimers() {
        return segmentTimers.size();
    }

    // ========================================================================
    //  HELPERS
    // ========================================================================

    /** Caller holds the lock. */
    private ChatRoom requireMembership(String connectionId, String roomId) {
        ChatRoom room = (roomId == null) ? null : rooms.get(roomId);
        if (room == null) throw new NotFoundException("room", roomId);
        if (!room.isMember(connectionId)) {
            throw new ProtocolViolationException("not-a-member", "connection is not a member of " + roomId);
        }
        return room;
    }

    private static String newRoomId(Instant now) {
        ThreadLocalRandom rnd = ThreadLocalRandom.current();
        StringBuilder sb = new StringBuilder("room_").append(now.toEpochMilli()).append('_');
        for (int i = 0; i < 9; i++) sb.append(ROOM_ID_CHARS.charAt(rnd.nextInt(ROOM_ID_CHARS.length())));
        return sb.toString();
    }

    @PreDestroy
    public void shutdown() {
        for (String roomId : new ArrayList<>(segmentTimers.keySet())) cancelSegmentTimer(roomId);
    }
}
