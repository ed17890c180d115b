package com.example.onetwoone.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A paired 1:1 session. Membership is fixed for the lifetime of the room; only the segment clock moves.
 * ChatService synchronizes all access, so this class itself does not add extra locking.
 */
public class ChatRoom {

    // ---------------------------------------------------------------------
    // Identity & membership
    // ---------------------------------------------------------------------

    private final String id;
    private final ChatMode mode;
    private final String user1;
    private final String user2;
    private final Instant createdAt;

    // ---------------------------------------------------------------------
    // Segment clock
    // ---------------------------------------------------------------------

    private final Duration segmentDuration;
    private int segment = 0;
    private int round = 1;
    private Instant segmentStartedAt;

    /** Bumped on every advance; scheduled timer tasks compare it to detect they went stale. */
    private long generation = 0;

    public ChatRoom(String id, ChatMode mode, String user1, String user2, Duration segmentDuration, Instant now) {
        this.id = Objects.requireNonNull(id, "id");
        this.mode = Objects.requireNonNull(mode, "mode");
        if (!mode.isConcrete()) {
            throw new IllegalArgumentException("room mode must be resolved, got " + mode);
        }
        this.user1 = Objects.requireNonNull(user1, "user1");
        this.user2 = Objects.requireNonNull(user2, "user2");
        if (user1.equals(user2)) {
            throw new IllegalArgumentException("a connection cannot be paired with itself");
        }
        this.segmentDuration = Objects.requireNonNull(segmentDuration, "segmentDuration");
        this.createdAt = Objects.requireNonNull(now, "now");
        this.segmentStartedAt = now;
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public String getId() { return id; }
    public ChatMode getMode() { return mode; }
    public String getUser1() { return user1; }
    public String getUser2() { return user2; }
    public Instant getCreatedAt() { return createdAt; }
    public Duration getSegmentDuration() { return segmentDuration; }
    public int getSegment() { return segment; }
    public int getRound() { return round; }
    public Instant getSegmentStartedAt() { return segmentStartedAt; }
    public long getGeneration() { return generation; }

    public List<String> getMembers() {
        return List.of(user1, user2);
    }

    // ---------------------------------------------------------------------
    // Membership helpers
    // ---------------------------------------------------------------------

    public boolean isMember(String connectionId) {
        return user1.equals(connectionId) || user2.equals(connectionId);
    }

    /** Role of the given connection, or null when it is not a member. */
    public Role roleOf(String connectionId) {
        if (user1.equals(connectionId)) return Role.USER1;
        if (user2.equals(connectionId)) return Role.USER2;
        return null;
    }

    public String memberFor(Role role) {
        return role == Role.USER1 ? user1 : user2;
    }

    /** The other member, or null when the given connection is not in this room. */
    public String peerOf(String connectionId) {
        if (user1.equals(connectionId)) return user2;
        if (user2.equals(connectionId)) return user1;
        return null;
    }

    public Role currentSpeaker() {
        return SegmentTable.speaker(segment);
    }

    // ---------------------------------------------------------------------
    // Segment clock
    // ---------------------------------------------------------------------

    /**
     * Moves to the next segment and restarts its clock.
     * @return true when the round wrapped around (3 → 0)
     */
    public boolean advance(Instant now) {
        segment = SegmentTable.next(segment);
        boolean wrapped = (segment == 0);
        if (wrapped) round++;
        segmentStartedAt = now;
        generation++;
        return wrapped;
    }

    public Duration elapsed(Instant now) {
        Duration d = Duration.between(segmentStartedAt, now);
        return d.isNegative() ? Duration.ZERO : d;
    }

    public Duration remaining(Instant now) {
        Duration left = segmentDuration.minus(elapsed(now));
        return left.isNegative() ? Duration.ZERO : left;
    }

    public RoomSnapshot snapshot(Instant now) {
        return new RoomSnapshot(id, mode, user1, user2, segment, round, segmentStartedAt,
                remaining(now).toSeconds());
    }

    @Override
    public String toString() {
        return "ChatRoom{" +
                "id='" + id + '\'' +
                ", mode=" + mode +
                ", user1='" + user1 + '\'' +
                ", user2='" + user2 + '\'' +
                ", segment=" + segment +
                ", round=" + round +
                '}';
    }
}
