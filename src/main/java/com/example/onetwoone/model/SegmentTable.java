package com.example.onetwoone.model;

/**
 * Fixed speaking rights of a 1:1 conversation round.
 *
 * <pre>
 * segment | speaker | listener
 *    0    |  user1  |  user2
 *    1    |  user2  |  user1
 *    2    |  user2  |  user1
 *    3    |  user1  |  user2
 * </pre>
 */
public final class SegmentTable {

    public static final int SEGMENTS_PER_ROUND = 4;

    private static final Role[] SPEAKERS = { Role.USER1, Role.USER2, Role.USER2, Role.USER1 };

    private SegmentTable() { }

    public static Role speaker(int segment) {
        checkSegment(segment);
        return SPEAKERS[segment];
    }

    public static boolean canSpeak(int segment, Role role) {
        if (role == null) return false;
        return speaker(segment) == role;
    }

    public static int next(int segment) {
        checkSegment(segment);
        return (segment + 1) % SEGMENTS_PER_ROUND;
    }

    private static void checkSegment(int segment) {
        if (segment < 0 || segment >= SEGMENTS_PER_ROUND) {
            throw new IllegalArgumentException("segment out of range: " + segment);
        }
    }
}
