package com.example.onetwoone.debate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

/**
 * Draws Q&amp;A questions by shuffled round-robin over viewers rather than over questions:
 * every pass through the shuffled viewer order takes at most one question per viewer,
 * so a single chatty viewer cannot dominate. Not thread-safe; owned by one {@link DebateRoom}.
 */
public class QuestionPicker {

    private final Random random;
    private List<String> order = new ArrayList<>();
    private int cursor = 0;

    public QuestionPicker(Random random) {
        this.random = random;
    }

    /**
     * Removes and returns the next question.
     *
     * @param pending     viewer id → that viewer's pending questions (oldest first); mutated on success
     * @param maxReshuffles upper bound on reshuffles, guards against inconsistent input
     */
    public Optional<DebateQuestion> next(Map<String, Deque<DebateQuestion>> pending, int maxReshuffles) {
        for (int reshuffles = 0; ; reshuffles++) {
            while (cursor < order.size()) {
                String viewer = order.get(cursor++);
                Deque<DebateQuestion> q = pending.get(viewer);
                if (q != null && !q.isEmpty()) {
                    DebateQuestion picked = q.pollFirst();
                    if (q.isEmpty()) pending.remove(viewer);
                    return Optional.ofNullable(picked);
                }
            }
            if (reshuffles >= maxReshuffles || !hasAny(pending)) {
                return Optional.empty();
            }
            reshuffle(pending);
        }
    }

    /** Viewer order of the current pass (for diagnostics and tests). */
    public List<String> currentOrder() {
        return Collections.unmodifiableList(order);
    }

    /** Drops a viewer from the running pass, e.g. when they leave. */
    public void forget(String viewerId) {
        int idx = order.indexOf(viewerId);
        if (idx < 0) return;
        order.remove(idx);
        if (idx < cursor) cursor--;
    }

    private void reshuffle(Map<String, Deque<DebateQuestion>> pending) {
        List<String> viewers = new ArrayList<>();
        for (Map.Entry<String, Deque<DebateQuestion>> e : pending.entrySet()) {
            if (e.getValue() != null && !e.getValue().isEmpty()) viewers.add(e.getKey());
        }
        Collections.shuffle(viewers, random);
        order = viewers;
        cursor = 0;
    }

    private static boolean hasAny(Map<String, Deque<DebateQuestion>> pending) {
        for (Deque<DebateQuestion> q : pending.values()) {
            if (q != null && !q.isEmpty()) return true;
        }
        return false;
    }
}
