package com.example.onetwoone.model;

import java.util.LinkedHashMap;
import java.util.Map;

/** Live counters for display. Wildcard queue entries are counted as video. */
public record PresenceCounts(int total, int video, int audio, int text) {

    public Map<String, Integer> perMode() {
        Map<String, Integer> m = new LinkedHashMap<>();
        m.put(ChatMode.VIDEO.wire(), video);
        m.put(ChatMode.AUDIO.wire(), audio);
        m.put(ChatMode.TEXT.wire(), text);
        return m;
    }
}
