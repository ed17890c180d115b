package com.example.onetwoone.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class SegmentTableTest {

    @ParameterizedTest(name = "segment {0}: {1} speaks={2}")
    @CsvSource({
            "0, USER1, true",  "0, USER2, false",
            "1, USER1, false", "1, USER2, true",
            "2, USER1, false", "2, USER2, true",
            "3, USER1, true",  "3, USER2, false"
    })
    void speakingRights(int segment, Role role, boolean expected) {
        assertEquals(expected, SegmentTable.canSpeak(segment, role));
    }

    @Test
    void nextWrapsAfterLastSegment() {
        assertEquals(1, SegmentTable.next(0));
        assertEquals(3, SegmentTable.next(2));
        assertEquals(0, SegmentTable.next(3));
    }

    @Test
    void outOfRangeSegmentIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> SegmentTable.speaker(4));
        assertThrows(IllegalArgumentException.class, () -> SegmentTable.next(-1));
        assertFalse(SegmentTable.canSpeak(0, null));
    }
}
