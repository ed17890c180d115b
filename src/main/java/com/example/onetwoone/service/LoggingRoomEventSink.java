package com.example.onetwoone.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Default sink when no persistence-backed implementation is present: logs for traceability. */
public class LoggingRoomEventSink implements RoomEventSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingRoomEventSink.class);

    @Override
    public void roomClosed(RoomClosed event) {
        log.info("Room closed: id={} mode={} reason={} by={} lifetimeMs={}",
                event.roomId(), event.mode(), event.reason(), event.closedBy(),
                event.closedAt().toEpochMilli() - event.createdAt().toEpochMilli());
    }

    @Override
    public void reportFiled(ReportFiled event) {
        log.info("Report filed: id={} room={} reporter={} reported={} reasons={}",
                event.reportId(), event.roomId(), event.reporterId(), event.reportedId(), event.reasons());
    }
}
