package com.example.onetwoone.model;

import java.util.Objects;

/** A live transport session as seen by the session registry. Guarded by the owning service's lock. */
public class Connection {

    public static final String DEFAULT_NAME = "Stranger";
    private static final int MAX_NAME_LENGTH = 80;

    private final String id;
    private String displayName = DEFAULT_NAME;
    private ChatMode requestedMode;      // original request, kept across rematches
    private String roomId;               // null while not paired

    public Connection(String id) {
        this.id = Objects.requireNonNull(id, "id");
    }

    // identity
    public String getId() { return id; }

    public String getDisplayName() { return displayName; }
    public void setDisplayName(String displayName) { this.displayName = normalizeName(displayName); }

    // matchmaking
    public ChatMode getRequestedMode() { return requestedMode; }
    public void setRequestedMode(ChatMode requestedMode) { this.requestedMode = requestedMode; }

    public String getRoomId() { return roomId; }
    public void setRoomId(String roomId) { this.roomId = roomId; }
    public boolean isInRoom() { return roomId != null; }

    public static String normalizeName(String raw) {
        String t = (raw == null) ? "" : raw.trim();
        if (t.isEmpty()) t = DEFAULT_NAME;
        if (t.length() > MAX_NAME_LENGTH) t = t.substring(0, MAX_NAME_LENGTH);
        return t;
    }

    @Override
    public String toString() {
        return "Connection{" +
                "id='" + id + '\'' +
                ", displayName='" + displayName + '\'' +
                ", requestedMode=" + requestedMode +
                ", roomId='" + roomId + '\'' +
                '}';
    }
}
