package com.example.onetwoone.service;

import com.example.onetwoone.error.ProtocolViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;

import static com.example.onetwoone.service.Outbox.fields;

/**
 * Forwards opaque WebRTC negotiation payloads between members of a 1:1 room or a debate.
 * Membership is always checked against the owning store at relay time, so a connection that
 * has left its room stops receiving signals even if it never said goodbye here.
 */
@Service
public class SignalingRelay {

    private static final Logger log = LoggerFactory.getLogger(SignalingRelay.class);

    private final ChatService chat;
    private final DebateService debates;
    private final ClientGateway gateway;

    private final Object lock = new Object();
    /** room id or debate code -> joined connection ids, join order */
    private final Map<String, Set<String>> joined = new HashMap<>();

    public SignalingRelay(ChatService chat, DebateService debates, ClientGateway gateway) {
        this.chat = chat;
        this.debates = debates;
        this.gateway = gateway;
    }

    /** Registers the connection as a signaling member of a room it already belongs to. */
    public void join(String connectionId, String roomId) {
        requireMember(connectionId, roomId);
        synchronized (lock) {
            joined.computeIfAbsent(roomId, k -> new LinkedHashSet<>()).add(connectionId);
        }
        log.debug("SIGNAL JOIN room={} conn={}", roomId, connectionId);
    }

    /**
     * Delivers {@code payload} to {@code target} when given, otherwise to every other joined member.
     * @return the connection ids the signal went to
     */
    public List<String> relay(String fromId, SignalKind kind, String roomId, String target, Object payload) {
        List<String> members = requireMember(fromId, roomId);
        List<String> recipients = new ArrayList<>();
        if (target != null && !target.isBlank()) {
            if (target.equals(fromId) || !members.contains(target)) {
                throw new ProtocolViolationException("bad-target", "target is not another member of " + roomId);
            }
            recipients.add(target);
        } else {
            synchronized (lock) {
                Set<String> set = joined.getOrDefault(roomId, Set.of());
                for (String id : set) {
                    if (!id.equals(fromId) && members.contains(id)) recipients.add(id);
                }
            }
        }

        Map<String, Object> body = fields("fromId", fromId, "roomId", roomId, "payload", payload);
        for (String to : recipients) gateway.send(to, kind.outbound(), body);
        log.debug("SIGNAL {} room={} from={} to={}", kind, roomId, fromId, recipients);
        return recipients;
    }

    /** Drops the connection from every room; called on close. */
    public void forget(String connectionId) {
        synchronized (lock) {
            Iterator<Map.Entry<String, Set<String>>> it = joined.entrySet().iterator();
            while (it.hasNext()) {
                Set<String> set = it.next().getValue();
                set.remove(connectionId);
                if (set.isEmpty()) it.remove();
            }
        }
    }

    /** Joined members of a room (for diagnostics and tests). */
    public Set<String> joinedMembers(String roomId) {
        synchronized (lock) {
            return Set.copyOf(joined.getOrDefault(roomId, Set.of()));
        }
    }

    private List<String> requireMember(String connectionId, String roomId) {
        if (roomId == null || roomId.isBlank()) {
            throw new ProtocolViolationException("bad-request", "roomId is required");
        }
        List<String> members = chat.members(roomId);
        if (members.isEmpty()) members = debates.members(roomId);
        if (members.isEmpty()) {
            // room or debate is gone; drop its signaling members
            synchronized (lock) {
                joined.remove(roomId);
            }
        }
        if (!members.contains(connectionId)) {
            throw new ProtocolViolationException("not-a-member", "connection is not in " + roomId);
        }
        return members;
    }
}
