package com.example.wizardchess.service;

import com.example.wizardchess.config.GameProperties;
import com.example.wizardchess.model.dto.RelayMessage;
import com.example.wizardchess.repository.Room;
import com.example.wizardchess.repository.RoomRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Room-keyed relay. Stores the latest snapshot per room and fans it out to every member,
 * sender included. The snapshot is never interpreted here.
 */
@Slf4j
@Service
public class RoomRelayService {

    private final RoomRepository roomRepository;
    private final ObjectMapper objectMapper;
    private final GameProperties properties;

    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, String> roomBySession = new ConcurrentHashMap<>();

    public RoomRelayService(RoomRepository roomRepository, ObjectMapper objectMapper, GameProperties properties) {
        this.roomRepository = roomRepository;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public void register(WebSocketSession session) {
        sessions.put(session.getId(), session);
        log.debug("Relay session {} connected", session.getId());
    }

    public void handleFrame(WebSocketSession session, String payload) {
        RelayMessage message;
        try {
            message = objectMapper.readValue(payload, RelayMessage.class);
        } catch (JsonProcessingException e) {
            log.warn("Dropping malformed frame from {}: {}", session.getId(), e.getOriginalMessage());
            return;
        }
        String type = message.getType();
        if (RelayMessage.JOIN_ROOM.equals(type)) {
            join(session, message.getPassword());
        } else if (RelayMessage.STATE.equals(type)) {
            String roomKey = roomBySession.get(session.getId());
            if (roomKey == null) {
                log.warn("Session {} sent state without joining a room", session.getId());
                return;
            }
            publish(roomKey, message.getState());
        } else {
            log.warn("Unknown relay message type {} from {}", type, session.getId());
        }
    }

    /**
     * Joins (creating if needed) the room keyed by {@code password}; an empty or missing
     * password means the default room.
     */
    public synchronized void join(WebSocketSession session, String password) {
        String roomKey = password == null ? "" : password;
        sessions.putIfAbsent(session.getId(), session);
        Optional<Room> existing = roomRepository.findByKey(roomKey);
        Room room = existing.orElseGet(() -> new Room(roomKey));
        if (!room.getMemberIds().contains(session.getId())
                && room.getMemberIds().size() >= properties.getRelay().getMaxRoomMembers()) {
            log.warn("Room \"{}\" is full, rejecting {}", roomKey, session.getId());
            send(session, RelayMessage.error("Room is full"));
            return;
        }
        String previous = roomBySession.get(session.getId());
        if (previous != null && !previous.equals(roomKey)) {
            leave(session.getId(), previous);
        }
        if (existing.isEmpty()) {
            log.info("Created room \"{}\"", roomKey);
        }
        room.getMemberIds().add(session.getId());
        roomRepository.save(room);
        roomBySession.put(session.getId(), roomKey);
        log.info("Session {} joined room \"{}\" ({} member(s))", session.getId(), roomKey, room.getMemberIds().size());
        send(session, RelayMessage.roomJoined(roomKey, room.getState()));
    }

    /**
     * Stores {@code state} as the room's latest snapshot and sends it to every member.
     *
     * @return the number of sessions the frame was delivered to
     */
    public int publish(String roomKey, JsonNode state) {
        List<WebSocketSession> targets = new ArrayList<>();
        synchronized (this) {
            Optional<Room> room = roomRepository.findByKey(roomKey);
            if (room.isEmpty()) {
                log.debug("No relay room \"{}\", state not published", roomKey);
                return 0;
            }
            room.get().setState(state);
            for (String memberId : room.get().getMemberIds()) {
                WebSocketSession member = sessions.get(memberId);
                if (member != null) {
                    targets.add(member);
                }
            }
        }
        RelayMessage frame = RelayMessage.state(state);
        int delivered = 0;
        for (WebSocketSession member : targets) {
            if (send(member, frame)) {
                delivered++;
            }
        }
        return delivered;
    }

    public synchronized void disconnect(WebSocketSession session) {
        sessions.remove(session.getId());
        String roomKey = roomBySession.get(session.getId());
        if (roomKey == null) {
            log.debug("Session {} closed without joining a room", session.getId());
            return;
        }
        leave(session.getId(), roomKey);
    }

    public Optional<JsonNode> latestState(String roomKey) {
        return roomRepository.findByKey(roomKey).map(Room::getState);
    }

    public int memberCount(String roomKey) {
        return roomRepository.findByKey(roomKey).map(r -> r.getMemberIds().size()).orElse(0);
    }

    private void leave(String sessionId, String roomKey) {
        roomBySession.remove(sessionId);
        Optional<Room> found = roomRepository.findByKey(roomKey);
        if (found.isEmpty()) {
            return;
        }
        Room room = found.get();
        room.getMemberIds().remove(sessionId);
        log.info("Session {} left room \"{}\", {} left", sessionId, roomKey, room.getMemberIds().size());
        if (room.getMemberIds().isEmpty()) {
            roomRepository.delete(roomKey);
            log.info("Room \"{}\" removed (empty)", roomKey);
        }
    }

    private boolean send(WebSocketSession session, RelayMessage message) {
        if (!session.isOpen()) {
            return false;
        }
        try {
            String json = objectMapper.writeValueAsString(message);
            // WebSocketSession does not allow concurrent sends
            synchronized (session) {
                session.sendMessage(new TextMessage(json));
            }
            return true;
        } catch (IOException e) {
            log.warn("Failed to send {} to {}: {}", message.getType(), session.getId(), e.getMessage());
            return false;
        }
    }
}
