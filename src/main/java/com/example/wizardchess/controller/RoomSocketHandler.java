package com.example.wizardchess.controller;

import com.example.wizardchess.service.RoomRelayService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Raw WebSocket endpoint of the room relay; all protocol handling lives in {@link RoomRelayService}.
 */
@Slf4j
@Component
public class RoomSocketHandler extends TextWebSocketHandler {

    private final RoomRelayService relayService;

    public RoomSocketHandler(RoomRelayService relayService) {
        this.relayService = relayService;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        relayService.register(session);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        relayService.handleFrame(session, message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Transport error on relay session {}: {}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        relayService.disconnect(session);
    }
}
