package com.example.wizardchess.config;

import com.example.wizardchess.controller.RoomSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final RoomSocketHandler roomSocketHandler;
    private final GameProperties properties;

    public WebSocketConfig(RoomSocketHandler roomSocketHandler, GameProperties properties) {
        this.roomSocketHandler = roomSocketHandler;
        this.properties = properties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        // plain JSON frames, no STOMP: clients speak the relay protocol directly
        registry.addHandler(roomSocketHandler, properties.getRelay().getPath())
                .setAllowedOriginPatterns(properties.getRelay().getAllowedOrigins());
    }
}
