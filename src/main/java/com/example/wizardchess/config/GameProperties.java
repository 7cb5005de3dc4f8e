package com.example.wizardchess.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Relay and room settings, bound from {@code wizardchess.*} in application.properties.
 */
@Data
@Component
@ConfigurationProperties(prefix = "wizardchess")
public class GameProperties {

    private Relay relay = new Relay();

    /**
     * Engine-backed rooms accept moves only once both seats are taken and ready.
     */
    private boolean requireReadySeats = true;

    @Data
    public static class Relay {

        /**
         * WebSocket endpoint of the room relay.
         */
        private String path = "/ws";

        private String[] allowedOrigins = {"*"};

        /**
         * Sessions allowed in one room; a join beyond this answers with an error frame.
         */
        private int maxRoomMembers = 16;
    }
}
