package com.example.wizardchess.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One frame on the room relay channel. {@code state} is passed through untouched.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class RelayMessage {

    public static final String JOIN_ROOM = "joinRoom";
    public static final String ROOM_JOINED = "roomJoined";
    public static final String STATE = "state";
    public static final String ERROR = "error";

    private String type;
    private String password;
    private JsonNode state;
    private String message;

    public static RelayMessage joinRoom(String password) {
        return new RelayMessage(JOIN_ROOM, password, null, null);
    }

    // a brand-new room answers with an explicit null state
    public static RelayMessage roomJoined(String password, JsonNode state) {
        return new RelayMessage(ROOM_JOINED, password, state == null ? NullNode.getInstance() : state, null);
    }

    public static RelayMessage state(JsonNode state) {
        return new RelayMessage(STATE, null, state == null ? NullNode.getInstance() : state, null);
    }

    public static RelayMessage error(String message) {
        return new RelayMessage(ERROR, null, null, message);
    }
}
