package com.example.wizardchess.service;

import com.example.wizardchess.model.domain.Game;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

/**
 * Converts a {@link Game} to and from the snapshot that travels through the relay.
 * A snapshot alone is enough to rebuild the game.
 */
@Component
public class SnapshotCodec {

    private final ObjectMapper objectMapper;

    public SnapshotCodec(ObjectMapper objectMapper) {
        // lenient copy, so snapshots from newer clients still load
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public String toJson(Game game) {
        try {
            return objectMapper.writeValueAsString(game);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize game " + game.getRoomKey(), e);
        }
    }

    public JsonNode toTree(Game game) {
        return objectMapper.valueToTree(game);
    }

    public Game fromJson(String json) {
        try {
            return objectMapper.readValue(json, Game.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed game snapshot: " + e.getOriginalMessage(), e);
        }
    }

    public Game fromTree(JsonNode node) {
        if (node == null || node.isNull() || !node.isObject()) {
            throw new IllegalArgumentException("Game snapshot must be a JSON object");
        }
        try {
            return objectMapper.treeToValue(node, Game.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed game snapshot: " + e.getOriginalMessage(), e);
        }
    }
}
