package com.example.wizardchess.repository;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A relay room: the sessions in it and the last snapshot broadcast there.
 */
@Data
@NoArgsConstructor
public class Room {
    private String key;
    private Set<String> memberIds = new LinkedHashSet<>();
    private JsonNode state;

    public Room(String key) {
        this.key = key;
    }
}
