package com.example.wizardchess.model.dto;

import com.example.wizardchess.model.domain.Side;
import com.example.wizardchess.model.domain.TurnPhase;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;

import java.util.List;

@Data
public class GameStateDTO {
    private String roomKey;
    private boolean accepted;
    private long version;
    private TurnPhase phase;
    private Side currentSide;
    private int turnNumber;
    private Side winner;
    private String statusMessage;

    // history as seen by the requesting side
    private List<String> history;

    private JsonNode snapshot;
}
