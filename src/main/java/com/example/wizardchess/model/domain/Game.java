package com.example.wizardchess.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * The complete canonical state of one room. Everything needed to resume a game is in here,
 * so the JSON form of this class is the snapshot that travels through the relay.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Game {

    private int schemaVersion = 1;

    private String roomKey;
    private long version;

    private PieceRegistry pieces = new PieceRegistry();
    private Side currentSide = Side.WHITE;
    private int turnNumber = 1;
    private TurnState turn = new IdleTurn();
    private boolean captureOccurred;

    private List<ScorchMark> scorchMarks = new ArrayList<>();
    private List<GuardLight> guardLights = new ArrayList<>();

    private List<MoveRecord> history = new ArrayList<>();
    private Map<Side, List<Piece>> capturedPieces = new EnumMap<>(Side.class);

    // player id per seat
    private Map<Side, String> seats = new EnumMap<>(Side.class);
    private Map<Side, Boolean> ready = new EnumMap<>(Side.class);

    private Side winner;

    public Game(String roomKey) {
        this.roomKey = roomKey;
    }

    @JsonIgnore
    public TurnPhase getPhase() {
        return turn == null ? TurnPhase.IDLE : turn.getPhase();
    }

    @JsonIgnore
    public boolean isOver() {
        return winner != null;
    }

    public void recordCapture(Piece victim) {
        capturedPieces.computeIfAbsent(victim.getSide(), s -> new ArrayList<>()).add(victim);
    }

    @JsonIgnore
    public boolean isSeatReady(Side side) {
        return Boolean.TRUE.equals(ready.get(side));
    }
}
