package com.example.wizardchess.model.dto;

import com.example.wizardchess.model.domain.AttackMode;
import com.example.wizardchess.model.domain.Point;
import com.example.wizardchess.model.domain.Side;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of every mutating room request. Only the fields the endpoint needs are read.
 */
@Data
@NoArgsConstructor
public class MoveRequest {
    private String playerId;
    private Side side;
    private int r;
    private int c;
    private String paladinId; // guard decision; null declines
    private AttackMode attackMode;
    private Long expectedVersion;

    public MoveRequest(String playerId) {
        this.playerId = playerId;
    }

    @JsonIgnore
    public Point getCell() {
        return new Point(r, c);
    }
}
