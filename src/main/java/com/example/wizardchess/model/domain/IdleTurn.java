package com.example.wizardchess.model.domain;

import lombok.EqualsAndHashCode;
import lombok.ToString;

@ToString
@EqualsAndHashCode(callSuper = false)
public class IdleTurn extends TurnState {

    @Override
    public TurnPhase getPhase() {
        return TurnPhase.IDLE;
    }
}
