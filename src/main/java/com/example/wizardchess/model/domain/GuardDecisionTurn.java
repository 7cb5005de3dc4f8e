package com.example.wizardchess.model.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class GuardDecisionTurn extends TurnState {
    private PendingGuard pending;

    @Override
    public TurnPhase getPhase() {
        return TurnPhase.AWAITING_GUARD_DECISION;
    }
}
