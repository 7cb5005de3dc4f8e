package com.example.wizardchess.model.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class BardSwapTurn extends TurnState {
    private String bardId;
    private List<String> partnerIds = new ArrayList<>();

    @Override
    public TurnPhase getPhase() {
        return TurnPhase.AWAITING_BARD_SWAP_TARGET;
    }
}
