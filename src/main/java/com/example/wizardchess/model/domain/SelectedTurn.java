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
public class SelectedTurn extends TurnState {
    private String pieceId;
    private List<CandidateAction> candidates = new ArrayList<>();

    @Override
    public TurnPhase getPhase() {
        return TurnPhase.SELECTED;
    }
}
