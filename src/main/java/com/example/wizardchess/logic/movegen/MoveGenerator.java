package com.example.wizardchess.logic.movegen;

import com.example.wizardchess.logic.BeamTracer;
import com.example.wizardchess.logic.BoardView;
import com.example.wizardchess.model.domain.CandidateAction;
import com.example.wizardchess.model.domain.Piece;
import com.example.wizardchess.model.domain.PieceType;
import com.example.wizardchess.model.domain.Side;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Dispatches candidate generation to the rule registered for the piece's archetype.
 */
public class MoveGenerator {

    private final Map<PieceType, MoveRule> rules = new EnumMap<>(PieceType.class);

    public MoveGenerator(BeamTracer beamTracer) {
        register(new ApprenticeRule());
        register(new WizardRule(beamTracer));
        register(new DragonRule());
        register(new RangerRule());
        register(new GriffinRule());
        register(new AssassinRule());
        register(new PaladinRule());
        register(new BardRule());
    }

    private void register(MoveRule rule) {
        rules.put(rule.type(), rule);
    }

    public List<CandidateAction> candidates(Piece piece, Side actingSide, BoardView view) {
        MoveRule rule = rules.get(piece.getType());
        if (rule == null) {
            return Collections.emptyList();
        }
        return rule.candidates(piece, actingSide, view);
    }
}
