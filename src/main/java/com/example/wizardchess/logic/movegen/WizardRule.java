package com.example.wizardchess.logic.movegen;

import com.example.wizardchess.logic.BeamTrace;
import com.example.wizardchess.logic.BeamTracer;
import com.example.wizardchess.logic.BoardView;
import com.example.wizardchess.model.domain.CandidateAction;
import com.example.wizardchess.model.domain.Piece;
import com.example.wizardchess.model.domain.PieceType;
import com.example.wizardchess.model.domain.Point;
import com.example.wizardchess.model.domain.Side;

import java.util.ArrayList;
import java.util.List;

/**
 * Steps to open neighbours, swaps with any friendly apprentice that still has its swap,
 * and at most one beam attack.
 */
public class WizardRule implements MoveRule {

    private final BeamTracer beamTracer;

    public WizardRule(BeamTracer beamTracer) {
        this.beamTracer = beamTracer;
    }

    @Override
    public PieceType type() {
        return PieceType.WIZARD;
    }

    @Override
    public List<CandidateAction> candidates(Piece piece, Side actingSide, BoardView view) {
        List<CandidateAction> out = new ArrayList<>();
        for (Point dest : view.graph().neighbors(piece.getPosition())) {
            Steps.addStep(out, piece, actingSide, view, dest, false);
        }
        for (Piece apprentice : view.pieces().ofSide(piece.getSide())) {
            if (apprentice.is(PieceType.APPRENTICE) && !apprentice.isSwapUsed()) {
                out.add(CandidateAction.swap(apprentice.getPosition()));
            }
        }
        BeamTrace trace = beamTracer.trace(piece, view);
        if (trace.hasTarget()) {
            out.add(CandidateAction.attack(trace.target()));
        }
        return out;
    }
}
