package com.example.wizardchess.logic.movegen;

import com.example.wizardchess.logic.BoardView;
import com.example.wizardchess.logic.Direction;
import com.example.wizardchess.model.domain.CandidateAction;
import com.example.wizardchess.model.domain.Piece;
import com.example.wizardchess.model.domain.PieceType;
import com.example.wizardchess.model.domain.Point;
import com.example.wizardchess.model.domain.Side;

import java.util.ArrayList;
import java.util.List;

/**
 * Only an activated bard moves: one step to a cell that looks empty, or one jump over an
 * adjacent piece. It never attacks.
 */
public class BardRule implements MoveRule {

    @Override
    public PieceType type() {
        return PieceType.BARD;
    }

    @Override
    public List<CandidateAction> candidates(Piece piece, Side actingSide, BoardView view) {
        List<CandidateAction> out = new ArrayList<>();
        if (!piece.isActivated()) {
            return out;
        }
        for (Direction dir : Direction.values()) {
            Point next = view.graph().step(piece.getPosition(), dir);
            if (next == null) {
                continue;
            }
            Piece over = view.visibleAt(next, actingSide);
            if (over == null) {
                Steps.addStep(out, piece, actingSide, view, next, false);
                continue;
            }
            if (!canBeJumped(over) || !view.canEnter(next, actingSide)) {
                continue;
            }
            Point landing = view.graph().step(next, dir);
            if (landing != null && view.looksEmpty(landing, actingSide)) {
                Steps.addStep(out, piece, actingSide, view, landing, false);
            }
        }
        return out;
    }

    private boolean canBeJumped(Piece over) {
        if (over.is(PieceType.BARD) && !over.isActivated()) {
            return false;
        }
        return !over.isStealthed();
    }

    /**
     * Pieces the bard may trade places with once it has moved.
     */
    public static boolean isSwapPartner(Piece candidate, Side actingSide) {
        return candidate.getSide() == actingSide
                && candidate.getType() != PieceType.BARD
                && candidate.getType() != PieceType.DRAGON
                && candidate.getType() != PieceType.WIZARD;
    }
}
