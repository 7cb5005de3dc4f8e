package com.example.wizardchess.logic.movegen;

import com.example.wizardchess.logic.BoardView;
import com.example.wizardchess.logic.Direction;
import com.example.wizardchess.model.domain.CandidateAction;
import com.example.wizardchess.model.domain.Piece;
import com.example.wizardchess.model.domain.PieceType;
import com.example.wizardchess.model.domain.Side;

import java.util.ArrayList;
import java.util.List;

public class ApprenticeRule implements MoveRule {

    @Override
    public PieceType type() {
        return PieceType.APPRENTICE;
    }

    @Override
    public List<CandidateAction> candidates(Piece piece, Side actingSide, BoardView view) {
        List<CandidateAction> out = new ArrayList<>();
        for (Direction dir : forward(piece.getSide())) {
            Steps.addStep(out, piece, actingSide, view, view.graph().step(piece.getPosition(), dir), true);
        }
        if (!piece.isSwapUsed()) {
            Piece wizard = view.pieces().wizardOf(piece.getSide());
            if (wizard != null) {
                out.add(CandidateAction.swap(wizard.getPosition()));
            }
        }
        return out;
    }

    /**
     * The two directions that face the enemy's home rows.
     */
    public static Direction[] forward(Side side) {
        if (side == Side.BLACK) {
            return new Direction[]{Direction.SOUTH_EAST, Direction.SOUTH_WEST};
        }
        return new Direction[]{Direction.NORTH_WEST, Direction.NORTH_EAST};
    }
}
