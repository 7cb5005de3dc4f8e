package com.example.wizardchess.logic.movegen;

import com.example.wizardchess.logic.BoardView;
import com.example.wizardchess.logic.Direction;
import com.example.wizardchess.model.domain.CandidateAction;
import com.example.wizardchess.model.domain.Piece;
import com.example.wizardchess.model.domain.PieceType;
import com.example.wizardchess.model.domain.Side;

import java.util.ArrayList;
import java.util.List;

/**
 * Slides along its own row and hops one cell straight up or down the board (x and y both +1 or -1).
 */
public class GriffinRule implements MoveRule {

    private static final int[][] VERTICAL_HOPS = {{1, 1}, {-1, -1}};

    @Override
    public PieceType type() {
        return PieceType.GRIFFIN;
    }

    @Override
    public List<CandidateAction> candidates(Piece piece, Side actingSide, BoardView view) {
        List<CandidateAction> out = new ArrayList<>();
        Steps.addSlide(out, piece, actingSide, view, Direction.EAST);
        Steps.addSlide(out, piece, actingSide, view, Direction.WEST);
        for (int[] hop : VERTICAL_HOPS) {
            Steps.addStep(out, piece, actingSide, view,
                    view.graph().offset(piece.getPosition(), hop[0], hop[1]), true);
        }
        return out;
    }
}
