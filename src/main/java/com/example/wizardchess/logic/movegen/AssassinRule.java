package com.example.wizardchess.logic.movegen;

import com.example.wizardchess.logic.BoardGraph;
import com.example.wizardchess.logic.BoardView;
import com.example.wizardchess.model.domain.CandidateAction;
import com.example.wizardchess.model.domain.Piece;
import com.example.wizardchess.model.domain.PieceType;
import com.example.wizardchess.model.domain.Point;
import com.example.wizardchess.model.domain.Side;

import java.util.ArrayList;
import java.util.List;

/**
 * Jumps to the far corner of the rhombus spanned by two neighbouring cells on different rows.
 * Both spanning cells have to be on the board.
 */
public class AssassinRule implements MoveRule {

    // {destination dx, dy, first spanning dx, dy, second spanning dx, dy}
    private static final int[][] JUMPS = {
            {2, -1, 1, 0, 1, -1},
            {1, -2, 1, -1, 0, -1},
            {-2, 1, -1, 0, -1, 1},
            {-1, 2, -1, 1, 0, 1}
    };

    @Override
    public PieceType type() {
        return PieceType.ASSASSIN;
    }

    @Override
    public List<CandidateAction> candidates(Piece piece, Side actingSide, BoardView view) {
        List<CandidateAction> out = new ArrayList<>();
        for (Point dest : destinations(view.graph(), piece.getPosition())) {
            Steps.addStep(out, piece, actingSide, view, dest, true);
        }
        return out;
    }

    public static List<Point> destinations(BoardGraph graph, Point from) {
        List<Point> result = new ArrayList<>();
        for (int[] jump : JUMPS) {
            Point dest = graph.offset(from, jump[0], jump[1]);
            if (dest != null
                    && graph.offset(from, jump[2], jump[3]) != null
                    && graph.offset(from, jump[4], jump[5]) != null) {
                result.add(dest);
            }
        }
        return result;
    }
}
