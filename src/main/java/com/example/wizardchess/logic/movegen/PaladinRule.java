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

public class PaladinRule implements MoveRule {

    @Override
    public PieceType type() {
        return PieceType.PALADIN;
    }

    @Override
    public List<CandidateAction> candidates(Piece piece, Side actingSide, BoardView view) {
        List<CandidateAction> out = new ArrayList<>();
        Steps.addKingSteps(out, piece, actingSide, view);
        return out;
    }

    /**
     * The paladin's own cell and every adjacent cell.
     */
    public static List<Point> protectionZone(BoardGraph graph, Point at) {
        List<Point> zone = new ArrayList<>();
        zone.add(at);
        zone.addAll(graph.neighbors(at));
        return zone;
    }
}
