package com.example.wizardchess.logic.movegen;

import com.example.wizardchess.logic.BoardView;
import com.example.wizardchess.logic.Direction;
import com.example.wizardchess.model.domain.CandidateAction;
import com.example.wizardchess.model.domain.Piece;
import com.example.wizardchess.model.domain.PieceType;
import com.example.wizardchess.model.domain.Side;

import java.util.ArrayList;
import java.util.List;

public class DragonRule implements MoveRule {

    @Override
    public PieceType type() {
        return PieceType.DRAGON;
    }

    @Override
    public List<CandidateAction> candidates(Piece piece, Side actingSide, BoardView view) {
        List<CandidateAction> out = new ArrayList<>();
        for (Direction dir : Direction.values()) {
            Steps.addSlide(out, piece, actingSide, view, dir);
        }
        return out;
    }
}
