package com.example.wizardchess.logic.movegen;

import com.example.wizardchess.logic.BoardView;
import com.example.wizardchess.model.domain.CandidateAction;
import com.example.wizardchess.model.domain.Piece;
import com.example.wizardchess.model.domain.PieceType;
import com.example.wizardchess.model.domain.Side;

import java.util.List;

/**
 * Candidate actions for one archetype at the piece's current position.
 * {@code actingSide} is the side on the move; it differs from the piece's side only for neutral pieces.
 */
public interface MoveRule {

    PieceType type();

    List<CandidateAction> candidates(Piece piece, Side actingSide, BoardView view);
}
