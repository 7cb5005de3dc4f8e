package com.example.wizardchess.logic;

import com.example.wizardchess.model.domain.Game;
import com.example.wizardchess.model.domain.GuardLight;
import com.example.wizardchess.model.domain.Piece;
import com.example.wizardchess.model.domain.PieceRegistry;
import com.example.wizardchess.model.domain.PieceType;
import com.example.wizardchess.model.domain.Point;
import com.example.wizardchess.model.domain.ScorchMark;
import com.example.wizardchess.model.domain.Side;

import java.util.Collections;
import java.util.List;

/**
 * Read-only query surface over pieces and terrain used by move generation and beam tracing.
 */
public class BoardView {

    private final BoardGraph graph;
    private final PieceRegistry pieces;
    private final List<ScorchMark> scorchMarks;
    private final List<GuardLight> guardLights;

    public BoardView(BoardGraph graph, PieceRegistry pieces, List<ScorchMark> scorchMarks, List<GuardLight> guardLights) {
        this.graph = graph;
        this.pieces = pieces;
        this.scorchMarks = scorchMarks == null ? Collections.emptyList() : scorchMarks;
        this.guardLights = guardLights == null ? Collections.emptyList() : guardLights;
    }

    public static BoardView of(BoardGraph graph, Game game) {
        return new BoardView(graph, game.getPieces(), game.getScorchMarks(), game.getGuardLights());
    }

    public BoardGraph graph() {
        return graph;
    }

    public PieceRegistry pieces() {
        return pieces;
    }

    public Piece physicalAt(Point p) {
        return pieces.pieceAt(p);
    }

    public Piece visibleAt(Point p, Side viewer) {
        return pieces.visiblePieceAt(p, viewer);
    }

    public boolean isScorched(Point p) {
        for (ScorchMark mark : scorchMarks) {
            if (mark.r() == p.r() && mark.c() == p.c()) {
                return true;
            }
        }
        return false;
    }

    public boolean isGuardBlocked(Point p, Side moverSide) {
        for (GuardLight light : guardLights) {
            if (light.r() == p.r() && light.c() == p.c() && light.blocks(moverSide)) {
                return true;
            }
        }
        return false;
    }

    /**
     * On the board and not sealed by an opposing guard light.
     */
    public boolean canEnter(Point p, Side moverSide) {
        return graph.contains(p) && !isGuardBlocked(p, moverSide);
    }

    /**
     * Enterable, and not scorched unless the mover is a paladin.
     */
    public boolean canStop(Point p, Piece mover, Side moverSide) {
        if (!canEnter(p, moverSide)) {
            return false;
        }
        return mover.getType() == PieceType.PALADIN || !isScorched(p);
    }

    /**
     * Whether {@code target} may be attacked by a piece acting for {@code actingSide}.
     * Neutral pieces and bards are never attack targets.
     */
    public boolean isEnemy(Piece target, Side actingSide) {
        return target != null
                && target.getSide().isPlayer()
                && target.getSide() != actingSide
                && target.getType() != PieceType.BARD;
    }

    /**
     * Cell that looks empty to the mover: either free, or holding an enemy hidden in stealth,
     * which the move then captures.
     */
    public boolean looksEmpty(Point p, Side moverSide) {
        return visibleAt(p, moverSide) == null;
    }
}
