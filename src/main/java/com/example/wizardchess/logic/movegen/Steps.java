package com.example.wizardchess.logic.movegen;

import com.example.wizardchess.logic.BoardView;
import com.example.wizardchess.logic.Direction;
import com.example.wizardchess.model.domain.CandidateAction;
import com.example.wizardchess.model.domain.Piece;
import com.example.wizardchess.model.domain.Point;
import com.example.wizardchess.model.domain.Side;

import java.util.List;

/**
 * Primitives shared by the archetype rules.
 */
final class Steps {

    private Steps() {
    }

    /**
     * Single step onto {@code dest}: a move if it looks empty, an attack if it holds a visible enemy.
     */
    static void addStep(List<CandidateAction> out, Piece piece, Side actingSide, BoardView view, Point dest,
                        boolean allowAttack) {
        if (dest == null || !view.canStop(dest, piece, actingSide)) {
            return;
        }
        Piece occupant = view.visibleAt(dest, actingSide);
        if (occupant == null) {
            out.add(CandidateAction.move(dest));
        } else if (allowAttack && view.isEnemy(occupant, actingSide)) {
            out.add(CandidateAction.attack(dest));
        }
    }

    static void addKingSteps(List<CandidateAction> out, Piece piece, Side actingSide, BoardView view) {
        for (Point dest : view.graph().neighbors(piece.getPosition())) {
            addStep(out, piece, actingSide, view, dest, true);
        }
    }

    /**
     * Unlimited travel along {@code dir}. Scorch may be crossed but not stopped on; the slide ends at
     * the first physical piece, taking it when it is a hidden or visible enemy.
     */
    static void addSlide(List<CandidateAction> out, Piece piece, Side actingSide, BoardView view, Direction dir) {
        Point cur = piece.getPosition();
        while (true) {
            cur = view.graph().step(cur, dir);
            if (cur == null || !view.canEnter(cur, actingSide)) {
                return;
            }
            Piece physical = view.physicalAt(cur);
            if (physical != null) {
                Piece visible = view.visibleAt(cur, actingSide);
                if (view.canStop(cur, piece, actingSide)) {
                    if (visible == null) {
                        out.add(CandidateAction.move(cur));
                    } else if (view.isEnemy(visible, actingSide)) {
                        out.add(CandidateAction.attack(cur));
                    }
                }
                return;
            }
            if (view.canStop(cur, piece, actingSide)) {
                out.add(CandidateAction.move(cur));
            }
        }
    }
}
