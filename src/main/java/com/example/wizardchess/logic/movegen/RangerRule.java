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
 * King steps plus the cannon jump: along each ray the first visible piece is the screen,
 * and an enemy directly behind it can be taken.
 */
public class RangerRule implements MoveRule {

    @Override
    public PieceType type() {
        return PieceType.RANGER;
    }

    @Override
    public List<CandidateAction> candidates(Piece piece, Side actingSide, BoardView view) {
        List<CandidateAction> out = new ArrayList<>();
        Steps.addKingSteps(out, piece, actingSide, view);
        for (Direction dir : Direction.values()) {
            Point screen = findScreen(piece.getPosition(), dir, actingSide, view);
            if (screen == null) {
                continue;
            }
            Point landing = view.graph().step(screen, dir);
            if (landing == null || !view.canStop(landing, piece, actingSide)) {
                continue;
            }
            Piece target = view.visibleAt(landing, actingSide);
            if (view.isEnemy(target, actingSide)) {
                CandidateAction attack = CandidateAction.attack(landing);
                if (!out.contains(attack)) {
                    out.add(attack);
                }
            }
        }
        return out;
    }

    // hidden assassins and guard lights are transparent to the scan
    private Point findScreen(Point from, Direction dir, Side actingSide, BoardView view) {
        Point cur = view.graph().step(from, dir);
        while (cur != null) {
            Piece visible = view.visibleAt(cur, actingSide);
            if (visible != null) {
                if (visible.is(PieceType.BARD) && !visible.isActivated()) {
                    return null;
                }
                return cur;
            }
            cur = view.graph().step(cur, dir);
        }
        return null;
    }
}
