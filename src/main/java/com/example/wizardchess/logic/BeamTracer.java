package com.example.wizardchess.logic;

import com.example.wizardchess.model.domain.Piece;
import com.example.wizardchess.model.domain.PieceType;
import com.example.wizardchess.model.domain.Point;
import com.example.wizardchess.model.domain.Side;
import com.example.wizardchess.model.domain.SquareCoord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Traces the wizard's conductor beam. Each hop links the current cell to a conductor or an
 * enemy on one of the three line families at distance 1 or 2. Ambiguity at any hop means
 * no beam at all.
 */
public class BeamTracer {

    public BeamTrace trace(Piece wizard, BoardView view) {
        Side side = wizard.getSide();
        Point origin = wizard.getPosition();
        List<Point> path = new ArrayList<>();
        path.add(origin);

        List<Point> conductors = conductorCells(side, view);
        List<Point> enemies = enemyCells(side, view);

        List<Point> first = linked(origin, conductors, side, view);
        if (first.size() != 1) {
            return new BeamTrace(path, null);
        }
        Point current = first.get(0);
        Set<Point> visited = new HashSet<>();
        visited.add(current);
        path.add(current);

        while (true) {
            List<Point> enemyLinks = linked(current, enemies, side, view);
            List<Point> remaining = new ArrayList<>(conductors);
            remaining.removeAll(visited);
            List<Point> nextLinks = linked(current, remaining, side, view);

            if (enemyLinks.size() > 1 || nextLinks.size() > 1) {
                return new BeamTrace(path, null);
            }
            if (enemyLinks.size() == 1) {
                Point target = enemyLinks.get(0);
                path.add(target);
                return new BeamTrace(path, target);
            }
            if (nextLinks.isEmpty()) {
                return new BeamTrace(path, null);
            }
            current = nextLinks.get(0);
            visited.add(current);
            path.add(current);
        }
    }

    /**
     * Friendly apprentices and activated bards of the wizard's side or the neutral side.
     */
    List<Point> conductorCells(Side side, BoardView view) {
        List<Point> cells = new ArrayList<>();
        for (Piece piece : view.pieces().all()) {
            boolean apprentice = piece.is(PieceType.APPRENTICE) && piece.getSide() == side;
            boolean bard = piece.is(PieceType.BARD) && piece.isActivated()
                    && (piece.getSide() == side || piece.getSide() == Side.NEUTRAL);
            if (apprentice || bard) {
                cells.add(piece.getPosition());
            }
        }
        return cells;
    }

    List<Point> enemyCells(Side side, BoardView view) {
        List<Point> cells = new ArrayList<>();
        for (Piece piece : view.pieces().all()) {
            if (view.isEnemy(piece, side) && !piece.isHiddenFrom(side)) {
                cells.add(piece.getPosition());
            }
        }
        return cells;
    }

    private List<Point> linked(Point from, List<Point> pool, Side side, BoardView view) {
        if (pool.isEmpty()) {
            return Collections.emptyList();
        }
        List<Point> result = new ArrayList<>();
        for (Point to : pool) {
            if (canLink(from, to, side, view)) {
                result.add(to);
            }
        }
        return result;
    }

    /**
     * Straight line in one of the three families, one or two cells apart. The endpoint and any
     * midpoint must not be sealed by an opposing guard light; a midpoint must also look empty
     * to the wizard's side. Scorch never blocks.
     */
    boolean canLink(Point from, Point to, Side side, BoardView view) {
        BoardGraph graph = view.graph();
        SquareCoord a = graph.rotateToSquare(from);
        SquareCoord b = graph.rotateToSquare(to);
        int dx = b.x() - a.x();
        int dy = b.y() - a.y();
        if (dx != 0 && dy != 0 && dx + dy != 0) {
            return false;
        }
        int distance = Math.max(Math.abs(dx), Math.abs(dy));
        if (distance < 1 || distance > 2) {
            return false;
        }
        if (view.isGuardBlocked(to, side)) {
            return false;
        }
        if (distance == 2) {
            Point mid = graph.fromSquare(a.x() + dx / 2, a.y() + dy / 2);
            if (mid == null || view.isGuardBlocked(mid, side) || !view.looksEmpty(mid, side)) {
                return false;
            }
        }
        return true;
    }
}
