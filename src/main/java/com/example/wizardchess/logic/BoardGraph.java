package com.example.wizardchess.logic;

import com.example.wizardchess.model.domain.Node;
import com.example.wizardchess.model.domain.Point;
import com.example.wizardchess.model.domain.SquareCoord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The triangular lattice: a diamond of {@code 2N+1} rows whose widths grow from 1 to
 * {@code N+1} and shrink back to 1. Cells are addressed by (row, col); the rotated
 * square coordinate (x, y) turns the three lattice line families into
 * "same x", "same y" and "x + y constant".
 */
public class BoardGraph {

    public static final int DEFAULT_SIZE = 8;
    public static final double STEP = 40.0;

    private final int size;
    private final List<List<Node>> rows;
    private final Map<Point, List<Point>> adjacency;

    public BoardGraph() {
        this(DEFAULT_SIZE);
    }

    public BoardGraph(int size) {
        if (size < 1) {
            throw new IllegalArgumentException("Board size must be positive: " + size);
        }
        this.size = size;
        this.rows = buildNodes(size);
        this.adjacency = buildAdjacency(size, rows);
    }

    public static int rowCount(int size, int row) {
        return row <= size ? row + 1 : 2 * size + 1 - row;
    }

    /**
     * Nodes per row, centered on the origin; rows are half a step apart vertically.
     */
    public static List<List<Node>> buildNodes(int size) {
        List<List<Node>> result = new ArrayList<>();
        for (int row = 0; row <= 2 * size; row++) {
            int count = rowCount(size, row);
            List<Node> line = new ArrayList<>(count);
            for (int col = 0; col < count; col++) {
                double x = (-(count - 1) / 2.0 + col) * STEP;
                double y = (row - size) * STEP / 2.0;
                line.add(new Node(x, y, row, col));
            }
            result.add(Collections.unmodifiableList(line));
        }
        return Collections.unmodifiableList(result);
    }

    public static Map<Point, List<Point>> buildAdjacency(int size, List<List<Node>> rows) {
        Map<Point, List<Point>> adj = new LinkedHashMap<>();
        for (List<Node> line : rows) {
            for (Node node : line) {
                adj.put(node.point(), new ArrayList<>());
            }
        }
        for (int row = 0; row < rows.size(); row++) {
            int count = rows.get(row).size();
            for (int col = 0; col + 1 < count; col++) {
                link(adj, new Point(row, col), new Point(row, col + 1));
            }
            if (row + 1 >= rows.size()) {
                continue;
            }
            if (row < size) {
                // expanding: each cell sits over two cells of the wider row below
                for (int col = 0; col < count; col++) {
                    link(adj, new Point(row, col), new Point(row + 1, col));
                    link(adj, new Point(row, col), new Point(row + 1, col + 1));
                }
            } else {
                // contracting: each cell below sits under two cells of this row
                int below = rows.get(row + 1).size();
                for (int col = 0; col < below; col++) {
                    link(adj, new Point(row + 1, col), new Point(row, col));
                    link(adj, new Point(row + 1, col), new Point(row, col + 1));
                }
            }
        }
        Map<Point, List<Point>> frozen = new LinkedHashMap<>();
        adj.forEach((k, v) -> frozen.put(k, Collections.unmodifiableList(v)));
        return Collections.unmodifiableMap(frozen);
    }

    private static void link(Map<Point, List<Point>> adj, Point a, Point b) {
        if (!adj.get(a).contains(b)) {
            adj.get(a).add(b);
        }
        if (!adj.get(b).contains(a)) {
            adj.get(b).add(a);
        }
    }

    public static SquareCoord rotateToSquare(int size, int row, int col) {
        if (row <= size) {
            return new SquareCoord(col, row - col);
        }
        return new SquareCoord(col + (row - size), size - col);
    }

    public SquareCoord rotateToSquare(Point p) {
        return rotateToSquare(size, p.r(), p.c());
    }

    /**
     * Inverse of {@link #rotateToSquare}; {@code null} when (x, y) lies off the board.
     */
    public Point fromSquare(int x, int y) {
        if (x < 0 || y < 0 || x > size || y > size) {
            return null;
        }
        int row = x + y;
        int col = row <= size ? x : size - y;
        return new Point(row, col);
    }

    public Point fromSquare(SquareCoord sq) {
        return fromSquare(sq.x(), sq.y());
    }

    public boolean contains(Point p) {
        return p != null && adjacency.containsKey(p);
    }

    public List<Point> neighbors(Point p) {
        List<Point> result = adjacency.get(p);
        return result == null ? Collections.emptyList() : result;
    }

    public boolean adjacent(Point a, Point b) {
        return neighbors(a).contains(b);
    }

    /**
     * The cell reached by moving {@code steps} times in {@code dir}, or {@code null} off the board.
     */
    public Point step(Point from, Direction dir, int steps) {
        return offset(from, dir.dx() * steps, dir.dy() * steps);
    }

    public Point step(Point from, Direction dir) {
        return step(from, dir, 1);
    }

    public Point offset(Point from, int dx, int dy) {
        SquareCoord sq = rotateToSquare(from);
        return fromSquare(sq.x() + dx, sq.y() + dy);
    }

    /**
     * File letter from x, rank number from y (1-based), e.g. {@code A1} for the row-0 corner.
     */
    public String label(Point p) {
        SquareCoord sq = rotateToSquare(p);
        return String.valueOf((char) ('A' + sq.x())) + (sq.y() + 1);
    }

    public Node node(Point p) {
        if (!contains(p)) {
            return null;
        }
        return rows.get(p.r()).get(p.c());
    }

    public List<Point> allCells() {
        return new ArrayList<>(adjacency.keySet());
    }

    public List<List<Node>> getRows() {
        return rows;
    }

    public Map<Point, List<Point>> getAdjacency() {
        return adjacency;
    }

    public int getSize() {
        return size;
    }
}
