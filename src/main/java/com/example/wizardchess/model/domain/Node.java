package com.example.wizardchess.model.domain;

// planar position, centred on the origin
public record Node(double x, double y, int row, int col) {

    public Point point() {
        return new Point(row, col);
    }
}
