package com.example.wizardchess.model.domain;

/**
 * A lattice address: row index (0..2N) and column index within that row.
 */
public record Point(int r, int c) {

    @Override
    public String toString() {
        return "(" + r + "," + c + ")";
    }
}
