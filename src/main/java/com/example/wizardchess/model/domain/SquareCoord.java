package com.example.wizardchess.model.domain;

/**
 * Axis-aligned coordinate of a lattice node once the diamond is rotated into a square.
 * Same x is one diagonal family, same y the other, and x + y is constant along a row.
 */
public record SquareCoord(int x, int y) {
}
