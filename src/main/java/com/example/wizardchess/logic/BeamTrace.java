package com.example.wizardchess.logic;

import com.example.wizardchess.model.domain.Point;

import java.util.List;

/**
 * Result of tracing a wizard's beam: the cells linked so far (wizard first) and the
 * target cell, or {@code null} when the beam failed to form.
 */
public record BeamTrace(List<Point> path, Point target) {

    public boolean hasTarget() {
        return target != null;
    }
}
