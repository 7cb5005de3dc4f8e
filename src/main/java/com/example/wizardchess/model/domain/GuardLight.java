package com.example.wizardchess.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Left behind by a paladin that intercepted an attack. Pieces of the other side can
 * neither stop on nor pass through it.
 */
public record GuardLight(int r, int c, Side createdBy) {

    @JsonIgnore
    public Point point() {
        return new Point(r, c);
    }

    public boolean blocks(Side moverSide) {
        return createdBy != moverSide;
    }
}
