package com.example.wizardchess.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Dragon trail cell. Passable by everyone, only a paladin may stop on it.
 * {@code dragonTag} scopes the mark to the most recent move of one dragon.
 */
public record ScorchMark(int r, int c, String dragonTag) {

    @JsonIgnore
    public Point point() {
        return new Point(r, c);
    }
}
