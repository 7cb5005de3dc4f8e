package com.example.wizardchess.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;

public record CandidateAction(ActionType type, int r, int c) {

    public static CandidateAction move(Point p) {
        return new CandidateAction(ActionType.MOVE, p.r(), p.c());
    }

    public static CandidateAction swap(Point p) {
        return new CandidateAction(ActionType.SWAP, p.r(), p.c());
    }

    public static CandidateAction attack(Point p) {
        return new CandidateAction(ActionType.ATTACK, p.r(), p.c());
    }

    @JsonIgnore
    public Point point() {
        return new Point(r, c);
    }
}
