package com.example.wizardchess.model.domain;

public enum PieceType {
    APPRENTICE("Apprentice"),
    WIZARD("Wizard"),
    DRAGON("Dragon"),
    RANGER("Ranger"),
    GRIFFIN("Griffin"),
    ASSASSIN("Assassin"),
    PALADIN("Paladin"),
    BARD("Bard");

    private final String displayName;

    PieceType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
