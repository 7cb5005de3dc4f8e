package com.example.wizardchess.model.domain;

public enum Side {
    WHITE("White"), // first player, starts on the high rows
    BLACK("Black"), // second player
    NEUTRAL("Neutral");

    private final String displayName;

    Side(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * The other playing side. Neutral has no opponent and maps to itself.
     */
    public Side opponent() {
        switch (this) {
            case WHITE:
                return BLACK;
            case BLACK:
                return WHITE;
            default:
                return NEUTRAL;
        }
    }

    public boolean isPlayer() {
        return this != NEUTRAL;
    }
}
