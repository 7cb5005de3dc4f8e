package com.example.wizardchess.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Common header (identity, archetype, side, position) plus the archetype payload.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Piece {
    private String id;
    private PieceType type;
    private Side side;
    private int r;
    private int c;
    private PieceTraits traits;

    public Piece(String id, PieceType type, Side side, int r, int c) {
        this.id = id;
        this.type = type;
        this.side = side;
        this.r = r;
        this.c = c;
        this.traits = PieceTraits.initialFor(type, id);
    }

    @JsonIgnore
    public Point getPosition() {
        return new Point(r, c);
    }

    public boolean isAt(Point p) {
        return r == p.r() && c == p.c();
    }

    public void moveTo(Point p) {
        this.r = p.r();
        this.c = p.c();
    }

    public boolean is(PieceType pieceType) {
        return type == pieceType;
    }

    @JsonIgnore
    public boolean isStealthed() {
        return traits instanceof AssassinTraits && ((AssassinTraits) traits).isStealthed();
    }

    @JsonIgnore
    public boolean isActivated() {
        return traits instanceof BardTraits && ((BardTraits) traits).isActivated();
    }

    @JsonIgnore
    public boolean isSwapUsed() {
        return traits instanceof ApprenticeTraits && ((ApprenticeTraits) traits).isSwapUsed();
    }

    @JsonIgnore
    public String getDragonTag() {
        return traits instanceof DragonTraits ? ((DragonTraits) traits).getTag() : null;
    }

    /**
     * A stealthed assassin is invisible to every side but its own.
     */
    public boolean isHiddenFrom(Side viewer) {
        return isStealthed() && viewer != side;
    }

    @JsonIgnore
    public String getDisplayName() {
        return side.getDisplayName() + " " + type.getDisplayName();
    }
}
