package com.example.wizardchess.model.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Pieces keyed by their stable id. Serialized as a plain list.
 */
public class PieceRegistry {

    private final Map<String, Piece> pieces = new LinkedHashMap<>();

    public PieceRegistry() {
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public PieceRegistry(List<Piece> list) {
        if (list != null) {
            list.forEach(this::add);
        }
    }

    @JsonValue
    public List<Piece> list() {
        return new ArrayList<>(pieces.values());
    }

    public void add(Piece piece) {
        if (pieces.containsKey(piece.getId())) {
            throw new IllegalArgumentException("Duplicate piece id " + piece.getId());
        }
        pieces.put(piece.getId(), piece);
    }

    public Piece remove(String id) {
        return pieces.remove(id);
    }

    public Piece byId(String id) {
        return id == null ? null : pieces.get(id);
    }

    public Collection<Piece> all() {
        return pieces.values();
    }

    public int size() {
        return pieces.size();
    }

    /**
     * Physical lookup: any piece occupies its cell.
     */
    public Piece pieceAt(Point p) {
        for (Piece piece : pieces.values()) {
            if (piece.isAt(p)) {
                return piece;
            }
        }
        return null;
    }

    /**
     * Lookup as seen by {@code viewer}: an enemy in stealth is treated as absent.
     */
    public Piece visiblePieceAt(Point p, Side viewer) {
        Piece piece = pieceAt(p);
        if (piece == null || piece.isHiddenFrom(viewer)) {
            return null;
        }
        return piece;
    }

    public List<Piece> ofSide(Side side) {
        return pieces.values().stream()
                .filter(p -> p.getSide() == side)
                .collect(Collectors.toList());
    }

    public List<Piece> ofType(PieceType type) {
        return pieces.values().stream()
                .filter(p -> p.getType() == type)
                .collect(Collectors.toList());
    }

    public Piece wizardOf(Side side) {
        for (Piece piece : pieces.values()) {
            if (piece.getType() == PieceType.WIZARD && piece.getSide() == side) {
                return piece;
            }
        }
        return null;
    }
}
