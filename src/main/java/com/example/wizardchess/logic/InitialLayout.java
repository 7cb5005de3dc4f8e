package com.example.wizardchess.logic;

import com.example.wizardchess.model.domain.Piece;
import com.example.wizardchess.model.domain.PieceRegistry;
import com.example.wizardchess.model.domain.PieceType;
import com.example.wizardchess.model.domain.Side;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Starting position on the size-8 board. White is laid out on rows 10..16; black mirrors it on
 * row {@code 16 - r} in the same column; the neutral bard sits at the centre.
 */
public final class InitialLayout {

    private static final int SIZE = BoardGraph.DEFAULT_SIZE;

    // {row, col} per archetype, white side
    private static final Map<PieceType, int[][]> WHITE = new LinkedHashMap<>();

    static {
        WHITE.put(PieceType.WIZARD, new int[][]{{16, 0}});
        WHITE.put(PieceType.DRAGON, new int[][]{{14, 1}});
        WHITE.put(PieceType.GRIFFIN, new int[][]{{14, 0}, {14, 2}});
        WHITE.put(PieceType.RANGER, new int[][]{{13, 0}, {13, 3}});
        WHITE.put(PieceType.PALADIN, new int[][]{{13, 1}, {13, 2}});
        WHITE.put(PieceType.ASSASSIN, new int[][]{{12, 1}, {12, 3}});
        WHITE.put(PieceType.APPRENTICE, new int[][]{{10, 0}, {10, 1}, {10, 2}, {10, 3}, {10, 4}, {10, 5}, {10, 6}});
    }

    private InitialLayout() {
    }

    public static PieceRegistry create() {
        PieceRegistry registry = new PieceRegistry();
        for (Side side : new Side[]{Side.WHITE, Side.BLACK}) {
            for (Map.Entry<PieceType, int[][]> entry : WHITE.entrySet()) {
                PieceType type = entry.getKey();
                int n = 0;
                for (int[] cell : entry.getValue()) {
                    n++;
                    int row = side == Side.WHITE ? cell[0] : 2 * SIZE - cell[0];
                    registry.add(new Piece(pieceId(side, type, n), type, side, row, cell[1]));
                }
            }
        }
        registry.add(new Piece(pieceId(Side.NEUTRAL, PieceType.BARD, 1), PieceType.BARD, Side.NEUTRAL, SIZE, SIZE / 2));
        return registry;
    }

    public static String pieceId(Side side, PieceType type, int n) {
        return side.name().toLowerCase() + "-" + type.name().toLowerCase() + "-" + n;
    }
}
