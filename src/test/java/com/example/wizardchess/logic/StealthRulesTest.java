package com.example.wizardchess.logic;

import com.example.wizardchess.model.domain.AssassinTraits;
import com.example.wizardchess.model.domain.Piece;
import com.example.wizardchess.model.domain.PieceType;
import com.example.wizardchess.model.domain.Point;
import com.example.wizardchess.model.domain.Side;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StealthRulesTest {

    private final BoardFixture board = new BoardFixture();

    private static AssassinTraits traits(Piece assassin) {
        return (AssassinTraits) assassin.getTraits();
    }

    @Test
    void testWhiteEntersOnNegativeSumAndLeavesOnPositive() {
        Piece assassin = board.place("white-assassin-1", PieceType.ASSASSIN, Side.WHITE, 4, 4);
        Point from = board.sq(4, 4);
        Point to = board.sq(2, 5); // delta sum -1

        StealthRules.updateStealth(board.graph, assassin, from, to);
        assertTrue(assassin.isStealthed());
        assertNull(traits(assassin).getStealthExpiresOn());

        // leaving stays hidden until black has had its turn
        StealthRules.updateStealth(board.graph, assassin, to, from);
        assertTrue(assassin.isStealthed());
        assertEquals(Side.BLACK, traits(assassin).getStealthExpiresOn());

        assertEquals(1, StealthRules.expire(List.of(assassin), Side.BLACK));
        assertFalse(assassin.isStealthed());
        assertNull(traits(assassin).getStealthExpiresOn());
    }

    @Test
    void testBlackDirectionIsReversed() {
        Piece assassin = board.place("black-assassin-1", PieceType.ASSASSIN, Side.BLACK, 4, 4);

        StealthRules.updateStealth(board.graph, assassin, board.sq(4, 4), board.sq(6, 3)); // +1
        assertTrue(assassin.isStealthed());
        assertNull(traits(assassin).getStealthExpiresOn());

        StealthRules.updateStealth(board.graph, assassin, board.sq(6, 3), board.sq(4, 4)); // -1
        assertTrue(assassin.isStealthed());
        assertEquals(Side.WHITE, traits(assassin).getStealthExpiresOn());
    }

    @Test
    void testLeavingMoveWhileVisibleDoesNothing() {
        Piece assassin = board.place("white-assassin-1", PieceType.ASSASSIN, Side.WHITE, 4, 4);

        StealthRules.updateStealth(board.graph, assassin, board.sq(4, 4), board.sq(6, 3)); // +1
        assertFalse(assassin.isStealthed());
        assertNull(traits(assassin).getStealthExpiresOn());
    }

    @Test
    void testReenteringCancelsPendingExpiry() {
        Piece assassin = BoardFixture.hide(board.place("white-assassin-1", PieceType.ASSASSIN, Side.WHITE, 4, 4));

        StealthRules.updateStealth(board.graph, assassin, board.sq(4, 4), board.sq(6, 3)); // +1
        assertEquals(Side.BLACK, traits(assassin).getStealthExpiresOn());
        StealthRules.updateStealth(board.graph, assassin, board.sq(6, 3), board.sq(4, 4)); // -1

        assertEquals(0, StealthRules.expire(List.of(assassin), Side.BLACK));
        assertTrue(assassin.isStealthed());
        assertNull(traits(assassin).getStealthExpiresOn());
    }

    @Test
    void testInverseDisplacementRestoresState() {
        Piece assassin = board.place("white-assassin-1", PieceType.ASSASSIN, Side.WHITE, 4, 4);
        List<Piece> pieces = List.of(assassin);
        Point a = board.sq(4, 4);
        // entering jumps and sideways steps, from a visible start
        int[][] jumps = {{1, -2}, {-2, 1}, {-1, 0}, {1, -1}, {-1, 1}};

        for (int[] jump : jumps) {
            Point b = board.sq(4 + jump[0], 4 + jump[1]);
            StealthRules.updateStealth(board.graph, assassin, a, b);
            StealthRules.updateStealth(board.graph, assassin, b, a);
            StealthRules.expire(pieces, Side.BLACK);
            assertFalse(assassin.isStealthed(), "visible start, jump " + jump[0] + "," + jump[1]);
        }

        // from a hidden start, leaving first and coming back
        BoardFixture.hide(assassin);
        Point b = board.sq(6, 3); // +1 leaves
        StealthRules.updateStealth(board.graph, assassin, a, b);
        StealthRules.updateStealth(board.graph, assassin, b, a);
        StealthRules.expire(pieces, Side.BLACK);
        assertTrue(assassin.isStealthed());
    }

    @Test
    void testSidewaysMoveLeavesStateUnchanged() {
        Piece assassin = BoardFixture.hide(board.place("white-assassin-1", PieceType.ASSASSIN, Side.WHITE, 4, 4));
        StealthRules.updateStealth(board.graph, assassin, board.sq(4, 4), board.sq(5, 3)); // sum 0
        assertTrue(assassin.isStealthed());
    }

    @Test
    void testNonAssassinIsIgnored() {
        Piece ranger = board.place("white-ranger-1", PieceType.RANGER, Side.WHITE, 4, 4);
        StealthRules.updateStealth(board.graph, ranger, board.sq(4, 4), board.sq(3, 4));
        assertFalse(ranger.isStealthed());
        assertNull(ranger.getTraits());
    }

    @Test
    void testExpireOnlyAfterTheOpponentsTurn() {
        Piece assassin = BoardFixture.hide(board.place("white-assassin-1", PieceType.ASSASSIN, Side.WHITE, 4, 4));
        List<Piece> pieces = List.of(assassin);

        assertEquals(0, StealthRules.expire(pieces, Side.BLACK));
        assertTrue(assassin.isStealthed());

        StealthRules.updateStealth(board.graph, assassin, board.sq(4, 4), board.sq(6, 3)); // +1
        assertEquals(0, StealthRules.expire(pieces, Side.WHITE));
        assertTrue(assassin.isStealthed());

        assertEquals(1, StealthRules.expire(pieces, Side.BLACK));
        assertFalse(assassin.isStealthed());
    }
}
