package com.example.wizardchess.logic;

import com.example.wizardchess.model.domain.AssassinTraits;
import com.example.wizardchess.model.domain.Piece;
import com.example.wizardchess.model.domain.Point;
import com.example.wizardchess.model.domain.Side;
import com.example.wizardchess.model.domain.SquareCoord;

/**
 * Assassin stealth transitions. Entering or leaving stealth depends only on the direction
 * of travel, measured as the signed sum of the rotated-coordinate deltas.
 */
public final class StealthRules {

    private StealthRules() {
    }

    /**
     * Applies stealth for a relocation {@code from -> to}. White enters on a delta sum of
     * -1 and leaves on +1; black the other way round. Other deltas change nothing.
     * Entering holds until a leaving move; a leaving move keeps the piece hidden until
     * the opponent's next turn has finished. A no-op for pieces that are not assassins.
     */
    public static void updateStealth(BoardGraph graph, Piece piece, Point from, Point to) {
        if (!(piece.getTraits() instanceof AssassinTraits)) {
            return;
        }
        AssassinTraits traits = (AssassinTraits) piece.getTraits();
        SquareCoord a = graph.rotateToSquare(from);
        SquareCoord b = graph.rotateToSquare(to);
        int sum = (b.x() - a.x()) + (b.y() - a.y());
        int enter = piece.getSide() == Side.BLACK ? 1 : -1;
        if (sum == enter) {
            traits.setStealthed(true);
            traits.setStealthExpiresOn(null);
        } else if (sum == -enter && traits.isStealthed()) {
            traits.setStealthExpiresOn(piece.getSide().opponent());
        }
    }

    public static void reveal(Piece piece) {
        if (piece.getTraits() instanceof AssassinTraits) {
            AssassinTraits traits = (AssassinTraits) piece.getTraits();
            traits.setStealthed(false);
            traits.setStealthExpiresOn(null);
        }
    }

    /**
     * Called at handoff once {@code finishedSide} has completed its turn: every assassin
     * whose stealth was due to lapse on that side's turn becomes visible again.
     */
    public static int expire(Iterable<Piece> pieces, Side finishedSide) {
        int revealed = 0;
        for (Piece piece : pieces) {
            if (piece.getTraits() instanceof AssassinTraits) {
                AssassinTraits traits = (AssassinTraits) piece.getTraits();
                if (traits.isStealthed() && traits.getStealthExpiresOn() == finishedSide) {
                    reveal(piece);
                    revealed++;
                }
            }
        }
        return revealed;
    }
}
