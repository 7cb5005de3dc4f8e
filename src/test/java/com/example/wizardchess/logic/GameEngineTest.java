package com.example.wizardchess.logic;

import com.example.wizardchess.model.domain.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class GameEngineTest {

    private BoardFixture board;
    private GameEngine engine;
    private Game game;

    @BeforeEach
    void setUp() {
        board = new BoardFixture();
        engine = new GameEngine(board.graph);
        game = board.game;
    }

    private void play(Point from, Point to) {
        assertTrue(engine.select(game, from), "select " + from);
        assertTrue(engine.act(game, to), "act " + to);
    }

    private String lastRecord() {
        List<MoveRecord> history = game.getHistory();
        return history.get(history.size() - 1).getFull();
    }

    // --- opening ---

    @Test
    void testNewGameLayout() {
        Game fresh = engine.newGame("room-1");

        assertEquals(35, fresh.getPieces().size());
        assertEquals(17, fresh.getPieces().ofSide(Side.WHITE).size());
        assertEquals(17, fresh.getPieces().ofSide(Side.BLACK).size());
        assertEquals(Side.WHITE, fresh.getCurrentSide());
        assertEquals(TurnPhase.IDLE, fresh.getPhase());
        assertEquals(new Point(16, 0), fresh.getPieces().wizardOf(Side.WHITE).getPosition());
        assertEquals(new Point(0, 0), fresh.getPieces().wizardOf(Side.BLACK).getPosition());
        assertEquals(new Point(8, 4), fresh.getPieces().byId("neutral-bard-1").getPosition());
    }

    @Test
    void testOpeningMoves() {
        game = engine.newGame("room-1");

        play(new Point(10, 0), new Point(9, 0));

        assertEquals(Side.BLACK, game.getCurrentSide());
        assertEquals(2, game.getTurnNumber());
        assertEquals("White Apprentice C9 → B9", lastRecord());
        assertEquals(TurnPhase.IDLE, game.getPhase());

        play(new Point(6, 0), new Point(7, 0));

        assertEquals(Side.WHITE, game.getCurrentSide());
        assertEquals(2, game.getHistory().size());
    }

    @Test
    void testOpeningThenBeamThroughOneConductor() {
        game = engine.newGame("room-1");
        play(new Point(10, 0), new Point(9, 0));
        play(new Point(6, 0), new Point(7, 0));

        // clear the white corner: an apprentice next to the wizard, a black ranger beyond it
        PieceRegistry pieces = game.getPieces();
        pieces.remove(pieces.pieceAt(new Point(14, 0)).getId());
        pieces.pieceAt(new Point(10, 1)).moveTo(new Point(15, 0));
        Piece ranger = pieces.pieceAt(new Point(3, 0));
        assertEquals(PieceType.RANGER, ranger.getType());
        assertEquals(Side.BLACK, ranger.getSide());
        ranger.moveTo(new Point(14, 0));

        Piece wizard = pieces.wizardOf(Side.WHITE);
        BeamTrace trace = engine.traceBeam(game, wizard);
        assertEquals(new Point(14, 0), trace.target());
        assertEquals(List.of(new Point(16, 0), new Point(15, 0), new Point(14, 0)), trace.path());
        assertTrue(engine.candidatesFor(game, new Point(16, 0)).contains(CandidateAction.attack(new Point(14, 0))));

        play(new Point(16, 0), new Point(14, 0));

        assertNull(pieces.byId(ranger.getId()));
        assertEquals(new Point(16, 0), wizard.getPosition());
        assertEquals(TurnPhase.IDLE, game.getPhase());
        assertEquals(Side.BLACK, game.getCurrentSide());
        assertEquals(3, game.getHistory().size());
    }

    @Test
    void testApprenticeSwapWithWizard() {
        game = engine.newGame("room-1");

        play(new Point(10, 0), new Point(16, 0));

        Piece apprentice = game.getPieces().byId("white-apprentice-1");
        assertEquals(new Point(16, 0), apprentice.getPosition());
        assertTrue(apprentice.isSwapUsed());
        assertEquals(new Point(10, 0), game.getPieces().wizardOf(Side.WHITE).getPosition());
        assertEquals("White Apprentice C9 ⇄ White Wizard I9", lastRecord());
    }

    // --- declines ---

    @Test
    void testDeclinedInputsLeaveGameUnchanged() {
        game = engine.newGame("room-1");

        assertFalse(engine.act(game, new Point(9, 0)));
        assertFalse(engine.deselect(game));
        assertFalse(engine.select(game, new Point(9, 0)));
        assertFalse(engine.select(game, new Point(6, 0)));
        assertFalse(engine.chooseWizardAttack(game, AttackMode.MELEE));
        assertFalse(engine.decideGuard(game, null));
        assertFalse(engine.chooseBardSwap(game, new Point(8, 4)));

        assertTrue(engine.select(game, new Point(10, 0)));
        assertFalse(engine.act(game, new Point(8, 0)));
        assertEquals(TurnPhase.SELECTED, game.getPhase());
        assertTrue(engine.deselect(game));

        assertEquals(TurnPhase.IDLE, game.getPhase());
        assertEquals(Side.WHITE, game.getCurrentSide());
        assertTrue(game.getHistory().isEmpty());
    }

    @Test
    void testDormantBardCannotBeSelected() {
        game = engine.newGame("room-1");

        assertFalse(engine.select(game, new Point(8, 4)));
    }

    // --- beam and wizard attacks ---

    @Test
    void testBeamShotKeepsWizardInPlace() {
        board.withWizards();
        board.place("white-apprentice-1", PieceType.APPRENTICE, Side.WHITE, 7, 8);
        board.place("black-ranger-1", PieceType.RANGER, Side.BLACK, 6, 8);

        play(board.sq(8, 8), board.sq(6, 8));

        assertNull(game.getPieces().byId("black-ranger-1"));
        assertEquals(board.sq(8, 8), game.getPieces().wizardOf(Side.WHITE).getPosition());
        assertEquals("White Wizard I9 ⚔ Black Ranger G9 (beam)", lastRecord());
        assertTrue(game.isCaptureOccurred());
        assertEquals(1, game.getCapturedPieces().get(Side.BLACK).size());
        assertEquals(Side.BLACK, game.getCurrentSide());
    }

    @Test
    void testAdjacentBeamTargetAsksForAttackMode() {
        Piece wizard = board.place("white-wizard-1", PieceType.WIZARD, Side.WHITE, 4, 6);
        board.place("black-wizard-1", PieceType.WIZARD, Side.BLACK, 0, 0);
        board.place("white-apprentice-1", PieceType.APPRENTICE, Side.WHITE, 3, 6);
        board.place("black-griffin-1", PieceType.GRIFFIN, Side.BLACK, 3, 7);

        play(board.sq(4, 6), board.sq(3, 7));

        assertEquals(TurnPhase.AWAITING_WIZARD_ATTACK_CHOICE, game.getPhase());
        assertEquals(Side.WHITE, game.getCurrentSide());
        assertTrue(engine.chooseWizardAttack(game, AttackMode.MELEE));

        assertNull(game.getPieces().byId("black-griffin-1"));
        assertEquals(board.sq(3, 7), wizard.getPosition());
        assertEquals(Side.BLACK, game.getCurrentSide());
    }

    @Test
    void testAdjacentBeamTargetShotFromRange() {
        Piece wizard = board.place("white-wizard-1", PieceType.WIZARD, Side.WHITE, 4, 6);
        board.place("black-wizard-1", PieceType.WIZARD, Side.BLACK, 0, 0);
        board.place("white-apprentice-1", PieceType.APPRENTICE, Side.WHITE, 3, 6);
        board.place("black-griffin-1", PieceType.GRIFFIN, Side.BLACK, 3, 7);

        play(board.sq(4, 6), board.sq(3, 7));
        assertTrue(engine.chooseWizardAttack(game, AttackMode.BEAM_SHOT));

        assertNull(game.getPieces().byId("black-griffin-1"));
        assertEquals(board.sq(4, 6), wizard.getPosition());
        assertTrue(lastRecord().endsWith("(beam)"));
    }

    // --- scorch ---

    @Test
    void testDragonTrailReplacedOnNextMove() {
        board.withWizards();
        Piece dragon = board.place("white-dragon-1", PieceType.DRAGON, Side.WHITE, 4, 4);

        play(board.sq(4, 4), board.sq(4, 2));

        assertEquals(List.of(board.sq(4, 4), board.sq(4, 3)), scorchedCells());
        assertEquals(dragon.getDragonTag(), game.getScorchMarks().get(0).dragonTag());

        play(board.sq(0, 0), board.sq(1, 0));
        assertEquals(2, game.getScorchMarks().size());

        play(board.sq(4, 2), board.sq(6, 0));

        assertEquals(List.of(board.sq(4, 2), board.sq(5, 1)), scorchedCells());
    }

    @Test
    void testCapturedDragonTakesItsTrail() {
        board.withWizards();
        board.place("white-dragon-1", PieceType.DRAGON, Side.WHITE, 4, 4);
        board.place("black-ranger-1", PieceType.RANGER, Side.BLACK, 3, 2);

        play(board.sq(4, 4), board.sq(4, 2));
        assertFalse(game.getScorchMarks().isEmpty());

        play(board.sq(3, 2), board.sq(4, 2));

        assertNull(game.getPieces().byId("white-dragon-1"));
        assertTrue(game.getScorchMarks().isEmpty());
    }

    private List<Point> scorchedCells() {
        return game.getScorchMarks().stream().map(ScorchMark::point).collect(Collectors.toList());
    }

    // --- guard ---

    private void setUpGuard() {
        board.withWizards();
        board.place("black-apprentice-1", PieceType.APPRENTICE, Side.BLACK, 4, 4);
        board.place("black-paladin-1", PieceType.PALADIN, Side.BLACK, 4, 3);
        board.place("white-ranger-1", PieceType.RANGER, Side.WHITE, 4, 5);
        play(board.sq(4, 5), board.sq(4, 4));
    }

    @Test
    void testAttackOnProtectedPieceWaitsForDefender() {
        setUpGuard();

        assertEquals(TurnPhase.AWAITING_GUARD_DECISION, game.getPhase());
        PendingGuard pending = ((GuardDecisionTurn) game.getTurn()).getPending();
        assertEquals(Side.BLACK, pending.getDefendingSide());
        assertEquals(List.of("black-paladin-1"), pending.getGuardianIds());
        assertEquals(AttackMode.MELEE, pending.getMode());
        assertEquals(Side.WHITE, game.getCurrentSide());
    }

    @Test
    void testGuardAccepted() {
        setUpGuard();

        assertTrue(engine.decideGuard(game, "black-paladin-1"));

        assertNull(game.getPieces().byId("black-paladin-1"));
        assertEquals(board.sq(4, 3), game.getPieces().byId("black-apprentice-1").getPosition());
        assertEquals(board.sq(4, 4), game.getPieces().byId("white-ranger-1").getPosition());
        Point lit = board.sq(4, 4);
        assertEquals(List.of(new GuardLight(lit.r(), lit.c(), Side.BLACK)), game.getGuardLights());
        assertEquals("White Ranger E6 ⚔ Black Apprentice E5 (guarded by Black Paladin E4)", lastRecord());
        assertEquals(Side.BLACK, game.getCurrentSide());

        play(board.sq(0, 0), board.sq(1, 0));
        assertEquals(1, game.getGuardLights().size());

        play(board.sq(8, 8), board.sq(8, 7));
        assertTrue(game.getGuardLights().isEmpty());
    }

    @Test
    void testGuardDeclined() {
        setUpGuard();

        assertTrue(engine.decideGuard(game, null));

        assertNull(game.getPieces().byId("black-apprentice-1"));
        assertNotNull(game.getPieces().byId("black-paladin-1"));
        assertEquals(board.sq(4, 4), game.getPieces().byId("white-ranger-1").getPosition());
        assertEquals("White Ranger E6 ⚔ Black Apprentice E5", lastRecord());
        assertTrue(game.getGuardLights().isEmpty());
    }

    @Test
    void testGuardByIneligiblePieceDeclined() {
        setUpGuard();

        assertFalse(engine.decideGuard(game, "white-ranger-1"));
        assertFalse(engine.decideGuard(game, "black-wizard-1"));
        assertFalse(engine.select(game, board.sq(8, 8)));

        assertEquals(TurnPhase.AWAITING_GUARD_DECISION, game.getPhase());
        assertNotNull(game.getPieces().byId("black-apprentice-1"));
    }

    private void scorch(Point cell) {
        game.getScorchMarks().add(new ScorchMark(cell.r(), cell.c(), "black-dragon-1"));
    }

    @Test
    void testPaladinOnScorchCannotGuard() {
        board.withWizards();
        board.place("black-apprentice-1", PieceType.APPRENTICE, Side.BLACK, 4, 4);
        board.place("black-paladin-1", PieceType.PALADIN, Side.BLACK, 4, 3);
        board.place("white-ranger-1", PieceType.RANGER, Side.WHITE, 4, 5);
        scorch(board.sq(4, 3));

        play(board.sq(4, 5), board.sq(4, 4));

        assertEquals(TurnPhase.IDLE, game.getPhase());
        assertNull(game.getPieces().byId("black-apprentice-1"));
        assertEquals(board.sq(4, 3), game.getPieces().byId("black-paladin-1").getPosition());
        assertEquals(board.sq(4, 4), game.getPieces().byId("white-ranger-1").getPosition());
        assertEquals("White Ranger E6 ⚔ Black Apprentice E5", lastRecord());
        assertEquals(Side.BLACK, game.getCurrentSide());
    }

    @Test
    void testPaladinOnScorchMayStillGuardAPaladin() {
        board.withWizards();
        Piece target = board.place("black-paladin-2", PieceType.PALADIN, Side.BLACK, 4, 4);
        board.place("black-paladin-1", PieceType.PALADIN, Side.BLACK, 4, 3);
        scorch(board.sq(4, 3));

        assertEquals(List.of("black-paladin-1"), engine.eligibleGuardians(game, target));
    }

    // --- winning ---

    @Test
    void testCapturingWizardEndsGame() {
        board.withWizards();
        board.place("white-ranger-1", PieceType.RANGER, Side.WHITE, 1, 0);

        play(board.sq(1, 0), board.sq(0, 0));

        assertEquals(Side.WHITE, game.getWinner());
        assertTrue(game.isOver());
        assertEquals(Side.WHITE, game.getCurrentSide());
        assertEquals(1, game.getTurnNumber());
        assertFalse(engine.select(game, board.sq(8, 8)));
        assertTrue(engine.candidatesFor(game, board.sq(8, 8)).isEmpty());
    }

    @Test
    void testCheckWinner() {
        PieceRegistry pieces = new PieceRegistry();
        assertNull(GameEngine.checkWinner(pieces));

        pieces.add(new Piece("white-wizard-1", PieceType.WIZARD, Side.WHITE, 16, 0));
        assertEquals(Side.WHITE, GameEngine.checkWinner(pieces));

        pieces.add(new Piece("black-wizard-1", PieceType.WIZARD, Side.BLACK, 0, 0));
        assertNull(GameEngine.checkWinner(pieces));
    }

    // --- bard ---

    @Test
    void testBardMoveForcesSwap() {
        board.withWizards();
        BoardFixture.activate(board.place("neutral-bard-1", PieceType.BARD, Side.NEUTRAL, 4, 4));
        board.place("white-ranger-1", PieceType.RANGER, Side.WHITE, 6, 6);

        play(board.sq(4, 4), board.sq(4, 5));

        assertEquals(TurnPhase.AWAITING_BARD_SWAP_TARGET, game.getPhase());
        assertEquals(List.of("white-ranger-1"), ((BardSwapTurn) game.getTurn()).getPartnerIds());
        assertEquals(Side.WHITE, game.getCurrentSide());
        assertFalse(engine.chooseBardSwap(game, board.sq(8, 8)));

        assertTrue(engine.chooseBardSwap(game, board.sq(6, 6)));

        assertEquals(board.sq(6, 6), game.getPieces().byId("neutral-bard-1").getPosition());
        assertEquals(board.sq(4, 5), game.getPieces().byId("white-ranger-1").getPosition());
        assertEquals("White Bard E6 ⇄ White Ranger G7", lastRecord());
        assertEquals(Side.BLACK, game.getCurrentSide());
    }

    @Test
    void testBardWithoutPartnersEndsTurn() {
        board.withWizards();
        BoardFixture.activate(board.place("neutral-bard-1", PieceType.BARD, Side.NEUTRAL, 4, 4));

        play(board.sq(4, 4), board.sq(4, 5));

        assertEquals(TurnPhase.IDLE, game.getPhase());
        assertEquals(Side.BLACK, game.getCurrentSide());
        assertEquals("White Bard E5 → E6", lastRecord());
    }

    @Test
    void testBardSkipsPartnerOnScorch() {
        board.withWizards();
        BoardFixture.activate(board.place("neutral-bard-1", PieceType.BARD, Side.NEUTRAL, 4, 4));
        board.place("white-paladin-1", PieceType.PALADIN, Side.WHITE, 6, 6);
        scorch(board.sq(6, 6));

        play(board.sq(4, 4), board.sq(4, 5));

        assertEquals(TurnPhase.IDLE, game.getPhase());
        assertEquals(Side.BLACK, game.getCurrentSide());
        assertEquals(board.sq(4, 5), game.getPieces().byId("neutral-bard-1").getPosition());
        assertEquals(board.sq(6, 6), game.getPieces().byId("white-paladin-1").getPosition());
    }

    @Test
    void testBardSwapOffersOnlyPartnersOffScorch() {
        board.withWizards();
        BoardFixture.activate(board.place("neutral-bard-1", PieceType.BARD, Side.NEUTRAL, 4, 4));
        board.place("white-paladin-1", PieceType.PALADIN, Side.WHITE, 6, 6);
        board.place("white-ranger-1", PieceType.RANGER, Side.WHITE, 2, 2);
        scorch(board.sq(6, 6));

        play(board.sq(4, 4), board.sq(4, 5));

        assertEquals(TurnPhase.AWAITING_BARD_SWAP_TARGET, game.getPhase());
        assertEquals(List.of("white-ranger-1"), ((BardSwapTurn) game.getTurn()).getPartnerIds());
        assertFalse(engine.chooseBardSwap(game, board.sq(6, 6)));
    }

    @Test
    void testMovingOntoHiddenAssassinCapturesIt() {
        board.withWizards();
        Piece bard = board.place("neutral-bard-1", PieceType.BARD, Side.NEUTRAL, 0, 8);
        BoardFixture.hide(board.place("black-assassin-1", PieceType.ASSASSIN, Side.BLACK, 4, 5));
        board.place("white-ranger-1", PieceType.RANGER, Side.WHITE, 4, 6);

        assertTrue(engine.candidatesFor(game, board.sq(4, 6)).contains(CandidateAction.move(board.sq(4, 5))));
        play(board.sq(4, 6), board.sq(4, 5));

        assertNull(game.getPieces().byId("black-assassin-1"));
        assertEquals("White Ranger E7 ⚔ Black Assassin E6", lastRecord());
        assertTrue(game.isCaptureOccurred());
        assertTrue(bard.isActivated());
    }

    // --- stealth ---

    @Test
    void testAssassinStaysHiddenThroughOpponentTurn() {
        board.withWizards();
        Piece assassin = board.place("white-assassin-1", PieceType.ASSASSIN, Side.WHITE, 4, 4);

        play(board.sq(4, 4), board.sq(2, 5));

        assertTrue(assassin.isStealthed());
        assertNull(game.getPieces().visiblePieceAt(board.sq(2, 5), Side.BLACK));
        MoveRecord record = game.getHistory().get(0);
        assertEquals("White Assassin E5 → C6", record.getWhiteView());
        assertEquals("White Assassin moves unseen", record.getBlackView());

        play(board.sq(0, 0), board.sq(1, 0));

        assertTrue(assassin.isStealthed());
        assertNull(game.getPieces().visiblePieceAt(board.sq(2, 5), Side.BLACK));
        assertEquals(Side.WHITE, game.getCurrentSide());
    }

    @Test
    void testLeavingStealthStaysHiddenUntilOpponentTurnEnds() {
        board.withWizards();
        Piece assassin = board.place("white-assassin-1", PieceType.ASSASSIN, Side.WHITE, 4, 4);
        play(board.sq(4, 4), board.sq(2, 5));
        play(board.sq(0, 0), board.sq(1, 0));

        play(board.sq(2, 5), board.sq(4, 4));

        assertTrue(assassin.isStealthed());
        assertEquals(Side.BLACK, ((AssassinTraits) assassin.getTraits()).getStealthExpiresOn());
        assertNull(game.getPieces().visiblePieceAt(board.sq(4, 4), Side.BLACK));
        assertEquals("White Assassin moves unseen", game.getHistory().get(2).getBlackView());
        assertEquals("White Assassin C6 → E5", game.getHistory().get(2).getWhiteView());

        play(board.sq(1, 0), board.sq(0, 0));

        assertFalse(assassin.isStealthed());
        assertSame(assassin, game.getPieces().visiblePieceAt(board.sq(4, 4), Side.BLACK));
    }

    @Test
    void testOpposingPaladinExposesAssassin() {
        board.withWizards();
        Piece assassin = board.place("white-assassin-1", PieceType.ASSASSIN, Side.WHITE, 4, 4);
        board.place("black-paladin-1", PieceType.PALADIN, Side.BLACK, 1, 5);

        play(board.sq(4, 4), board.sq(2, 5));

        assertFalse(assassin.isStealthed());
        assertEquals("White Assassin E5 → C6", game.getHistory().get(0).getBlackView());
    }
}
