package com.example.wizardchess.logic;

import com.example.wizardchess.logic.movegen.BardRule;
import com.example.wizardchess.logic.movegen.MoveGenerator;
import com.example.wizardchess.logic.movegen.PaladinRule;
import com.example.wizardchess.model.domain.*;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Objects;

/**
 * Pure Java class containing all game rules and the turn state machine.
 * Stateless apart from the board geometry; callers confine or synchronize the {@link Game}.
 * <p>
 * Every entry point returns {@code true} when the input was applied and {@code false}
 * when it was declined, in which case the game is left as it was.
 */
@Slf4j
public class GameEngine {

    private final BoardGraph graph;
    private final BeamTracer beamTracer;
    private final MoveGenerator moveGenerator;

    public GameEngine() {
        this(new BoardGraph());
    }

    public GameEngine(BoardGraph graph) {
        this.graph = graph;
        this.beamTracer = new BeamTracer();
        this.moveGenerator = new MoveGenerator(beamTracer);
    }

    public BoardGraph getGraph() {
        return graph;
    }

    public Game newGame(String roomKey) {
        Game game = new Game(roomKey);
        startGame(game);
        return game;
    }

    /**
     * Puts the starting position on the board and forgets the previous game. Seats are kept.
     */
    public void startGame(Game game) {
        game.setPieces(InitialLayout.create());
        game.setCurrentSide(Side.WHITE);
        game.setTurnNumber(1);
        game.setTurn(new IdleTurn());
        game.setCaptureOccurred(false);
        game.setScorchMarks(new ArrayList<>());
        game.setGuardLights(new ArrayList<>());
        game.setHistory(new ArrayList<>());
        game.setCapturedPieces(new EnumMap<>(Side.class));
        game.setWinner(null);
    }

    public BoardView view(Game game) {
        return BoardView.of(graph, game);
    }

    /**
     * The side a piece acts for: its own, or the side on the move for neutral pieces.
     */
    public Side actingSide(Game game, Piece piece) {
        return piece.getSide().isPlayer() ? piece.getSide() : game.getCurrentSide();
    }

    public boolean canControl(Game game, Piece piece) {
        return piece.getSide() == game.getCurrentSide() || piece.getSide() == Side.NEUTRAL;
    }

    public List<CandidateAction> candidatesFor(Game game, Point cell) {
        if (game.isOver()) {
            return Collections.emptyList();
        }
        Piece piece = game.getPieces().visiblePieceAt(cell, game.getCurrentSide());
        if (piece == null || !canControl(game, piece)) {
            return Collections.emptyList();
        }
        return moveGenerator.candidates(piece, game.getCurrentSide(), view(game));
    }

    public BeamTrace traceBeam(Game game, Piece wizard) {
        return beamTracer.trace(wizard, view(game));
    }

    // --- selection ---

    public boolean select(Game game, Point cell) {
        if (game.isOver()) {
            return decline("game is over");
        }
        TurnPhase phase = game.getPhase();
        if (phase != TurnPhase.IDLE && phase != TurnPhase.SELECTED) {
            return decline("cannot select while {}", phase);
        }
        Piece piece = game.getPieces().visiblePieceAt(cell, game.getCurrentSide());
        if (piece == null || !canControl(game, piece)) {
            return decline("nothing selectable at {}", cell);
        }
        List<CandidateAction> candidates = candidatesFor(game, cell);
        if (candidates.isEmpty()) {
            return decline("{} has no candidate actions", piece.getId());
        }
        game.setTurn(new SelectedTurn(piece.getId(), new ArrayList<>(candidates)));
        return true;
    }

    public boolean deselect(Game game) {
        if (game.getPhase() != TurnPhase.SELECTED) {
            return decline("nothing selected");
        }
        game.setTurn(new IdleTurn());
        return true;
    }

    /**
     * Applies the candidate action of the selected piece that targets {@code cell}.
     */
    public boolean act(Game game, Point cell) {
        if (game.getPhase() != TurnPhase.SELECTED) {
            return decline("act without selection");
        }
        SelectedTurn selected = (SelectedTurn) game.getTurn();
        Piece piece = game.getPieces().byId(selected.getPieceId());
        if (piece == null) {
            return decline("selected piece {} is gone", selected.getPieceId());
        }
        CandidateAction action = null;
        for (CandidateAction candidate : selected.getCandidates()) {
            if (candidate.r() == cell.r() && candidate.c() == cell.c()) {
                action = candidate;
                break;
            }
        }
        if (action == null) {
            return decline("{} is not a candidate for {}", cell, piece.getId());
        }
        Side acting = actingSide(game, piece);
        switch (action.type()) {
            case MOVE:
                return resolveMove(game, piece, acting, cell);
            case SWAP:
                return resolveSwap(game, piece, acting, cell);
            case ATTACK:
                if (piece.is(PieceType.WIZARD)) {
                    if (graph.adjacent(piece.getPosition(), cell) && view(game).canStop(cell, piece, acting)) {
                        game.setTurn(new WizardAttackChoiceTurn(piece.getId(), cell.r(), cell.c()));
                        return true;
                    }
                    return beginAttack(game, piece, cell, AttackMode.BEAM_SHOT);
                }
                return beginAttack(game, piece, cell, AttackMode.MELEE);
            default:
                return decline("unknown action {}", action.type());
        }
    }

    public boolean chooseWizardAttack(Game game, AttackMode mode) {
        if (game.getPhase() != TurnPhase.AWAITING_WIZARD_ATTACK_CHOICE || mode == null) {
            return decline("no wizard attack to choose");
        }
        WizardAttackChoiceTurn choice = (WizardAttackChoiceTurn) game.getTurn();
        Piece wizard = game.getPieces().byId(choice.getWizardId());
        if (wizard == null) {
            return decline("wizard {} is gone", choice.getWizardId());
        }
        return beginAttack(game, wizard, choice.targetCell(), mode);
    }

    /**
     * Defending side's answer to a pending guard: a paladin id to intercept, or {@code null} to decline.
     */
    public boolean decideGuard(Game game, String paladinId) {
        if (game.getPhase() != TurnPhase.AWAITING_GUARD_DECISION) {
            return decline("no pending guard");
        }
        PendingGuard pending = ((GuardDecisionTurn) game.getTurn()).getPending();
        Piece attacker = game.getPieces().byId(pending.getAttackerId());
        Piece target = game.getPieces().byId(pending.getTargetId());
        if (attacker == null || target == null) {
            return decline("pending guard refers to missing pieces");
        }
        if (paladinId == null) {
            resolveCapture(game, attacker, target, pending.getMode());
            return true;
        }
        Piece paladin = game.getPieces().byId(paladinId);
        if (paladin == null || !pending.getGuardianIds().contains(paladinId)) {
            return decline("{} cannot guard", paladinId);
        }
        resolveGuard(game, attacker, target, paladin, pending.getMode());
        return true;
    }

    public boolean chooseBardSwap(Game game, Point cell) {
        if (game.getPhase() != TurnPhase.AWAITING_BARD_SWAP_TARGET) {
            return decline("no bard swap pending");
        }
        BardSwapTurn swap = (BardSwapTurn) game.getTurn();
        Piece bard = game.getPieces().byId(swap.getBardId());
        Piece partner = game.getPieces().pieceAt(cell);
        if (bard == null || partner == null || !swap.getPartnerIds().contains(partner.getId())) {
            return decline("{} is not a bard swap partner", cell);
        }
        Side acting = game.getCurrentSide();
        Point bardCell = bard.getPosition();
        Point partnerCell = partner.getPosition();
        bard.moveTo(partnerCell);
        partner.moveTo(bardCell);
        StealthRules.reveal(partner);
        afterRelocation(game, partner);
        afterRelocation(game, bard);
        String full = String.format("%s %s ⇄ %s %s", name(bard, acting), graph.label(bardCell),
                partner.getDisplayName(), graph.label(partnerCell));
        record(game, acting, full, full);
        finishTurn(game, null);
        return true;
    }

    // --- resolution ---

    private boolean resolveMove(Game game, Piece piece, Side acting, Point dest) {
        Point from = piece.getPosition();
        boolean wasHidden = piece.isStealthed();
        Piece hidden = game.getPieces().pieceAt(dest);
        if (hidden != null && hidden.is(PieceType.BARD)) {
            return decline("a bard at {} cannot be taken", dest);
        }
        if (hidden != null) {
            capture(game, hidden);
        }
        if (piece.is(PieceType.DRAGON)) {
            layScorch(game, piece, from, dest);
        }
        piece.moveTo(dest);
        StealthRules.updateStealth(graph, piece, from, dest);
        if (hidden != null) {
            StealthRules.reveal(piece);
        }
        afterRelocation(game, piece);

        String full;
        String redacted;
        if (hidden != null) {
            full = String.format("%s %s ⚔ %s %s", name(piece, acting), graph.label(from),
                    hidden.getDisplayName(), graph.label(dest));
            redacted = full;
        } else {
            full = String.format("%s %s → %s", name(piece, acting), graph.label(from), graph.label(dest));
            boolean unseen = piece.is(PieceType.ASSASSIN) && (wasHidden || piece.isStealthed());
            redacted = unseen ? name(piece, acting) + " moves unseen" : full;
        }
        record(game, acting, full, redacted);

        if (piece.is(PieceType.BARD)) {
            List<String> partners = bardPartners(game, acting);
            if (!partners.isEmpty() && checkWinner(game.getPieces()) == null) {
                game.setTurn(new BardSwapTurn(piece.getId(), partners));
                return true;
            }
        }
        finishTurn(game, null);
        return true;
    }

    private boolean resolveSwap(Game game, Piece piece, Side acting, Point cell) {
        Piece partner = game.getPieces().pieceAt(cell);
        if (partner == null || partner == piece) {
            return decline("no swap partner at {}", cell);
        }
        Point a = piece.getPosition();
        Point b = partner.getPosition();
        piece.moveTo(b);
        partner.moveTo(a);
        markSwapUsed(piece.is(PieceType.APPRENTICE) ? piece : partner);
        StealthRules.reveal(piece);
        StealthRules.reveal(partner);
        afterRelocation(game, piece);
        afterRelocation(game, partner);
        String full = String.format("%s %s ⇄ %s %s", name(piece, acting), graph.label(a),
                partner.getDisplayName(), graph.label(b));
        record(game, acting, full, full);
        finishTurn(game, null);
        return true;
    }

    private boolean beginAttack(Game game, Piece attacker, Point cell, AttackMode mode) {
        Piece target = game.getPieces().pieceAt(cell);
        if (target == null || target == attacker) {
            return decline("nothing to attack at {}", cell);
        }
        List<String> guardians = eligibleGuardians(game, target);
        if (!guardians.isEmpty()) {
            PendingGuard pending = new PendingGuard(attacker.getId(), target.getId(), cell.r(), cell.c(),
                    target.getSide(), guardians, mode);
            game.setTurn(new GuardDecisionTurn(pending));
            return true;
        }
        resolveCapture(game, attacker, target, mode);
        return true;
    }

    /**
     * Paladins of the target's side, other than the target, whose protection zone covers it.
     * A paladin on scorch cannot take a guarded piece onto its cell unless that piece is
     * itself a paladin.
     */
    public List<String> eligibleGuardians(Game game, Piece target) {
        List<String> ids = new ArrayList<>();
        if (!target.getSide().isPlayer() || target.is(PieceType.BARD)) {
            return ids;
        }
        BoardView view = view(game);
        for (Piece piece : game.getPieces().ofSide(target.getSide())) {
            if (piece.is(PieceType.PALADIN) && !piece.getId().equals(target.getId())
                    && (target.is(PieceType.PALADIN) || !view.isScorched(piece.getPosition()))
                    && PaladinRule.protectionZone(graph, piece.getPosition()).contains(target.getPosition())) {
                ids.add(piece.getId());
            }
        }
        return ids;
    }

    private void resolveCapture(Game game, Piece attacker, Piece target, AttackMode mode) {
        Side acting = actingSide(game, attacker);
        Point from = attacker.getPosition();
        Point cell = target.getPosition();
        String prefix = String.format("%s %s ⚔ %s %s", name(attacker, acting), graph.label(from),
                target.getDisplayName(), graph.label(cell));

        if (target.is(PieceType.BARD)) {
            String full = prefix + " (no effect)";
            record(game, acting, full, full);
            finishTurn(game, null);
            return;
        }
        capture(game, target);
        if (mode == AttackMode.MELEE) {
            relocateAttacker(game, attacker, from, cell);
        }
        String full = mode == AttackMode.BEAM_SHOT ? prefix + " (beam)" : prefix;
        record(game, acting, full, full);
        finishTurn(game, null);
    }

    private void resolveGuard(Game game, Piece attacker, Piece target, Piece paladin, AttackMode mode) {
        Side acting = actingSide(game, attacker);
        Point attackerFrom = attacker.getPosition();
        Point targetCell = target.getPosition();
        Point paladinCell = paladin.getPosition();

        capture(game, paladin);
        target.moveTo(paladinCell);
        StealthRules.updateStealth(graph, target, targetCell, paladinCell);
        if (mode == AttackMode.MELEE) {
            relocateAttacker(game, attacker, attackerFrom, targetCell);
        }
        afterRelocation(game, target);

        String full = String.format("%s %s ⚔ %s %s (guarded by %s %s)", name(attacker, acting),
                graph.label(attackerFrom), target.getDisplayName(), graph.label(targetCell),
                paladin.getDisplayName(), graph.label(paladinCell));
        record(game, acting, full, full);
        finishTurn(game, new GuardLight(targetCell.r(), targetCell.c(), paladin.getSide()));
    }

    private void relocateAttacker(Game game, Piece attacker, Point from, Point to) {
        if (attacker.is(PieceType.DRAGON)) {
            layScorch(game, attacker, from, to);
        }
        attacker.moveTo(to);
        StealthRules.updateStealth(graph, attacker, from, to);
        // taking a piece always exposes an assassin
        StealthRules.reveal(attacker);
        afterRelocation(game, attacker);
    }

    private void capture(Game game, Piece victim) {
        game.getPieces().remove(victim.getId());
        game.recordCapture(victim);
        if (victim.is(PieceType.DRAGON)) {
            String tag = victim.getDragonTag();
            game.getScorchMarks().removeIf(mark -> Objects.equals(mark.dragonTag(), tag));
        }
        game.setCaptureOccurred(true);
        for (Piece piece : game.getPieces().ofType(PieceType.BARD)) {
            if (piece.getTraits() instanceof BardTraits) {
                ((BardTraits) piece.getTraits()).setActivated(true);
            }
        }
    }

    private void afterRelocation(Game game, Piece piece) {
        if (piece.is(PieceType.PALADIN)) {
            Point at = piece.getPosition();
            game.getScorchMarks().removeIf(mark -> mark.r() == at.r() && mark.c() == at.c());
            game.getGuardLights().removeIf(light -> light.r() == at.r() && light.c() == at.c());
            List<Point> zone = PaladinRule.protectionZone(graph, at);
            for (Piece other : game.getPieces().ofSide(piece.getSide().opponent())) {
                if (other.isStealthed() && zone.contains(other.getPosition())) {
                    StealthRules.reveal(other);
                }
            }
        }
        if (piece.isStealthed() && insideOpposingZone(game, piece)) {
            StealthRules.reveal(piece);
        }
    }

    private boolean insideOpposingZone(Game game, Piece piece) {
        for (Piece paladin : game.getPieces().ofSide(piece.getSide().opponent())) {
            if (paladin.is(PieceType.PALADIN)
                    && PaladinRule.protectionZone(graph, paladin.getPosition()).contains(piece.getPosition())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Replaces the dragon's previous trail with the cells it left behind on this move:
     * the origin and every cell crossed, the destination excluded.
     */
    private void layScorch(Game game, Piece dragon, Point from, Point to) {
        String tag = dragon.getDragonTag();
        game.getScorchMarks().removeIf(mark -> Objects.equals(mark.dragonTag(), tag));
        for (Point p : trail(from, to)) {
            game.getScorchMarks().add(new ScorchMark(p.r(), p.c(), tag));
        }
    }

    List<Point> trail(Point from, Point to) {
        for (Direction dir : Direction.values()) {
            List<Point> cells = new ArrayList<>();
            Point cur = from;
            while (cur != null && !cur.equals(to)) {
                cells.add(cur);
                cur = graph.step(cur, dir);
            }
            if (cur != null) {
                return cells;
            }
        }
        return Collections.singletonList(from);
    }

    private void markSwapUsed(Piece apprentice) {
        if (apprentice.getTraits() instanceof ApprenticeTraits) {
            ((ApprenticeTraits) apprentice.getTraits()).setSwapUsed(true);
        }
    }

    /** The bard lands on the partner's cell, so partners on scorch are skipped. */
    private List<String> bardPartners(Game game, Side acting) {
        List<String> ids = new ArrayList<>();
        BoardView view = view(game);
        for (Piece piece : game.getPieces().all()) {
            if (BardRule.isSwapPartner(piece, acting) && !view.isScorched(piece.getPosition())) {
                ids.add(piece.getId());
            }
        }
        return ids;
    }

    // --- handoff ---

    /**
     * Win check, then handoff: stealth due on the finished side lapses, the incoming side's
     * guard lights are lifted, a fresh guard light (if any) is laid, and the turn passes.
     */
    private void finishTurn(Game game, GuardLight newLight) {
        Side winner = checkWinner(game.getPieces());
        if (winner != null) {
            game.setWinner(winner);
            if (newLight != null) {
                game.getGuardLights().add(newLight);
            }
            game.setTurn(new IdleTurn());
            log.debug("Room {}: {} wins on turn {}", game.getRoomKey(), winner, game.getTurnNumber());
            return;
        }
        Side finished = game.getCurrentSide();
        Side incoming = finished.opponent();
        StealthRules.expire(game.getPieces().all(), finished);
        game.getGuardLights().removeIf(light -> light.createdBy() == incoming);
        if (newLight != null) {
            game.getGuardLights().add(newLight);
        }
        game.setCurrentSide(incoming);
        game.setTurnNumber(game.getTurnNumber() + 1);
        game.setTurn(new IdleTurn());
    }

    /**
     * The side still holding its wizard when the other side has lost its own, else {@code null}.
     */
    public static Side checkWinner(PieceRegistry pieces) {
        boolean white = pieces.wizardOf(Side.WHITE) != null;
        boolean black = pieces.wizardOf(Side.BLACK) != null;
        if (white && !black) {
            return Side.WHITE;
        }
        if (black && !white) {
            return Side.BLACK;
        }
        return null;
    }

    private void record(Game game, Side acting, String full, String redactedForOpponent) {
        String whiteView = acting == Side.WHITE ? full : redactedForOpponent;
        String blackView = acting == Side.BLACK ? full : redactedForOpponent;
        game.getHistory().add(new MoveRecord(game.getTurnNumber(), acting, full, whiteView, blackView,
                System.currentTimeMillis()));
    }

    private String name(Piece piece, Side acting) {
        Side shown = piece.getSide().isPlayer() ? piece.getSide() : acting;
        return shown.getDisplayName() + " " + piece.getType().getDisplayName();
    }

    private boolean decline(String reason, Object... args) {
        if (log.isDebugEnabled()) {
            log.debug("Declined: " + reason, args);
        }
        return false;
    }
}
