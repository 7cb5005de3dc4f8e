package com.example.wizardchess.service;

import com.example.wizardchess.config.GameProperties;
import com.example.wizardchess.logic.GameEngine;
import com.example.wizardchess.model.domain.*;
import com.example.wizardchess.model.dto.GameStateDTO;
import com.example.wizardchess.model.dto.MoveRequest;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Engine-backed rooms: one authoritative {@link Game} per room key. Unlike the bare relay,
 * every step is checked for seat ownership, readiness and version before it reaches the engine,
 * and each accepted step is pushed into the relay room as a regular state frame.
 */
@Slf4j
@Service
public class GameService {

    private final Map<String, Game> activeGames = new ConcurrentHashMap<>();
    private final RoomRelayService relayService;
    private final SnapshotCodec snapshotCodec;
    private final GameProperties properties;
    private final GameEngine gameEngine;

    public GameService(RoomRelayService relayService, SnapshotCodec snapshotCodec, GameProperties properties) {
        this.relayService = relayService;
        this.snapshotCodec = snapshotCodec;
        this.properties = properties;
        this.gameEngine = new GameEngine();
    }

    public Game findOrCreateGame(String roomKey) {
        return activeGames.computeIfAbsent(roomKey, key -> {
            log.info("Starting engine-backed game in room \"{}\"", key);
            return gameEngine.newGame(key);
        });
    }

    public GameStateDTO getState(String roomKey, Side viewer) {
        Game game = findOrCreateGame(roomKey);
        synchronized (game) {
            return mapToDTO(game, viewer, true, null);
        }
    }

    public List<CandidateAction> candidates(String roomKey, int r, int c) {
        Game game = findOrCreateGame(roomKey);
        synchronized (game) {
            return gameEngine.candidatesFor(game, new Point(r, c));
        }
    }

    /**
     * Beam path of {@code side}'s wizard as the engine traces it right now; empty when that wizard is gone.
     */
    public List<Point> beamPath(String roomKey, Side side) {
        Game game = findOrCreateGame(roomKey);
        synchronized (game) {
            Piece wizard = game.getPieces().wizardOf(side);
            if (wizard == null) {
                return List.of();
            }
            return gameEngine.traceBeam(game, wizard).path();
        }
    }

    // --- seats ---

    public GameStateDTO takeSeat(String roomKey, MoveRequest request) {
        String playerId = requirePlayer(request);
        Side side = request.getSide();
        if (side == null || !side.isPlayer()) {
            throw new IllegalArgumentException("Seat must be WHITE or BLACK");
        }
        Game game = findOrCreateGame(roomKey);
        synchronized (game) {
            checkVersion(game, request);
            String holder = game.getSeats().get(side);
            if (holder != null && !holder.equals(playerId)) {
                throw new IllegalStateException(side.getDisplayName() + " seat is taken");
            }
            if (playerId.equals(game.getSeats().get(side.opponent()))) {
                throw new IllegalStateException("Player " + playerId + " already sits on the other side");
            }
            game.getSeats().put(side, playerId);
            return commit(game, side, playerId + " sits as " + side.getDisplayName());
        }
    }

    public GameStateDTO ready(String roomKey, MoveRequest request) {
        String playerId = requirePlayer(request);
        Game game = findOrCreateGame(roomKey);
        synchronized (game) {
            checkVersion(game, request);
            Side side = seatOf(game, playerId);
            game.getReady().put(side, Boolean.TRUE);
            String message = bothReady(game)
                    ? "Both players ready, " + game.getCurrentSide().getDisplayName() + " to move"
                    : side.getDisplayName() + " is ready";
            return commit(game, side, message);
        }
    }

    // --- turn steps ---

    public GameStateDTO select(String roomKey, MoveRequest request) {
        return step(roomKey, request, Game::getCurrentSide,
                game -> gameEngine.select(game, request.getCell()), "Piece selected");
    }

    public GameStateDTO deselect(String roomKey, MoveRequest request) {
        return step(roomKey, request, Game::getCurrentSide, gameEngine::deselect, "Selection cleared");
    }

    public GameStateDTO act(String roomKey, MoveRequest request) {
        return step(roomKey, request, Game::getCurrentSide,
                game -> gameEngine.act(game, request.getCell()), null);
    }

    public GameStateDTO wizardAttack(String roomKey, MoveRequest request) {
        if (request.getAttackMode() == null) {
            throw new IllegalArgumentException("attackMode is required");
        }
        return step(roomKey, request, Game::getCurrentSide,
                game -> gameEngine.chooseWizardAttack(game, request.getAttackMode()), null);
    }

    /**
     * Guard decisions belong to the defending side, not the side on the move.
     */
    public GameStateDTO guard(String roomKey, MoveRequest request) {
        return step(roomKey, request, this::decidingSideForGuard,
                game -> gameEngine.decideGuard(game, request.getPaladinId()), null);
    }

    public GameStateDTO bardSwap(String roomKey, MoveRequest request) {
        return step(roomKey, request, Game::getCurrentSide,
                game -> gameEngine.chooseBardSwap(game, request.getCell()), null);
    }

    // --- whole-game operations ---

    /**
     * Replaces the room's game with one rebuilt from {@code snapshot}. Seats stay as they are.
     */
    public GameStateDTO loadSnapshot(String roomKey, String playerId, JsonNode snapshot) {
        Game restored = snapshotCodec.fromTree(snapshot);
        Game game = findOrCreateGame(roomKey);
        synchronized (game) {
            seatOf(game, playerId);
            restored.setRoomKey(roomKey);
            restored.setVersion(game.getVersion());
            restored.setSeats(game.getSeats());
            restored.setReady(game.getReady());
            activeGames.put(roomKey, restored);
            log.info("Room \"{}\" restored from snapshot by {}", roomKey, playerId);
            return commit(restored, seatOf(restored, playerId), "Snapshot loaded");
        }
    }

    public GameStateDTO reset(String roomKey, MoveRequest request) {
        String playerId = requirePlayer(request);
        Game game = findOrCreateGame(roomKey);
        synchronized (game) {
            checkVersion(game, request);
            Side side = seatOf(game, playerId);
            gameEngine.startGame(game);
            game.getReady().clear();
            log.info("Room \"{}\" reset by {}", roomKey, playerId);
            return commit(game, side, "Game reset");
        }
    }

    public Game findGame(String roomKey) {
        return activeGames.get(roomKey);
    }

    // --- helpers ---

    private GameStateDTO step(String roomKey, MoveRequest request, Function<Game, Side> decider,
                              Predicate<Game> action, String acceptedMessage) {
        String playerId = requirePlayer(request);
        Game game = findOrCreateGame(roomKey);
        synchronized (game) {
            checkVersion(game, request);
            if (game.isOver()) {
                throw new IllegalStateException("Game is over, " + game.getWinner().getDisplayName() + " won");
            }
            if (properties.isRequireReadySeats() && !bothReady(game)) {
                throw new IllegalStateException("Game has not started, both seats must be ready");
            }
            Side side = decider.apply(game);
            String holder = game.getSeats().get(side);
            if (!playerId.equals(holder)) {
                throw new IllegalStateException("It is not " + playerId + "'s decision, waiting on "
                        + side.getDisplayName());
            }
            if (!action.test(game)) {
                return mapToDTO(game, side, false, "Action declined");
            }
            return commit(game, seatOf(game, playerId), acceptedMessage != null ? acceptedMessage : describe(game));
        }
    }

    private GameStateDTO commit(Game game, Side viewer, String message) {
        game.setVersion(game.getVersion() + 1);
        broadcast(game);
        return mapToDTO(game, viewer, true, message);
    }

    private void broadcast(Game game) {
        int delivered = relayService.publish(game.getRoomKey(), snapshotCodec.toTree(game));
        log.debug("Room \"{}\" v{} broadcast to {} session(s)", game.getRoomKey(), game.getVersion(), delivered);
    }

    private Side decidingSideForGuard(Game game) {
        if (game.getTurn() instanceof GuardDecisionTurn) {
            return ((GuardDecisionTurn) game.getTurn()).getPending().getDefendingSide();
        }
        return game.getCurrentSide().opponent();
    }

    private void checkVersion(Game game, MoveRequest request) {
        Long expected = request.getExpectedVersion();
        if (expected != null && expected != game.getVersion()) {
            throw new IllegalStateException("Stale version " + expected + ", room is at " + game.getVersion());
        }
    }

    private boolean bothReady(Game game) {
        return game.getSeats().containsKey(Side.WHITE) && game.getSeats().containsKey(Side.BLACK)
                && game.isSeatReady(Side.WHITE) && game.isSeatReady(Side.BLACK);
    }

    private Side seatOf(Game game, String playerId) {
        for (Map.Entry<Side, String> seat : game.getSeats().entrySet()) {
            if (seat.getValue().equals(playerId)) {
                return seat.getKey();
            }
        }
        throw new IllegalArgumentException("Player " + playerId + " has no seat in room " + game.getRoomKey());
    }

    private String requirePlayer(MoveRequest request) {
        if (request == null || request.getPlayerId() == null || request.getPlayerId().isBlank()) {
            throw new IllegalArgumentException("playerId is required");
        }
        return request.getPlayerId();
    }

    private String describe(Game game) {
        if (game.isOver()) {
            return game.getWinner().getDisplayName() + " wins";
        }
        switch (game.getPhase()) {
            case AWAITING_GUARD_DECISION:
                return "Waiting for " + decidingSideForGuard(game).getDisplayName() + " to guard or decline";
            case AWAITING_WIZARD_ATTACK_CHOICE:
                return "Choose beam shot or melee";
            case AWAITING_BARD_SWAP_TARGET:
                return "Choose a piece to swap with the bard";
            default:
                return game.getCurrentSide().getDisplayName() + " to move";
        }
    }

    private GameStateDTO mapToDTO(Game game, Side viewer, boolean accepted, String message) {
        GameStateDTO dto = new GameStateDTO();
        dto.setRoomKey(game.getRoomKey());
        dto.setAccepted(accepted);
        dto.setVersion(game.getVersion());
        dto.setPhase(game.getPhase());
        dto.setCurrentSide(game.getCurrentSide());
        dto.setTurnNumber(game.getTurnNumber());
        dto.setWinner(game.getWinner());
        dto.setStatusMessage(message != null ? message : describe(game));
        dto.setHistory(game.getHistory().stream()
                .map(record -> viewer == null ? record.getFull() : record.viewFor(viewer))
                .collect(Collectors.toList()));
        // the snapshot holds every hidden piece, so only the unfiltered view carries it
        if (viewer == null) {
            dto.setSnapshot(snapshotCodec.toTree(game));
        }
        return dto;
    }
}
