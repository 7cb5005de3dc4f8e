package com.example.wizardchess.controller;

import com.example.wizardchess.model.domain.CandidateAction;
import com.example.wizardchess.model.domain.Point;
import com.example.wizardchess.model.domain.Side;
import com.example.wizardchess.model.dto.GameStateDTO;
import com.example.wizardchess.model.dto.MoveRequest;
import com.example.wizardchess.service.GameService;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST surface of the engine-backed rooms. Every POST names the acting player in its body.
 * <p>
 * Responses for a seated side carry that side's redacted history and no snapshot; only
 * {@code /state} without a viewer returns the full snapshot. Relay frames published after
 * each accepted step carry the full, unredacted snapshot to every room member.
 */
@RestController
@RequestMapping("/api/rooms/{roomKey}")
public class GameController {

    private final GameService gameService;

    public GameController(GameService gameService) {
        this.gameService = gameService;
    }

    @GetMapping("/state")
    public ResponseEntity<GameStateDTO> getState(@PathVariable String roomKey,
                                                 @RequestParam(required = false) Side viewer) {
        return ResponseEntity.ok(gameService.getState(roomKey, viewer));
    }

    @GetMapping("/candidates")
    public ResponseEntity<List<CandidateAction>> getCandidates(@PathVariable String roomKey,
                                                               @RequestParam int row,
                                                               @RequestParam int col) {
        return ResponseEntity.ok(gameService.candidates(roomKey, row, col));
    }

    @GetMapping("/beam")
    public ResponseEntity<List<Point>> getBeam(@PathVariable String roomKey, @RequestParam Side side) {
        return ResponseEntity.ok(gameService.beamPath(roomKey, side));
    }

    @PostMapping("/seat")
    public ResponseEntity<GameStateDTO> takeSeat(@PathVariable String roomKey, @RequestBody MoveRequest request) {
        return ResponseEntity.ok(gameService.takeSeat(roomKey, request));
    }

    @PostMapping("/ready")
    public ResponseEntity<GameStateDTO> ready(@PathVariable String roomKey, @RequestBody MoveRequest request) {
        return ResponseEntity.ok(gameService.ready(roomKey, request));
    }

    @PostMapping("/select")
    public ResponseEntity<GameStateDTO> select(@PathVariable String roomKey, @RequestBody MoveRequest request) {
        return ResponseEntity.ok(gameService.select(roomKey, request));
    }

    @PostMapping("/deselect")
    public ResponseEntity<GameStateDTO> deselect(@PathVariable String roomKey, @RequestBody MoveRequest request) {
        return ResponseEntity.ok(gameService.deselect(roomKey, request));
    }

    @PostMapping("/act")
    public ResponseEntity<GameStateDTO> act(@PathVariable String roomKey, @RequestBody MoveRequest request) {
        return ResponseEntity.ok(gameService.act(roomKey, request));
    }

    @PostMapping("/guard")
    public ResponseEntity<GameStateDTO> guard(@PathVariable String roomKey, @RequestBody MoveRequest request) {
        return ResponseEntity.ok(gameService.guard(roomKey, request));
    }

    @PostMapping("/wizard-attack")
    public ResponseEntity<GameStateDTO> wizardAttack(@PathVariable String roomKey, @RequestBody MoveRequest request) {
        return ResponseEntity.ok(gameService.wizardAttack(roomKey, request));
    }

    @PostMapping("/bard-swap")
    public ResponseEntity<GameStateDTO> bardSwap(@PathVariable String roomKey, @RequestBody MoveRequest request) {
        return ResponseEntity.ok(gameService.bardSwap(roomKey, request));
    }

    @PostMapping("/snapshot")
    public ResponseEntity<GameStateDTO> loadSnapshot(@PathVariable String roomKey,
                                                     @RequestParam String playerId,
                                                     @RequestBody JsonNode snapshot) {
        return ResponseEntity.ok(gameService.loadSnapshot(roomKey, playerId, snapshot));
    }

    @PostMapping("/reset")
    public ResponseEntity<GameStateDTO> reset(@PathVariable String roomKey, @RequestBody MoveRequest request) {
        return ResponseEntity.ok(gameService.reset(roomKey, request));
    }
}
