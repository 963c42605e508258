package com.tabletop.workstation.game;

import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/games")
@RequiredArgsConstructor
@CrossOrigin("*")
public class GameController {

    private final GameService gameService;

    @PostMapping
    public ResponseEntity<JoinGameResponse> createGame(@RequestBody CreateGameRequest request) {
        return ResponseEntity.ok(gameService.createGame(request));
    }

    @GetMapping
    public ResponseEntity<List<GameSummary>> listGames() {
        return ResponseEntity.ok(gameService.listGames());
    }

    @PostMapping("/{gameId}/join")
    public ResponseEntity<JoinGameResponse> joinGame(@PathVariable String gameId,
                                                     @RequestBody JoinGameRequest request) {
        return ResponseEntity.ok(gameService.joinGame(gameId, request));
    }

    @PostMapping("/{gameId}/rejoin")
    public ResponseEntity<JoinGameResponse> rejoinGame(@PathVariable String gameId,
                                                       @RequestBody RejoinRequest request) {
        return ResponseEntity.ok(gameService.rejoinGame(gameId, request.getPlayerId()));
    }

    // raw snapshot json, byte-identical to what the socket pushes
    @GetMapping(value = "/{gameId}/state", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> getState(@PathVariable String gameId,
                                           @RequestParam(required = false) String playerId) {
        return ResponseEntity.ok(gameService.getState(gameId, playerId).json());
    }

    @PostMapping(value = "/{gameId}/players/{playerId}/deck", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> loadDeck(@PathVariable String gameId,
                                           @PathVariable String playerId,
                                           @RequestBody LoadDeckRequest request) {
        return ResponseEntity.ok(gameService.loadDeck(gameId, playerId, request.getDeckName()).json());
    }

    @DeleteMapping("/{gameId}")
    public ResponseEntity<Void> deleteGame(@PathVariable String gameId) {
        gameService.deleteGame(gameId);
        return ResponseEntity.noContent().build();
    }
}
