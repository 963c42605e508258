package com.tabletop.workstation.game;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/decks")
@RequiredArgsConstructor
@CrossOrigin("*")
public class DeckController {

    private final DeckService deckService;

    @PostMapping
    public ResponseEntity<DeckSummary> saveDeck(@RequestBody SaveDeckRequest request) {
        return ResponseEntity.ok(deckService.save(request));
    }

    @GetMapping
    public ResponseEntity<List<DeckSummary>> listDecks() {
        return ResponseEntity.ok(deckService.list());
    }
}
