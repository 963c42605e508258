package com.tabletop.workstation.game;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Named deck lists. Card names are stored as catalog references; nothing here looks the catalog up.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeckService {

    private final SavedDeckRepository savedDeckRepository;
    private final ObjectMapper objectMapper;

    public DeckSummary save(SaveDeckRequest request) {
        if (request == null || request.getName() == null || request.getName().isBlank()) {
            throw GameException.invalidAction("Deck name is required");
        }
        String name = request.getName().trim();
        DeckList deck = new DeckList(name, normalizeAll(request.getMain()), normalizeAll(request.getSideboard()));

        SavedDeck saved = new SavedDeck();
        saved.setDeckKey(deckKey(name));
        saved.setName(name);
        saved.setCardCount(deck.size());
        saved.setSavedAt(Instant.now());
        try {
            saved.setPayload(objectMapper.writeValueAsString(deck));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize deck " + name, e);
        }
        savedDeckRepository.save(saved);
        log.info("deck-saved name={} main={} sideboard={}", name, deck.main().size(), deck.sideboard().size());
        return new DeckSummary(name, saved.getDeckKey(), deck.main().size(), deck.sideboard().size());
    }

    public Optional<DeckList> find(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return savedDeckRepository.findById(deckKey(name)).map(this::read);
    }

    public DeckList require(String name) {
        return find(name).orElseThrow(() -> GameException.notFound("Deck not found: " + name));
    }

    public List<DeckSummary> list() {
        List<DeckSummary> summaries = new ArrayList<>();
        for (SavedDeck saved : savedDeckRepository.findAllByOrderByNameAsc()) {
            DeckList deck = read(saved);
            summaries.add(new DeckSummary(saved.getName(), saved.getDeckKey(), deck.main().size(), deck.sideboard().size()));
        }
        return summaries;
    }

    private DeckList read(SavedDeck saved) {
        try {
            return objectMapper.readValue(saved.getPayload(), DeckList.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt deck payload: " + saved.getDeckKey(), e);
        }
    }

    private List<String> normalizeAll(List<String> cardNames) {
        List<String> refs = new ArrayList<>();
        if (cardNames == null) {
            return refs;
        }
        for (String cardName : cardNames) {
            if (cardName == null || cardName.isBlank()) {
                continue;
            }
            String ref = CardRefs.normalize(cardName);
            if (!ref.isEmpty()) {
                refs.add(ref);
            }
        }
        return refs;
    }

    static String deckKey(String name) {
        return name.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_]", "_");
    }
}
