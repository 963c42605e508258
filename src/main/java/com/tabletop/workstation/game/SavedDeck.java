package com.tabletop.workstation.game;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import lombok.Data;

import java.time.Instant;

@Data
@Entity
@Table(name = "saved_decks")
public class SavedDeck {
    @Id
    private String deckKey;         // normalized name

    @Column(nullable = false)
    private String name;

    @Lob
    @Column(nullable = false)
    private String payload;         // DeckList as JSON

    @Column(nullable = false)
    private int cardCount;

    @Column(nullable = false)
    private Instant savedAt;
}
