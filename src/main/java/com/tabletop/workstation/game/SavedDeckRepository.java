package com.tabletop.workstation.game;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface SavedDeckRepository extends JpaRepository<SavedDeck, String> {
    List<SavedDeck> findAllByOrderByNameAsc();
}
