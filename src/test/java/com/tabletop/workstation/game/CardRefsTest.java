package com.tabletop.workstation.game;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class CardRefsTest {

    @Test
    void normalizeStripsPunctuation() {
        assertEquals("lightning_bolt", CardRefs.normalize("Lightning Bolt"));
        assertEquals("jaces_erasure", CardRefs.normalize("Jace's Erasure"));
        assertEquals("borborygmos_enraged", CardRefs.normalize("Borborygmos, Enraged"));
        assertEquals("fire_ice", CardRefs.normalize("Fire // Ice"));
    }

    @Test
    void displayNameDropsSetCode() {
        assertEquals("Lightning Bolt", CardRefs.displayName("lightning_bolt"));
        assertEquals("Lightning Bolt", CardRefs.displayName("lightning_bolt_A25"));
        assertEquals("Forest", CardRefs.displayName("forest_UNK"));
    }
}
