package com.tabletop.workstation.game;

import java.util.List;

/**
 * A named deck as catalog references, already resolved outside the engine.
 */
public record DeckList(String name, List<String> main, List<String> sideboard) {

    public DeckList {
        main = main == null ? List.of() : List.copyOf(main);
        sideboard = sideboard == null ? List.of() : List.copyOf(sideboard);
    }

    public int size() {
        return main.size() + sideboard.size();
    }
}
