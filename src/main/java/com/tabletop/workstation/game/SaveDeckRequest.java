package com.tabletop.workstation.game;

import lombok.Data;

import java.util.List;

@Data
public class SaveDeckRequest {
    private String name;
    private List<String> main;
    private List<String> sideboard;
}
