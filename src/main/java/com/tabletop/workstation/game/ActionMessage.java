package com.tabletop.workstation.game;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;

@Data
public class ActionMessage {
    private String action;
    private JsonNode data;
}
