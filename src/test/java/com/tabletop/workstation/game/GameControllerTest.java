package com.tabletop.workstation.game;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class GameControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void createJoinAndFetchState() throws Exception {
        JsonNode created = postJson("/api/games", Map.of("playerName", "Alice", "gameName", "Friday night"));
        String gameId = created.get("gameId").asText();
        String alice = created.get("playerId").asText();
        assertEquals("Friday night", created.get("state").get("name").asText());
        assertEquals(alice, created.get("state").get("active_player_id").asText());

        JsonNode joined = postJson("/api/games/" + gameId + "/join", Map.of("playerName", "Bob"));
        assertEquals(2, joined.get("state").get("players").size());
        assertEquals(20, joined.get("state").get("players").get(joined.get("playerId").asText()).get("life_total").asInt());

        mockMvc.perform(get("/api/games/" + gameId + "/state").param("playerId", alice))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.game_id").value(gameId))
                .andExpect(jsonPath("$.version").value(2));
    }

    @Test
    void thirdPlayerIsRefused() throws Exception {
        String gameId = postJson("/api/games", Map.of("playerName", "Alice")).get("gameId").asText();
        postJson("/api/games/" + gameId + "/join", Map.of("playerName", "Bob"));

        mockMvc.perform(post("/api/games/" + gameId + "/join")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("playerName", "Carol"))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("CAPACITY_EXCEEDED"));
    }

    @Test
    void rejoinReturnsSameSnapshotAndRefusesStrangers() throws Exception {
        JsonNode created = postJson("/api/games", Map.of("playerName", "Alice"));
        String gameId = created.get("gameId").asText();
        String alice = created.get("playerId").asText();

        JsonNode rejoined = postJson("/api/games/" + gameId + "/rejoin", Map.of("playerId", alice));
        assertEquals(created.get("state"), rejoined.get("state"));

        mockMvc.perform(post("/api/games/" + gameId + "/rejoin")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("playerId", "not-a-player"))))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    void unknownGameIsNotFound() throws Exception {
        mockMvc.perform(post("/api/games/NOPE99/join")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("playerName", "Bob"))))
                .andExpect(status().isNotFound());
    }

    @Test
    void savedDeckIsLoadedIntoTheCreatorsLibrary() throws Exception {
        postJson("/api/decks", Map.of(
                "name", "Mono Red",
                "main", List.of("Lightning Bolt", "Lightning Bolt", "Mountain"),
                "sideboard", List.of("Pyroblast")));

        JsonNode created = postJson("/api/games", Map.of("playerName", "Alice", "deckName", "mono red"));
        JsonNode zones = created.get("state").get("players").get(created.get("playerId").asText()).get("zones");

        assertEquals(3, zones.get("library").get("cards").size());
        assertEquals(1, zones.get("sideboard").get("cards").size());

        mockMvc.perform(get("/api/decks"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[?(@.name == 'Mono Red')].mainCount").value(3));
    }

    @Test
    void unknownDeckIsNotFound() throws Exception {
        mockMvc.perform(post("/api/games")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("playerName", "Alice", "deckName", "missing"))))
                .andExpect(status().isNotFound());
    }

    @Test
    void deletedGameDisappears() throws Exception {
        JsonNode created = postJson("/api/games", Map.of("playerName", "Alice"));
        String gameId = created.get("gameId").asText();

        mockMvc.perform(delete("/api/games/" + gameId)).andExpect(status().isNoContent());

        mockMvc.perform(get("/api/games/" + gameId + "/state"))
                .andExpect(status().isNotFound());
    }

    @Test
    void listedGamesIncludeNewGame() throws Exception {
        String gameId = postJson("/api/games", Map.of("playerName", "Alice", "gameName", "listed")).get("gameId").asText();

        mockMvc.perform(get("/api/games"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[?(@.gameId == '" + gameId + "')].playerCount").value(1));
    }

    @Test
    void blankPlayerNameIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/games")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"playerName\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ACTION"));
    }

    private JsonNode postJson(String path, Object body) throws Exception {
        MvcResult result = mockMvc.perform(post(path)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(body)))
                .andExpect(status().isOk())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }
}
