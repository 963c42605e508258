package com.tabletop.workstation.game;

import com.fasterxml.jackson.annotation.JsonRawValue;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class JoinGameResponse {
    private String gameId;
    private String playerId;
    @JsonRawValue
    private String state;

    public static JoinGameResponse of(String playerId, GameSnapshot snapshot) {
        return new JoinGameResponse(snapshot.gameId(), playerId, snapshot.json());
    }
}
