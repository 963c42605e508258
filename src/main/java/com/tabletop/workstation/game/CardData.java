package com.tabletop.workstation.game;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CardData {
    private Integer x;          // battlefield position, kept when the card leaves
    private Integer y;
    @JsonProperty("is_token")
    private boolean token;
    private String power;
    private String toughness;
    private Map<String, Integer> counters = new LinkedHashMap<>();

    public CardData copy() {
        CardData copy = new CardData();
        copy.setX(x);
        copy.setY(y);
        copy.setToken(token);
        copy.setPower(power);
        copy.setToughness(toughness);
        copy.setCounters(new LinkedHashMap<>(counters));
        return copy;
    }
}
