package com.tabletop.workstation.game;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Player {
    private String id;
    private String name;
    private int lifeTotal;
    private Map<ZoneType, Zone> zones = new LinkedHashMap<>();

    public static Player create(String id, String name, int lifeTotal) {
        Player player = new Player();
        player.setId(id);
        player.setName(name);
        player.setLifeTotal(lifeTotal);
        for (ZoneType type : ZoneType.values()) {
            player.getZones().put(type, new Zone(type, id));
        }
        return player;
    }

    public Zone zone(ZoneType type) {
        return zones.computeIfAbsent(type, t -> new Zone(t, id));
    }

    public Player copy() {
        Player copy = new Player();
        copy.setId(id);
        copy.setName(name);
        copy.setLifeTotal(lifeTotal);
        for (Map.Entry<ZoneType, Zone> entry : zones.entrySet()) {
            copy.getZones().put(entry.getKey(), entry.getValue().copy());
        }
        return copy;
    }
}
