package com.tabletop.workstation.game;

public record CardLocation(Player player, Zone zone, Card card) {

    public boolean onBattlefield() {
        return zone.getZoneType() == ZoneType.BATTLEFIELD;
    }
}
