package com.tabletop.workstation.game;

public record ApiError(String code, String message) {
}
