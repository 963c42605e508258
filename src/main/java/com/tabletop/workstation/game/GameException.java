package com.tabletop.workstation.game;

import lombok.Getter;

/**
 * Rejection raised by the engine. The state the action was applied to is left untouched.
 */
@Getter
public class GameException extends RuntimeException {

    private final ErrorKind kind;

    public GameException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public static GameException notFound(String message) {
        return new GameException(ErrorKind.NOT_FOUND, message);
    }

    public static GameException invalidAttachment(String message) {
        return new GameException(ErrorKind.INVALID_ATTACHMENT, message);
    }

    public static GameException invalidAction(String message) {
        return new GameException(ErrorKind.INVALID_ACTION, message);
    }

    public static GameException capacityExceeded(String message) {
        return new GameException(ErrorKind.CAPACITY_EXCEEDED, message);
    }
}
