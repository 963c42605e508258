package com.tabletop.workstation.game;

public enum ErrorKind {
    NOT_FOUND,
    INVALID_ATTACHMENT,
    INVALID_ACTION,
    CAPACITY_EXCEEDED
}
