package com.tabletop.workstation.game;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps engine rejections to HTTP statuses. The body is always {@code {code, message}}.
 */
@Slf4j
@RestControllerAdvice
public class GameExceptionAdvice {

    @ExceptionHandler(GameException.class)
    public ResponseEntity<ApiError> gameError(GameException e) {
        HttpStatus status = switch (e.getKind()) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INVALID_ATTACHMENT -> HttpStatus.UNPROCESSABLE_ENTITY;
            case INVALID_ACTION -> HttpStatus.BAD_REQUEST;
            case CAPACITY_EXCEEDED -> HttpStatus.CONFLICT;
        };
        log.debug("request rejected kind={} message={}", e.getKind(), e.getMessage());
        return ResponseEntity.status(status).body(new ApiError(e.getKind().name(), e.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> unreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ApiError(ErrorKind.INVALID_ACTION.name(), "Malformed request body"));
    }
}
