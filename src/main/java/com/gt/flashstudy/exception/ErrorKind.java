package com.gt.flashstudy.exception;

import com.fasterxml.jackson.annotation.JsonValue;
import org.springframework.http.HttpStatus;

public enum ErrorKind {
    ValidationError("VALIDATION_ERROR", HttpStatus.BAD_REQUEST),
    NotFound("NOT_FOUND", HttpStatus.NOT_FOUND),
    NoCardsInDeck("NO_CARDS", HttpStatus.UNPROCESSABLE_ENTITY),
    NoCardsAvailable("NO_CARDS_AVAILABLE", HttpStatus.UNPROCESSABLE_ENTITY),
    Forbidden("FORBIDDEN", HttpStatus.FORBIDDEN),
    AlreadyCompleted("ALREADY_COMPLETED", HttpStatus.CONFLICT),
    SessionClosed("SESSION_CLOSED", HttpStatus.CONFLICT),
    ServerError("SERVER_ERROR", HttpStatus.INTERNAL_SERVER_ERROR);

    private final String code;
    private final HttpStatus httpStatus;

    ErrorKind(String code, HttpStatus httpStatus) {
        this.code = code;
        this.httpStatus = httpStatus;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}
