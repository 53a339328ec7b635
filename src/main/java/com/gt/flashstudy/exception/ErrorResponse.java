package com.gt.flashstudy.exception;

public record ErrorResponse(ErrorKind kind, String message) { }
