package com.gt.flashstudy.exception;

public class ValidationException extends StudyEngineException {

    public ValidationException(String msg) {
        super(ErrorKind.ValidationError, msg);
    }
}
