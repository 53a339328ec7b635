package com.gt.flashstudy.exception;

public class NotFoundException extends StudyEngineException {

    public NotFoundException(String msg) {
        super(ErrorKind.NotFound, msg);
    }
}
