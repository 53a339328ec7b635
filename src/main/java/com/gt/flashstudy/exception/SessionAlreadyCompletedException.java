package com.gt.flashstudy.exception;

public class SessionAlreadyCompletedException extends StudyEngineException {

    public SessionAlreadyCompletedException(String msg) {
        super(ErrorKind.AlreadyCompleted, msg);
    }
}
