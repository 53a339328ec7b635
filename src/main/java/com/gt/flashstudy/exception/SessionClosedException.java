package com.gt.flashstudy.exception;

public class SessionClosedException extends StudyEngineException {

    public SessionClosedException(String msg) {
        super(ErrorKind.SessionClosed, msg);
    }
}
