package com.gt.flashstudy.exception;

// Thrown when a request is made for a session that belongs to a different learner
public class UserAccessException extends StudyEngineException {

    public UserAccessException(String msg) {
        super(ErrorKind.Forbidden, msg);
    }
}
