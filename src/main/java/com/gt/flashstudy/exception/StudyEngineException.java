package com.gt.flashstudy.exception;

// Base of every failure that is reported to the client with a machine-readable kind
public abstract class StudyEngineException extends RuntimeException {

    private final ErrorKind kind;

    protected StudyEngineException(ErrorKind kind, String msg) {
        super(msg);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
