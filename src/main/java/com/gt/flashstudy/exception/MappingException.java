package com.gt.flashstudy.exception;

// Thrown when a JSON column cannot be converted to or from its model type
public class MappingException extends RuntimeException {

    public MappingException(String errMsg)  {
        super(errMsg);
    }

    public MappingException(String errMsg, Exception ex) {
        super(errMsg, ex);
    }
}
