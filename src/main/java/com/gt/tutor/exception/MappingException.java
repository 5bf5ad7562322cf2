package com.gt.tutor.exception;

// Thrown when collaborator data exists but is not in any recognized shape
public class MappingException extends RuntimeException {

    public MappingException(String errMsg) {
        super(errMsg);
    }

    public MappingException(String errMsg, Throwable cause) {
        super(errMsg, cause);
    }
}
