package com.gt.tutor.exception;

// Thrown when the persisted profile cannot be read from or written to storage
public class DaoException extends RuntimeException {

    public DaoException(String errMsg) {
        super(errMsg);
    }

    public DaoException(String errMsg, Throwable cause) {
        super(errMsg, cause);
    }
}
