package com.positionengine.exception;

public class ClassificationStoreException extends BaseException {

    public ClassificationStoreException(String message) {
        super(ErrorCode.STORE_UNAVAILABLE, message);
    }

    public ClassificationStoreException(String message, Throwable cause) {
        super(ErrorCode.STORE_UNAVAILABLE, message, cause);
    }
}
