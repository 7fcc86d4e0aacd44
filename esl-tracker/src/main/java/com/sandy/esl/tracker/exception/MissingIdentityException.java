package com.sandy.esl.tracker.exception;

public class MissingIdentityException extends EslStoreException {

    public MissingIdentityException() {
        super(EslErrorCode.MISSING_IDENTITY);
    }
}
