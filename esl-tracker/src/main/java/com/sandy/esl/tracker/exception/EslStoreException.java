package com.sandy.esl.tracker.exception;

import lombok.Getter;

/**
 * Failure of an {@link com.sandy.esl.tracker.service.EslStore} operation.
 * Stores never recover from these, they reach the caller unchanged.
 */
@Getter
public class EslStoreException extends RuntimeException {
    private final EslErrorCode errorCode;

    public EslStoreException(EslErrorCode errorCode, Throwable cause, Object... args) {
        super(String.format(errorCode.getMessage(), args), cause);
        this.errorCode = errorCode;
    }

    public EslStoreException(EslErrorCode errorCode, Object... args) {
        this(errorCode, null, args);
    }

    public static EslStoreException url(String url, Throwable cause) {
        return new EslStoreException(EslErrorCode.URL, cause, url);
    }

    public static EslStoreException transport(Throwable cause) {
        return new EslStoreException(EslErrorCode.TRANSPORT, cause, cause.getMessage());
    }

    public static EslStoreException serialization(Throwable cause) {
        return new EslStoreException(EslErrorCode.SERIALIZATION, cause, cause.getMessage());
    }

    public static EslStoreException io(Throwable cause) {
        return new EslStoreException(EslErrorCode.IO, cause, cause.getMessage());
    }

    public static EslStoreException database(Throwable cause) {
        return new EslStoreException(EslErrorCode.DATABASE, cause, cause.getMessage());
    }
}
