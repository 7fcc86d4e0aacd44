package com.sandy.esl.tracker.exception;

import lombok.Getter;

/**
 * The Parse server answered with an unexpected status. Carries the HTTP status
 * and the {@code error} message of the response body verbatim.
 */
@Getter
public class PlatformException extends EslStoreException {
    private final int status;
    private final String platformCause;

    public PlatformException(int status, String platformCause) {
        super(EslErrorCode.PLATFORM, status, platformCause);
        this.status = status;
        this.platformCause = platformCause;
    }
}
