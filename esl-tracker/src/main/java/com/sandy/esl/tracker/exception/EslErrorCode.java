package com.sandy.esl.tracker.exception;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Every way a store operation can fail, whatever the backend.
 */
@Getter
@AllArgsConstructor
public enum EslErrorCode {
    URL("ESL-001", "An error occurred while parsing the URL: %s"),
    TRANSPORT("ESL-002", "An issue occurred within this request: %s"),
    SERIALIZATION("ESL-003", "An issue occurred while converting the payload to JSON: %s"),
    IO("ESL-004", "An I/O error occurred: %s"),
    PLATFORM("ESL-005", "The object store rejected the request. status: %s, cause: %s"),
    DATABASE("ESL-006", "Database error: %s"),
    MISSING_IDENTITY("ESL-007", "This record has no objectId, please save it first");

    private final String code;
    private final String message;
}
