package com.sandy.esl.tracker.controller;

import com.sandy.esl.tracker.exception.EslStoreException;
import com.sandy.esl.tracker.exception.MissingIdentityException;
import com.sandy.esl.tracker.exception.PlatformException;
import com.sandy.esl.tracker.vo.ErrorRsp;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Translates store failures into HTTP answers of the tracker API.
 */
@Slf4j
@RestControllerAdvice(assignableTypes = EslController.class)
public class EslExceptionHandler {

    @ExceptionHandler(MissingIdentityException.class)
    public ResponseEntity<ErrorRsp> handleMissingIdentity(MissingIdentityException e) {
        return ResponseEntity.badRequest().body(ErrorRsp.builder()
                .code(e.getErrorCode().getCode())
                .error(e.getMessage())
                .build());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorRsp> handleIllegalArgument(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(ErrorRsp.builder().code("ESL-400").error(e.getMessage()).build());
    }

    @ExceptionHandler(PlatformException.class)
    public ResponseEntity<ErrorRsp> handlePlatform(PlatformException e) {
        log.warn("Parse platform error: status={} cause={}", e.getStatus(), e.getPlatformCause());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(ErrorRsp.builder()
                .code(e.getErrorCode().getCode())
                .error(e.getPlatformCause())
                .upstreamStatus(e.getStatus())
                .build());
    }

    @ExceptionHandler(EslStoreException.class)
    public ResponseEntity<ErrorRsp> handleStore(EslStoreException e) {
        log.error("ESL store failure: code={} message={}", e.getErrorCode().getCode(), e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ErrorRsp.builder()
                .code(e.getErrorCode().getCode())
                .error(e.getMessage())
                .build());
    }
}
