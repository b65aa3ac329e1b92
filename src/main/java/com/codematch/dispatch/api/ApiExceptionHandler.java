package com.codematch.dispatch.api;

import com.codematch.core.error.AmbiguousContractException;
import com.codematch.core.error.CodematchException;
import com.codematch.core.error.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps every {@link CodematchException} to a stable error kind and HTTP status.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(AmbiguousContractException.class)
    public ResponseEntity<Map<String, Object>> handleAmbiguous(AmbiguousContractException ex) {
        Map<String, Object> body = body(ex);
        body.put("contractsToChoose", ex.getChoices());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    @ExceptionHandler(CodematchException.class)
    public ResponseEntity<Map<String, Object>> handle(CodematchException ex) {
        HttpStatus status = statusFor(ex.getKind());
        if (status.is5xxServerError()) {
            log.error("Request failed: {}", ex.getMessage(), ex);
        } else {
            log.debug("Request rejected ({}): {}", ex.getKind(), ex.getMessage());
        }
        return ResponseEntity.status(status).body(body(ex));
    }

    static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case CAPACITY_EXCEEDED -> HttpStatus.PAYLOAD_TOO_LARGE;
            case VALIDATION_FAILURE, INCOMPLETE_CANDIDATE, INVALID_REQUEST -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case VERIFICATION_TRANSPORT_FAILURE -> HttpStatus.BAD_GATEWAY;
        };
    }

    private static Map<String, Object> body(CodematchException ex) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", ex.getKind().name());
        body.put("message", ex.getMessage());
        return body;
    }
}
