package com.skillbridge.mfa.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders MFA failures as {@code {"error": ..., "code": ...}}.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(MfaException.class)
    public ResponseEntity<Map<String, Object>> handleMfaException(MfaException ex) {
        MfaErrorCode code = ex.getErrorCode();
        if (code.getStatus().is5xxServerError()) {
            log.error("MFA operation failed with {}: {}", code, ex.getMessage(), ex);
        } else {
            log.warn("MFA request rejected with {}", code);
        }
        return ResponseEntity.status(code.getStatus()).body(body(code.getMessage(), code.name()));
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, Object>> handleValidation(Exception ex) {
        log.warn("Rejected malformed request: {}", ex.getMessage());
        MfaErrorCode code = MfaErrorCode.VALIDATION_ERROR;
        return ResponseEntity.status(code.getStatus()).body(body(code.getMessage(), code.name()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(body("Internal server error", "INTERNAL_ERROR"));
    }

    private static Map<String, Object> body(String message, String code) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        body.put("code", code);
        return body;
    }
}
