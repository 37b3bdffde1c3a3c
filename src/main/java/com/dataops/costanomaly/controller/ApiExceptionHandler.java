package com.dataops.costanomaly.controller;

import com.dataops.costanomaly.model.DetectionResult;
import com.dataops.costanomaly.model.ErrorType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Request-binding failures that happen before a controller method runs are
 * reported in the same envelope as detection failures.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<DetectionResult> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        String message = "Invalid value for parameter '" + ex.getName() + "': " + ex.getValue();
        return build(message);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<DetectionResult> handleUnreadable(HttpMessageNotReadableException ex) {
        log.debug("Unreadable request body: {}", ex.getMessage());
        return build("Malformed request body");
    }

    private ResponseEntity<DetectionResult> build(String message) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(DetectionResult.failure(ErrorType.VALIDATION_ERROR, message));
    }
}
