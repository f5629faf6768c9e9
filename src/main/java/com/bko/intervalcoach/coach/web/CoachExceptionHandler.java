package com.bko.intervalcoach.coach.web;

import com.bko.intervalcoach.coach.web.dto.ErrorDto;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class CoachExceptionHandler {
    private static final Logger logger = LoggerFactory.getLogger(CoachExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorDto> handleIllegalArgument(IllegalArgumentException e) {
        logger.warn("Rejected request: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorDto> handleUnreadable(Exception e) {
        logger.warn("Malformed request: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Malformed request");
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorDto> handleRuntime(RuntimeException e) {
        logger.error("Coaching request failed", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Coaching request failed, check the logs");
    }

    private ResponseEntity<ErrorDto> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(new ErrorDto(status.value(), status.getReasonPhrase(), message));
    }
}
