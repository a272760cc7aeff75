package com.reservation.api.controller;

import com.reservation.api.exception.BookingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps core rejections to HTTP status codes.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(BookingException.class)
    public ResponseEntity<Map<String, String>> handleBooking(BookingException e) {
        HttpStatus status = statusFor(e.getReason());
        if (status.is5xxServerError()) {
            log.error("Request failed: {}", e.getMessage(), e);
        }
        return ResponseEntity.status(status)
                .body(Map.of("error", e.getReason().name(), "message", String.valueOf(e.getMessage())));
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<Map<String, String>> handleDataAccess(DataAccessException e) {
        log.error("Store unavailable: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("error", BookingException.Reason.PERSISTENCE_ERROR.name(),
                        "message", "Storage is unavailable"));
    }

    static HttpStatus statusFor(BookingException.Reason reason) {
        if (reason == BookingException.Reason.PERSISTENCE_CONFLICT) {
            return HttpStatus.CONFLICT;
        }
        return switch (reason.getCategory()) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case UNAUTHORIZED -> HttpStatus.FORBIDDEN;
            case VALIDATION_FAILED, SLOT_UNAVAILABLE, STATE_CONFLICT -> HttpStatus.BAD_REQUEST;
            case PERSISTENCE_ERROR -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }
}
