package com.elssolution.greenguard.web;

import com.elssolution.greenguard.domain.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@Slf4j
@RestControllerAdvice
public class ErrorHandler {

    @ExceptionHandler({TelemetryValidationException.class, InvalidFacilityRulesException.class,
            IllegalArgumentException.class, HttpMessageNotReadableException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleBadRequest(Exception ex) {
        log.debug("bad_request {}", ex.getMessage());
        return error("VALIDATION_FAILED", ex.getMessage());
    }

    @ExceptionHandler({AuditNotFoundException.class, UnknownFacilityException.class})
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleNotFound(RuntimeException ex) {
        return error("NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(HumanActionAlreadySetException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleConflict(HumanActionAlreadySetException ex) {
        return error("ALREADY_REVIEWED", ex.getMessage());
    }

    private static Map<String, Object> error(String code, String message) {
        return Map.of(
                "success", false,
                "code", code,
                "message", message == null ? code : message
        );
    }
}
