package by.greenmobile.lotmassing.controller;

import by.greenmobile.lotmassing.service.validation.InvalidLotException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/** Ошибки входных данных и прерывания -> JSON с кодом ответа. */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(InvalidLotException.class)
    public ResponseEntity<Map<String, Object>> invalidLot(InvalidLotException e) {
        log.warn("API: {}", e.getMessage());
        return body(HttpStatus.BAD_REQUEST, e.getLotId(), e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badArgument(IllegalArgumentException e) {
        log.warn("API: {}", e.getMessage());
        return body(HttpStatus.BAD_REQUEST, null, e.getMessage());
    }

    @ExceptionHandler(InterruptedException.class)
    public ResponseEntity<Map<String, Object>> interrupted(InterruptedException e) {
        Thread.currentThread().interrupt();
        return body(HttpStatus.SERVICE_UNAVAILABLE, null, "evaluation interrupted");
    }

    private ResponseEntity<Map<String, Object>> body(HttpStatus status, String lotId, String message) {
        Map<String, Object> b = new LinkedHashMap<>();
        b.put("status", status.value());
        if (lotId != null) b.put("lotId", lotId);
        b.put("error", message);
        return ResponseEntity.status(status).body(b);
    }
}
