package com.example.media_registry.controller;

import com.example.media_registry.util.RegistryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

import java.util.HashMap;
import java.util.Map;

@RestControllerAdvice
public class RegistryExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(RegistryExceptionHandler.class);

    @ExceptionHandler(RegistryException.class)
    public ResponseEntity<Map<String, Object>> handleRegistry(RegistryException ex) {
        log.debug("Registry call rejected kind={} detail={}", ex.getKind(), ex.getDetail());
        Map<String, Object> body = new HashMap<>();
        body.put("error", ex.getKind().code());
        body.put("message", ex.getDetail());
        return new ResponseEntity<>(body, ex.getStatusCode());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, Object>> handleStatus(ResponseStatusException ex) {
        Map<String, Object> body = new HashMap<>();
        body.put("error", ex.getReason());
        return new ResponseEntity<>(body, ex.getStatusCode());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        log.debug("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        Map<String, Object> body = new HashMap<>();
        body.put("error", "MALFORMED_REQUEST");
        return new ResponseEntity<>(body, HttpStatus.BAD_REQUEST);
    }
}
