package com.jmapmail.controller;

import com.jmapmail.jmap.JmapErrorType;
import com.jmapmail.jmap.JmapException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Request-level JMAP failures as 400 problem bodies {type, status, detail}
 */
@Slf4j
@RestControllerAdvice(assignableTypes = JmapController.class)
public class ApiExceptionHandler {

    @ExceptionHandler(JmapException.class)
    public ResponseEntity<Map<String, Object>> handleJmapException(JmapException e) {
        log.warn("Rejected JMAP request: {} {}", e.getType().getValue(), e.getMessage());
        return problem(e.getType(), e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("Unreadable JMAP request: {}", e.getMostSpecificCause().getMessage());
        return problem(JmapErrorType.NOT_JSON, "Request body is not a valid JMAP request");
    }

    private ResponseEntity<Map<String, Object>> problem(JmapErrorType type, String detail) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("type", type.getValue());
        body.put("status", HttpStatus.BAD_REQUEST.value());
        body.put("detail", detail);
        return ResponseEntity.badRequest().body(body);
    }
}
