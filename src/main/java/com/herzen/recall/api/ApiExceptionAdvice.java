package com.herzen.recall.api;

import com.herzen.recall.testdef.GenerationUnavailableException;
import com.herzen.recall.testdef.InvalidTestDefinitionException;
import com.herzen.recall.testdef.TestNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps domain exceptions to JSON error bodies for the REST controllers.
 */
@RestControllerAdvice(annotations = RestController.class)
public class ApiExceptionAdvice {

    @ExceptionHandler(TestNotFoundException.class)
    public ResponseEntity<Map<String, Object>> notFound(TestNotFoundException ex, HttpServletRequest request) {
        return error(HttpStatus.NOT_FOUND, ex, request);
    }

    @ExceptionHandler({InvalidTestDefinitionException.class, IllegalArgumentException.class})
    public ResponseEntity<Map<String, Object>> badRequest(RuntimeException ex, HttpServletRequest request) {
        return error(HttpStatus.BAD_REQUEST, ex, request);
    }

    @ExceptionHandler(GenerationUnavailableException.class)
    public ResponseEntity<Map<String, Object>> generationUnavailable(GenerationUnavailableException ex, HttpServletRequest request) {
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex, request);
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, RuntimeException ex, HttpServletRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("error", status.getReasonPhrase());
        body.put("message", ex.getMessage());
        body.put("path", request.getRequestURI());
        return ResponseEntity.status(status).body(body);
    }
}
