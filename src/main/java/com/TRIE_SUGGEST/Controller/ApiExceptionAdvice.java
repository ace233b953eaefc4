package com.TRIE_SUGGEST.Controller;

import com.TRIE_SUGGEST.service.InvalidWordException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps boundary validation failures to a JSON 400.
 */
@Slf4j
@RestControllerAdvice(annotations = RestController.class)
public class ApiExceptionAdvice {

    @ExceptionHandler(InvalidWordException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidWord(InvalidWordException ex, HttpServletRequest request) {
        log.debug("Rejected input {}: {}", ex.getToken(), ex.getMessage());
        HttpStatus status = HttpStatus.BAD_REQUEST;
        return ResponseEntity.status(status).body(body(status, "invalid_word", ex, request));
    }

    private static Map<String, Object> body(HttpStatus status, String code, Exception ex, HttpServletRequest request) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("ok", false);
        out.put("status", status.value());
        out.put("error", code);
        out.put("message", ex.getMessage());
        if (request != null) {
            out.put("path", request.getRequestURI());
        }
        out.put("timestamp", Instant.now().toString());
        return out;
    }
}
