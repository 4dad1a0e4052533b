package com.butlergroceries.retailer.controller;

import com.butlergroceries.retailer.service.NoMatchesException;
import com.butlergroceries.retailer.service.RecipeNotFoundException;
import com.butlergroceries.retailer.service.RetailerNotConfiguredException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.server.ServerWebInputException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps the caller-visible outcomes of the retailer endpoints to distinct HTTP responses:
 * unknown recipe, nothing matched, retailer not configured, and bad input.
 */
@RestControllerAdvice
public class GlobalErrorHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalErrorHandler.class);

    @ExceptionHandler(RecipeNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleRecipeNotFound(RecipeNotFoundException ex) {
        Map<String, Object> body = new HashMap<>();
        body.put("error", "recipe_not_found");
        body.put("message", ex.getMessage());
        return ResponseEntity.status(404).body(body);
    }

    @ExceptionHandler(NoMatchesException.class)
    public ResponseEntity<Map<String, Object>> handleNoMatches(NoMatchesException ex) {
        log.info("Recipe {}: no products matched ({} skipped)", ex.getRecipeId(), ex.getSkipped().size());
        Map<String, Object> body = new HashMap<>();
        body.put("error", "no_matches");
        body.put("message", "No products matched; nothing to add");
        body.put("skipped", ex.getSkipped());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(RetailerNotConfiguredException.class)
    public ResponseEntity<Map<String, Object>> handleNotConfigured(RetailerNotConfiguredException ex) {
        Map<String, Object> body = new HashMap<>();
        body.put("error", "not_configured");
        body.put("message", ex.getMessage());
        return ResponseEntity.status(503).body(body);
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(HandlerMethodValidationException ex) {
        List<String> errors = ex.getAllErrors().stream()
                .map(err -> String.valueOf(err.getDefaultMessage()))
                .collect(Collectors.toList());
        log.warn("Request validation failed: {}", errors);
        Map<String, Object> body = new HashMap<>();
        body.put("error", "bad_request");
        body.put("details", errors);
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex) {
        Map<String, Object> body = new HashMap<>();
        body.put("error", "bad_request");
        body.put("reason", ex.getMessage());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, Object>> handleInput(ServerWebInputException ex) {
        log.warn("Input error: {}", ex.getReason());
        Map<String, Object> body = new HashMap<>();
        body.put("error", "bad_request");
        body.put("reason", ex.getReason());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleOther(Exception ex) {
        log.warn("Unhandled error: {}", ex.toString());
        Map<String, Object> body = new HashMap<>();
        body.put("error", "server_error");
        body.put("exception", ex.getClass().getSimpleName());
        body.put("message", ex.getMessage());
        return ResponseEntity.status(500).body(body);
    }
}
