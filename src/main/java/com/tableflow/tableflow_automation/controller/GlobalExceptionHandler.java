package com.tableflow.tableflow_automation.controller;

import com.tableflow.tableflow_automation.engine.AutomationConfigurationException;
import com.tableflow.tableflow_automation.template.TemplateApplicationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(TemplateApplicationException.class)
    public ResponseEntity<Map<String, Object>> handleTemplateApplication(TemplateApplicationException ex) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", ex.getMessage());
        body.put("problems", ex.getProblems());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(AutomationConfigurationException.class)
    public ResponseEntity<Map<String, Object>> handleConfiguration(AutomationConfigurationException ex) {
        return ResponseEntity.badRequest().body(Map.of("error", ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(IllegalArgumentException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception ex) {
        log.error("Unhandled exception", ex);
        return ResponseEntity.internalServerError().body(Map.of("error", "Unexpected error"));
    }
}
