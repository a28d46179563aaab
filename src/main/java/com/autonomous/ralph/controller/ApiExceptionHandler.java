package com.autonomous.ralph.controller;

import com.autonomous.ralph.service.NoWorkerConnectedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@Slf4j
@RestControllerAdvice
@Profile("!worker")
public class ApiExceptionHandler {

    @ExceptionHandler(NoWorkerConnectedException.class)
    public ResponseEntity<?> noWorker(NoWorkerConnectedException e) {
        log.info("Rejected terminal request: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("success", false, "error", e.getMessage()));
    }
}
