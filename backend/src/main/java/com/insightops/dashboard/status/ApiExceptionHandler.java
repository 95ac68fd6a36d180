package com.insightops.dashboard.status;

import com.insightops.dashboard.tenant.MissingTenantException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps the fail-closed tenancy signal to HTTP 400 for every REST controller.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(MissingTenantException.class)
    public ResponseEntity<Map<String, String>> handleMissingTenant(MissingTenantException ex) {
        log.warn("Rejected request without tenant: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Map.of("error", ex.getMessage(), "code", "TENANT_REQUIRED"));
    }
}
