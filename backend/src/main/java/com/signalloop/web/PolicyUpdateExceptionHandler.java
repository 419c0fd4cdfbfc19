package com.signalloop.web;

import com.signalloop.service.PolicyUpdateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class PolicyUpdateExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(PolicyUpdateExceptionHandler.class);

    @ExceptionHandler(PolicyUpdateException.class)
    public ResponseEntity<PolicyUpdateErrorResponse> handle(PolicyUpdateException ex) {
        log.error("Policy update request failed", ex);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new PolicyUpdateErrorResponse("policy_update_failed", ex.getMessage()));
    }

    public record PolicyUpdateErrorResponse(
            String code,
            String message
    ) {
    }
}
