package com.signalloop.web;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps rejected telemetry and decision requests to a 400 body. Field keys use
 * the request path, e.g. {@code candidates[2].likeCount}.
 */
@RestControllerAdvice
public class ValidationExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ValidationErrorResponse> handle(MethodArgumentNotValidException ex) {
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(fe ->
                fieldErrors.putIfAbsent(fe.getField(), fe.getDefaultMessage())
        );

        String detail = fieldErrors.isEmpty()
                ? "Validation failed"
                : "Validation failed: " + String.join("; ", fieldErrors.values());

        return ResponseEntity.badRequest()
                .body(new ValidationErrorResponse("invalid_request", detail, fieldErrors));
    }

    /**
     * Unknown enum values (an unsupported collection phase) name the accepted
     * values; any other unreadable body is reported without echoing the payload.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ValidationErrorResponse> handle(HttpMessageNotReadableException ex) {
        Throwable cause = ex.getCause();
        if (cause instanceof InvalidFormatException) {
            InvalidFormatException invalid = (InvalidFormatException) cause;
            Class<?> target = invalid.getTargetType();
            if (target != null && target.isEnum()) {
                String field = fieldPath(invalid);
                String accepted = Arrays.stream(target.getEnumConstants())
                        .map(Object::toString)
                        .collect(Collectors.joining(", "));
                String message = field + " must be one of [" + accepted + "]";
                return ResponseEntity.badRequest()
                        .body(new ValidationErrorResponse("invalid_request", message, Map.of(field, message)));
            }
        }
        return ResponseEntity.badRequest()
                .body(new ValidationErrorResponse("malformed_body", "Request body is not valid JSON for this endpoint",
                        Map.of()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ValidationErrorResponse> handle(IllegalArgumentException ex) {
        return ResponseEntity.badRequest()
                .body(new ValidationErrorResponse("rejected", ex.getMessage(), Map.of()));
    }

    private static String fieldPath(JsonMappingException ex) {
        StringBuilder path = new StringBuilder();
        for (JsonMappingException.Reference reference : ex.getPath()) {
            if (reference.getFieldName() != null) {
                if (path.length() > 0) {
                    path.append('.');
                }
                path.append(reference.getFieldName());
            } else if (reference.getIndex() >= 0) {
                path.append('[').append(reference.getIndex()).append(']');
            }
        }
        return path.length() == 0 ? "body" : path.toString();
    }

    public record ValidationErrorResponse(
            String code,
            String detail,
            Map<String, String> fieldErrors
    ) {
    }
}
