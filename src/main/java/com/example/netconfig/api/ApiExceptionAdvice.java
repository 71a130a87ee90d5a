package com.example.netconfig.api;

import com.example.netconfig.service.ConfigurationValidationException;
import com.example.netconfig.storage.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;
import java.util.Map;

/**
 * Error bodies for the configuration endpoints. Every body carries a
 * {@code detail} entry, which is what the front end displays.
 *
 * <ul>
 *   <li>422: payload shape (types, ranges, enum values)</li>
 *   <li>400: weight shape rules and other rejected writes</li>
 *   <li>500: storage failure while saving</li>
 * </ul>
 */
@Slf4j
@RestControllerAdvice(assignableTypes = NetworkConfigController.class)
public class ApiExceptionAdvice {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidField(MethodArgumentNotValidException ex) {
        List<String> details = ex.getBindingResult().getFieldErrors().stream()
                .map(ApiExceptionAdvice::describe)
                .toList();
        log.warn("Rejected configuration payload: {}", details);
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(Map.of("detail", details));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        Throwable root = NestedExceptionUtils.getMostSpecificCause(ex);
        String message = root.getMessage() == null ? ex.getMessage() : root.getMessage();
        log.warn("Unreadable configuration payload: {}", message);
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(Map.of("detail", List.of(message)));
    }

    @ExceptionHandler(ConfigurationValidationException.class)
    public ResponseEntity<Map<String, Object>> handleRuleViolation(ConfigurationValidationException ex) {
        log.warn("Configuration rejected: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(Map.of("detail", ex.getMessage()));
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<Map<String, Object>> handleStorage(StorageException ex) {
        log.error("Failed to save configuration", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("detail", "Failed to save configuration: " + ex.getMessage()));
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<Map<String, Object>> handleOther(RuntimeException ex) {
        log.error("Configuration update failed", ex);
        String message = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
        return ResponseEntity.badRequest().body(Map.of("detail", message));
    }

    private static String describe(FieldError error) {
        return error.getField() + ": " + error.getDefaultMessage();
    }
}
