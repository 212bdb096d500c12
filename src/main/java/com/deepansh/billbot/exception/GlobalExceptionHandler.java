package com.deepansh.billbot.exception;

import com.deepansh.billbot.session.SearchSessionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(ValidationException ex) {
        return ResponseEntity.badRequest().body(errorBody(ex));
    }

    @ExceptionHandler(SessionConflictException.class)
    public ResponseEntity<Map<String, Object>> handleConflict(SessionConflictException ex) {
        log.warn("Session conflict: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(errorBody(ex));
    }

    @ExceptionHandler(WorkerUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleWorkerUnavailable(WorkerUnavailableException ex) {
        log.error("Tool worker unavailable: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(errorBody(ex));
    }

    @ExceptionHandler(BillBotException.class)
    public ResponseEntity<Map<String, Object>> handleBillBot(BillBotException ex) {
        HttpStatus status = SearchSessionService.CAPACITY_CODE.equals(ex.getCode())
                ? HttpStatus.SERVICE_UNAVAILABLE
                : HttpStatus.INTERNAL_SERVER_ERROR;
        log.error("Request failed [{}]: {}", ex.getCode(), ex.getMessage(), ex);
        return ResponseEntity.status(status).body(errorBody(ex));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidBody(MethodArgumentNotValidException ex) {
        String msg = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + ": " + e.getDefaultMessage())
                .findFirst()
                .orElse("Validation failed");
        return ResponseEntity.badRequest().body(errorBody(msg, ValidationException.CODE, false));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        return ResponseEntity.badRequest().body(errorBody("Malformed request body", ValidationException.CODE, false));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneral(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(errorBody("An unexpected error occurred", "INTERNAL_ERROR", true));
    }

    private Map<String, Object> errorBody(BillBotException ex) {
        return errorBody(ex.getMessage(), ex.getCode(), ex.isRecoverable());
    }

    private Map<String, Object> errorBody(String message, String code, boolean recoverable) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        body.put("code", code);
        body.put("recoverable", recoverable);
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
