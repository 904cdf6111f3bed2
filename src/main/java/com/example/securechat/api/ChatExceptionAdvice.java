package com.example.securechat.api;

import com.example.securechat.error.DecryptionException;
import com.example.securechat.error.IntegrityException;
import com.example.securechat.error.MissingOwnerException;
import com.example.securechat.error.SecureChatException;
import com.example.securechat.error.SessionAccessDeniedException;
import com.example.securechat.error.ValidationException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps chat-store failures to consistent JSON error bodies.
 *
 * <ul>
 *   <li>403 for missing or foreign sessions (never 404, so existence does not leak)</li>
 *   <li>422 for integrity and decryption failures</li>
 *   <li>400 for malformed input, including unknown algorithm tags</li>
 *   <li>401 when the owner header is absent</li>
 * </ul>
 */
@Slf4j
@RestControllerAdvice(annotations = RestController.class)
public class ChatExceptionAdvice {

    @ExceptionHandler(SessionAccessDeniedException.class)
    public ResponseEntity<Map<String, Object>> handleAccessDenied(SessionAccessDeniedException ex,
                                                                  HttpServletRequest request) {
        return respond(HttpStatus.FORBIDDEN, ex.getCode(), ex.getMessage(), request);
    }

    @ExceptionHandler({IntegrityException.class, DecryptionException.class})
    public ResponseEntity<Map<String, Object>> handleCrypto(SecureChatException ex, HttpServletRequest request) {
        log.warn("{} on {}: {}", ex.getCode(), request.getRequestURI(), ex.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, ex.getCode(), ex.getMessage(), request);
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(ValidationException ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, ex.getCode(), ex.getMessage(), request);
    }

    @ExceptionHandler(MissingOwnerException.class)
    public ResponseEntity<Map<String, Object>> handleMissingOwner(MissingOwnerException ex,
                                                                  HttpServletRequest request) {
        return respond(HttpStatus.UNAUTHORIZED, ex.getCode(), ex.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidBody(MethodArgumentNotValidException ex,
                                                                 HttpServletRequest request) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + " " + e.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return respond(HttpStatus.BAD_REQUEST, "validation_failed", details, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex,
                                                                HttpServletRequest request) {
        // binding failures (e.g. an unsupported algorithm tag) arrive wrapped here
        Throwable cause = ex.getMostSpecificCause();
        String message = cause instanceof ValidationException ? cause.getMessage() : "Malformed request body";
        return respond(HttpStatus.BAD_REQUEST, "validation_failed", message, request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleTypeMismatch(MethodArgumentTypeMismatchException ex,
                                                                  HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "validation_failed", "Invalid value for " + ex.getName(), request);
    }

    private static ResponseEntity<Map<String, Object>> respond(HttpStatus status, String code, String message,
                                                               HttpServletRequest request) {
        return ResponseEntity.status(status).body(body(status, code, message, request));
    }

    private static Map<String, Object> body(HttpStatus status, String code, String message,
                                            HttpServletRequest request) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("ok", false);
        out.put("status", status.value());
        out.put("error", code);
        out.put("message", message);
        if (request != null) {
            out.put("path", request.getRequestURI());
        }
        out.put("timestamp", Instant.now().toString());

        String trace = MDC.get("traceId");
        if (trace != null && !trace.isBlank()) {
            out.put("trace", trace);
        }
        return out;
    }
}
