package tech.noetzold.coverage_api.controller;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import tech.noetzold.coverage_api.RequestTraceFilter;
import tech.noetzold.coverage_api.exception.CoverageApiException;
import tech.noetzold.coverage_api.exception.ErrorKind;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Translates {@link ErrorKind} values into HTTP statuses. NOT_FOUND and FORBIDDEN
 * stay distinct so a gateway can decide whether to hide that a scenario exists.
 */
@Slf4j
@RestControllerAdvice
public class ErrorHandler {

    @ExceptionHandler(CoverageApiException.class)
    public ResponseEntity<Map<String, Object>> handleDomain(CoverageApiException ex) {
        if (ex.getKind() == ErrorKind.STORAGE_ERROR) {
            log.error("Storage error: {}", ex.getMessage(), ex);
            return body(ErrorKind.STORAGE_ERROR, "Storage error; re-fetch to confirm the current state");
        }
        log.debug("Request rejected with {}: {}", ex.getKind(), ex.getMessage());
        return body(ex.getKind(), ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidBody(MethodArgumentNotValidException ex) {
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(ErrorHandler::describe)
                .collect(Collectors.joining("; "));
        return body(ErrorKind.VALIDATION_ERROR, detail.isEmpty() ? "Request validation failed" : detail);
    }

    @ExceptionHandler({MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, Object>> handleMalformed(Exception ex) {
        return body(ErrorKind.VALIDATION_ERROR, ex.getMessage());
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<Map<String, Object>> handleDataAccess(DataAccessException ex) {
        log.error("Unhandled data access failure", ex);
        return body(ErrorKind.STORAGE_ERROR, "Storage error; re-fetch to confirm the current state");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception ex) {
        // framework errors (unknown path, wrong method, media type) keep their own status
        if (ex instanceof ErrorResponse framework && framework.getStatusCode().is4xxClientError()) {
            ErrorKind kind = framework.getStatusCode().value() == 404 ? ErrorKind.NOT_FOUND : ErrorKind.VALIDATION_ERROR;
            return body(kind, framework.getStatusCode(), ex.getMessage());
        }
        log.error("Unhandled failure: {}", ex.getMessage(), ex);
        return body(ErrorKind.INTERNAL_ERROR, "Internal error");
    }

    private static String describe(FieldError error) {
        return error.getField() + " " + error.getDefaultMessage();
    }

    private static ResponseEntity<Map<String, Object>> body(ErrorKind kind, String detail) {
        return body(kind, kind.status(), detail);
    }

    private static ResponseEntity<Map<String, Object>> body(ErrorKind kind, HttpStatusCode status, String detail) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("code", kind.name());
        body.put("detail", detail);
        String traceId = MDC.get(RequestTraceFilter.TRACE_ID);
        if (traceId != null) body.put("trace_id", traceId);
        return ResponseEntity.status(status).body(body);
    }
}
