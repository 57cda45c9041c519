package com.hybridforecast.exception;

import com.hybridforecast.config.RequestIdFilter;
import com.hybridforecast.dto.ApiError;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.List;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final String INVALID_REQUEST = "INVALID_REQUEST";
    static final String MALFORMED_REQUEST = "MALFORMED_REQUEST";
    static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(
            MethodArgumentNotValidException ex, HttpServletRequest request) {

        List<ApiError.FieldError> fieldErrors = ex.getBindingResult()
            .getFieldErrors()
            .stream()
            .map(fe -> ApiError.FieldError.builder()
                .field(fe.getField())
                .rejectedValue(rejectedValue(fe.getRejectedValue()))
                .message(fe.getDefaultMessage())
                .build())
            .toList();
        log.warn("Rejected pipeline request | fields={} | requestId={}",
                 fieldErrors.stream().map(ApiError.FieldError::getField).toList(),
                 RequestIdFilter.requestId(request));

        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Validation Failed", INVALID_REQUEST,
                       "Pipeline request failed validation", request, fieldErrors);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        log.warn("Unreadable pipeline request at {}: {}", request.getRequestURI(), ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Malformed Request", MALFORMED_REQUEST,
                       "Request body is not a valid pipeline request", request, null);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        String expected = ex.getRequiredType() != null ? ex.getRequiredType().getSimpleName() : "unknown";
        return respond(HttpStatus.BAD_REQUEST, "Type Mismatch", MALFORMED_REQUEST,
                       "'" + ex.getName() + "' must be a " + expected, request, null);
    }

    @ExceptionHandler(ForecastTableFormatException.class)
    public ResponseEntity<ApiError> handleTableFormat(
            ForecastTableFormatException ex, HttpServletRequest request) {
        log.warn("Rejected forecast table [{}]: {}", ex.getErrorCode(), ex.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Invalid Forecast Table", ex, request);
    }

    @ExceptionHandler(InvalidPipelineConfigException.class)
    public ResponseEntity<ApiError> handleConfig(
            InvalidPipelineConfigException ex, HttpServletRequest request) {
        log.warn("Rejected pipeline config [{}]: {}", ex.getErrorCode(), ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Pipeline Config", ex, request);
    }

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<ApiError> handleJobNotFound(
            JobNotFoundException ex, HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, "Not Found", ex, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(
            Exception ex, HttpServletRequest request) {
        log.error("Pipeline failed at {} | requestId={}: {}",
                  request.getRequestURI(), RequestIdFilter.requestId(request), ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", INTERNAL_ERROR,
                       "An unexpected error occurred", request, null);
    }

    private ResponseEntity<ApiError> respond(
            HttpStatus status, String error, HybridForecastException ex, HttpServletRequest request) {
        return respond(status, error, ex.getErrorCode(), ex.getMessage(), request, null);
    }

    private ResponseEntity<ApiError> respond(
            HttpStatus status, String error, String errorCode, String message,
            HttpServletRequest request, List<ApiError.FieldError> fieldErrors) {

        ApiError body = ApiError.builder()
            .status(status.value())
            .error(error)
            .errorCode(errorCode)
            .message(message)
            .path(request.getRequestURI())
            .requestId(RequestIdFilter.requestId(request))
            .timestamp(Instant.now())
            .fieldErrors(fieldErrors)
            .build();

        return ResponseEntity.status(status).body(body);
    }

    // forecast tables can be large; echo their size rather than the rows
    private static Object rejectedValue(Object value) {
        if (value instanceof List<?> rows) {
            return rows.size() + " rows";
        }
        return value;
    }
}
