package com.dgw.resolver.api;

import com.dgw.resolver.api.dto.ErrorResponse;
import com.dgw.resolver.ranking.UnknownProfileException;
import com.dgw.resolver.resilience.ExternalCallException;
import com.dgw.resolver.service.HandleNotFoundException;
import com.dgw.resolver.service.ResolutionFailedException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({
        HttpMessageNotReadableException.class,
        HttpMediaTypeNotSupportedException.class,
        MissingServletRequestParameterException.class,
        MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "bad_request", "Invalid request", request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleInvalidArgument(IllegalArgumentException ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage(), request);
    }

    @ExceptionHandler(UnknownProfileException.class)
    public ResponseEntity<ErrorResponse> handleUnknownProfile(UnknownProfileException ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "unknown_profile", ex.getMessage(), request);
    }

    @ExceptionHandler(HandleNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(HandleNotFoundException ex, HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, "not_found", ex.getMessage(), request);
    }

    @ExceptionHandler({ResolutionFailedException.class, ExternalCallException.class})
    public ResponseEntity<ErrorResponse> handleUpstream(RuntimeException ex, HttpServletRequest request) {
        log.warn("upstream failure path={} message={}", request.getRequestURI(), ex.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, "upstream_failure", "Upstream service failed", request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("unexpected error path={}", request.getRequestURI(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "Unexpected error", request);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String code, String message,
        HttpServletRequest request) {
        String traceId = RequestIdUtil.resolveOrGenerate(request, "x-trace-id");
        String requestId = RequestIdUtil.resolveOrGenerate(request, "x-request-id");
        return ResponseEntity.status(status).body(new ErrorResponse(code, message, traceId, requestId));
    }
}
