package com.flagship.retainer_settlement.web;

import com.flagship.retainer_settlement.deal.DealNotFoundException;
import com.flagship.retainer_settlement.identity.CallerNotAuthorizedException;
import com.flagship.retainer_settlement.identity.UnknownCallerRoleException;
import com.flagship.retainer_settlement.invoice.DealLinkException;
import com.flagship.retainer_settlement.invoice.InvoiceNotFoundException;
import com.flagship.retainer_settlement.invoice.InvoiceValidationException;
import com.flagship.retainer_settlement.settlement.SafetyLockException;
import com.flagship.retainer_settlement.settlement.StageTransitionFailedException;
import com.flagship.retainer_settlement.settlement.TransitionInProgressException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps exceptions to {@link ErrorResponse} bodies.
 *
 * 400 for bad input, 401/403 for caller problems, 404 for unknown deals and invoices,
 * 409 for state conflicts, 502 when the store rejected a stage change.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());
        return respond(HttpStatus.BAD_REQUEST, "Missing Required Header",
                "Required header '" + e.getHeaderName() + "' is missing", null);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(MissingServletRequestParameterException e) {
        log.warn("Missing required parameter: {}", e.getParameterName());
        return respond(HttpStatus.BAD_REQUEST, "Missing Required Parameter",
                "Required parameter '" + e.getParameterName() + "' is missing", null);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("Malformed value for {}: {}", e.getName(), e.getValue());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request",
                "Malformed value for '" + e.getName() + "'", null);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMostSpecificCause().getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", "Request body could not be read", null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());
        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing,
                LinkedHashMap::new
            ));
        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", "Request validation failed", errors);
    }

    @ExceptionHandler(InvoiceValidationException.class)
    public ResponseEntity<ErrorResponse> handleInvoiceValidation(InvoiceValidationException e) {
        log.warn("Invoice rejected: {}", e.getProblems());
        Map<String, String> details = new LinkedHashMap<>();
        for (int i = 0; i < e.getProblems().size(); i++) {
            details.put("problem_" + (i + 1), e.getProblems().get(i));
        }
        return respond(HttpStatus.BAD_REQUEST, "Invoice Not Submittable", e.getMessage(), details);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", e.getMessage(), null);
    }

    @ExceptionHandler(UnknownCallerRoleException.class)
    public ResponseEntity<ErrorResponse> handleUnknownCaller(UnknownCallerRoleException e) {
        log.warn("Unrecognised caller: {}", e.getMessage());
        return respond(HttpStatus.UNAUTHORIZED, "Unauthorized", e.getMessage(), null);
    }

    @ExceptionHandler(CallerNotAuthorizedException.class)
    public ResponseEntity<ErrorResponse> handleNotAuthorized(CallerNotAuthorizedException e) {
        log.warn("Caller not authorized: {}", e.getMessage());
        return respond(HttpStatus.FORBIDDEN, "Forbidden", e.getMessage(), null);
    }

    @ExceptionHandler({DealNotFoundException.class, InvoiceNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(RuntimeException e) {
        log.warn("Not found: {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, "Not Found", e.getMessage(), null);
    }

    @ExceptionHandler({SafetyLockException.class, TransitionInProgressException.class, DealLinkException.class})
    public ResponseEntity<ErrorResponse> handleConflict(RuntimeException e) {
        log.warn("Conflict: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "Conflict", e.getMessage(), null);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(IllegalStateException e) {
        log.warn("Invalid state: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "Invalid State", e.getMessage(), null);
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ErrorResponse> handleDataIntegrity(DataIntegrityViolationException e) {
        log.warn("Constraint violation: {}", e.getMostSpecificCause().getMessage());
        return respond(HttpStatus.CONFLICT, "Conflict",
                "The change conflicts with data written concurrently; reload and retry", null);
    }

    @ExceptionHandler(StageTransitionFailedException.class)
    public ResponseEntity<ErrorResponse> handleStageTransitionFailed(StageTransitionFailedException e) {
        log.error("Stage change failed and was rolled back: {}", e.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, "Stage Change Failed", e.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "An unexpected error occurred", null);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message,
                                                         Map<String, String> details) {
        ErrorResponse body = ErrorResponse.builder()
            .error(error)
            .message(message)
            .details(details)
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(status).body(body);
    }

    @lombok.Value
    @lombok.Builder
    public static class ErrorResponse {
        String error;
        String message;
        Map<String, String> details;
        Instant timestamp;
    }
}
