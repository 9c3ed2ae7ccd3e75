package com.flagship.classroom_ledger.exception;

import com.flagship.classroom_ledger.claim.ClaimNotFoundException;
import com.flagship.classroom_ledger.claim.ClaimNotPendingException;
import com.flagship.classroom_ledger.enrollment.AlreadyEnrolledException;
import com.flagship.classroom_ledger.enrollment.EnrollmentCancelledException;
import com.flagship.classroom_ledger.enrollment.EnrollmentNotFoundException;
import com.flagship.classroom_ledger.enrollment.InsufficientFundsException;
import com.flagship.classroom_ledger.enrollment.RepurchaseBlockedException;
import com.flagship.classroom_ledger.ledger.AlreadyVoidedException;
import com.flagship.classroom_ledger.ledger.InvalidAmountException;
import com.flagship.classroom_ledger.ledger.TransactionNotFoundException;
import com.flagship.classroom_ledger.policy.DuplicatePolicyCodeException;
import com.flagship.classroom_ledger.policy.PolicyInactiveException;
import com.flagship.classroom_ledger.policy.PolicyLockedException;
import com.flagship.classroom_ledger.policy.PolicyNotFoundException;
import com.flagship.classroom_ledger.tenant.CrossTenantViolationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Clock;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps exceptions to HTTP responses.
 *
 * 400 malformed request, 403 cross-tenant access, 404 unknown or stale
 * reference, 409 conflicting state, 422 amount rejected by the ledger or
 * not covered by the balance.
 * Claim rule failures are not exceptions; the claim controller answers them
 * with 422 directly.
 */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

    private final Clock clock;

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ApiError> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());
        return respond(HttpStatus.BAD_REQUEST, ApiError.builder()
            .error("Missing Required Header")
            .message("Required header '" + e.getHeaderName() + "' is missing"));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        return respond(HttpStatus.BAD_REQUEST, ApiError.builder()
            .error("Validation Failed")
            .message("Request validation failed")
            .details(errors));
    }

    @ExceptionHandler({MethodArgumentTypeMismatchException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ApiError> handleUnreadable(Exception e) {
        log.warn("Unreadable request: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ApiError.builder()
            .error("Invalid Request")
            .message("Request could not be read"));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ApiError.builder()
            .error("Invalid Request")
            .message(e.getMessage()));
    }

    // ==================== Integrity ====================

    @ExceptionHandler(CrossTenantViolationException.class)
    public ResponseEntity<ApiError> handleCrossTenant(CrossTenantViolationException e) {
        // already audited by the guard; the message names the foreign entity, so it is not echoed
        log.warn("Cross-tenant access refused: entityType={}, entityId={}", e.getEntityType(), e.getEntityId());
        return respond(HttpStatus.FORBIDDEN, ApiError.builder()
            .error("Forbidden")
            .code(e.getCode())
            .message("Entity is not visible in this tenant")
            .retryable(false));
    }

    @ExceptionHandler(IntegrityViolationException.class)
    public ResponseEntity<ApiError> handleIntegrityViolation(IntegrityViolationException e) {
        log.warn("Integrity violation: code={}, message={}", e.getCode(), e.getMessage());
        return respond(HttpStatus.CONFLICT, ApiError.builder()
            .error("Integrity Violation")
            .code(e.getCode())
            .message(e.getMessage())
            .retryable(false));
    }

    // ==================== Not found ====================

    @ExceptionHandler({
        TransactionNotFoundException.class,
        PolicyNotFoundException.class,
        EnrollmentNotFoundException.class,
        ClaimNotFoundException.class
    })
    public ResponseEntity<ApiError> handleNotFound(RuntimeException e) {
        log.info("Not found: {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, ApiError.builder()
            .error("Not Found")
            .code(codeOf(e))
            .message(e.getMessage()));
    }

    // ==================== Conflicts ====================

    @ExceptionHandler({
        AlreadyVoidedException.class,
        AlreadyEnrolledException.class,
        RepurchaseBlockedException.class,
        EnrollmentCancelledException.class,
        PolicyInactiveException.class,
        PolicyLockedException.class,
        DuplicatePolicyCodeException.class,
        ClaimNotPendingException.class
    })
    public ResponseEntity<ApiError> handleConflict(RuntimeException e) {
        log.warn("Conflict: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, ApiError.builder()
            .error("Conflict")
            .code(codeOf(e))
            .message(e.getMessage())
            .retryable(false));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiError> handleIllegalState(IllegalStateException e) {
        log.warn("Invalid state: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, ApiError.builder()
            .error("Invalid State")
            .message(e.getMessage())
            .retryable(false));
    }

    @ExceptionHandler(InvalidAmountException.class)
    public ResponseEntity<ApiError> handleInvalidAmount(InvalidAmountException e) {
        log.warn("Invalid amount: {}", e.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, ApiError.builder()
            .error("Invalid Amount")
            .code(codeOf(e))
            .message(e.getMessage()));
    }

    @ExceptionHandler(InsufficientFundsException.class)
    public ResponseEntity<ApiError> handleInsufficientFunds(InsufficientFundsException e) {
        log.info("Insufficient funds: subjectId={}, available={}, required={}",
                e.getSubjectId(), e.getAvailable(), e.getRequired());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, ApiError.builder()
            .error("Insufficient Funds")
            .code(codeOf(e))
            .message(e.getMessage())
            .retryable(false));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ApiError.builder()
            .error("Internal Server Error")
            .message("An unexpected error occurred"));
    }

    private ResponseEntity<ApiError> respond(HttpStatus status, ApiError.ApiErrorBuilder builder) {
        return ResponseEntity.status(status).body(builder.timestamp(clock.instant()).build());
    }

    /**
     * TRANSACTION_NOT_FOUND from TransactionNotFoundException, and so on.
     */
    static String codeOf(RuntimeException e) {
        String name = e.getClass().getSimpleName().replaceFirst("Exception$", "");
        return name.replaceAll("([a-z])([A-Z])", "$1_$2").toUpperCase();
    }
}
