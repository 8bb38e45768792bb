package com.authplatform.authsvc.api.error;

import com.authplatform.authsvc.shared.exception.AuthException;
import com.authplatform.authsvc.shared.exception.IdentityProviderException;
import com.authplatform.authsvc.shared.exception.RateLimitedException;
import com.authplatform.authsvc.shared.exception.ValidationException;
import com.authplatform.authsvc.shared.security.SecurityUtils;
import com.authplatform.authsvc.shared.validation.FieldError;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;
import java.util.Map;

/**
 * Maps auth failures and request binding errors to RFC 7807 responses.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);
    private static final String PROBLEM_TYPE_BASE = "https://api.auth-platform.com/problems/";

    private final SecurityUtils securityUtils;

    public GlobalExceptionHandler(SecurityUtils securityUtils) {
        this.securityUtils = securityUtils;
    }

    @ExceptionHandler(RateLimitedException.class)
    public ResponseEntity<ProblemDetail> handleRateLimited(RateLimitedException ex, HttpServletRequest request) {
        String correlationId = securityUtils.getCurrentCorrelationId();
        long retryAfter = ex.getRetryAfterSeconds();

        ProblemDetail problem = ProblemDetail.of(
                PROBLEM_TYPE_BASE + "rate-limited",
                "Rate Limit Exceeded",
                ex.getHttpStatus(),
                "Too many requests. Please try again later.",
                request.getRequestURI(),
                correlationId,
                ex.getErrorCode(),
                Map.of("retryAfter", retryAfter)
        );

        log.warn("Rate limit exceeded: path={}, correlationId={}", request.getRequestURI(), correlationId);

        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfter))
                .body(problem);
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ProblemDetail> handleValidation(ValidationException ex, HttpServletRequest request) {
        return validationProblem(ex.getErrors(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemDetail> handleInvalidBody(MethodArgumentNotValidException ex,
                                                           HttpServletRequest request) {
        List<FieldError> errors = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> FieldError.of(e.getField(), "INVALID", e.getDefaultMessage()))
                .toList();
        return validationProblem(errors, request);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<ProblemDetail> handleMalformed(Exception ex, HttpServletRequest request) {
        String correlationId = securityUtils.getCurrentCorrelationId();
        log.debug("Malformed request: correlationId={}, reason={}", correlationId, ex.getMessage());

        ProblemDetail problem = ProblemDetail.of(
                PROBLEM_TYPE_BASE + "malformed-request",
                "Malformed Request",
                400,
                "The request could not be read",
                request.getRequestURI(),
                correlationId,
                "MALFORMED_REQUEST"
        );
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(IdentityProviderException.class)
    public ResponseEntity<ProblemDetail> handleIdentityProvider(IdentityProviderException ex,
                                                                HttpServletRequest request) {
        log.warn("Identity provider failure: provider={}, reason={}", ex.getProviderId(), ex.getMessage());
        return buildResponse(ex, request, "Sign-in with " + ex.getProviderId() + " failed");
    }

    @ExceptionHandler(AuthException.class)
    public ResponseEntity<ProblemDetail> handleAuth(AuthException ex, HttpServletRequest request) {
        return buildResponse(ex, request, ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleGeneric(Exception ex, HttpServletRequest request) {
        String correlationId = securityUtils.getCurrentCorrelationId();

        log.error("Unexpected error: correlationId={}", correlationId, ex);

        ProblemDetail problem = ProblemDetail.of(
                PROBLEM_TYPE_BASE + "internal-error",
                "Internal Server Error",
                500,
                "An unexpected error occurred",
                request.getRequestURI(),
                correlationId,
                "INTERNAL_ERROR"
        );

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
    }

    private ResponseEntity<ProblemDetail> validationProblem(List<FieldError> errors, HttpServletRequest request) {
        String correlationId = securityUtils.getCurrentCorrelationId();

        ProblemDetail problem = ProblemDetail.of(
                PROBLEM_TYPE_BASE + "validation-error",
                "Validation Error",
                400,
                "One or more validation errors occurred",
                request.getRequestURI(),
                correlationId,
                "VALIDATION_ERROR",
                Map.of("errors", errors)
        );

        log.debug("Validation error: correlationId={}, errors={}", correlationId, errors);

        return ResponseEntity.badRequest().body(problem);
    }

    private ResponseEntity<ProblemDetail> buildResponse(AuthException ex, HttpServletRequest request, String detail) {
        String correlationId = securityUtils.getCurrentCorrelationId();

        ProblemDetail problem = ProblemDetail.of(
                PROBLEM_TYPE_BASE + ex.getErrorCode().toLowerCase().replace('_', '-'),
                toTitle(ex.getErrorCode()),
                ex.getHttpStatus(),
                detail,
                request.getRequestURI(),
                correlationId,
                ex.getErrorCode()
        );

        log.debug("Handled exception: type={}, correlationId={}", ex.getErrorCode(), correlationId);

        return ResponseEntity.status(ex.getHttpStatus()).body(problem);
    }

    private static String toTitle(String errorCode) {
        String words = errorCode.replace('_', ' ').toLowerCase();
        return Character.toUpperCase(words.charAt(0)) + words.substring(1);
    }
}
