package com.authplatform.authsvc.api.controller;

import com.authplatform.authsvc.api.dto.request.EmailRequest;
import com.authplatform.authsvc.api.dto.request.RefreshTokenRequest;
import com.authplatform.authsvc.api.dto.request.RegisterRequest;
import com.authplatform.authsvc.api.dto.request.ResetPasswordRequest;
import com.authplatform.authsvc.api.dto.request.SignInRequest;
import com.authplatform.authsvc.api.dto.request.SignOutRequest;
import com.authplatform.authsvc.api.dto.request.VerifyEmailRequest;
import com.authplatform.authsvc.api.dto.response.AuthResponse;
import com.authplatform.authsvc.api.dto.response.SessionResponse;
import com.authplatform.authsvc.api.dto.response.SignOutAllResponse;
import com.authplatform.authsvc.api.dto.response.TokenResponse;
import com.authplatform.authsvc.api.dto.response.UserResponse;
import com.authplatform.authsvc.domain.engine.AuthEngine;
import com.authplatform.authsvc.domain.port.TokenDelivery;
import com.authplatform.authsvc.domain.ratelimit.RateLimitService;
import com.authplatform.authsvc.domain.session.AuthSession;
import com.authplatform.authsvc.shared.exception.EmailAlreadyVerifiedException;
import com.authplatform.authsvc.shared.exception.InvalidCredentialsException;
import com.authplatform.authsvc.shared.exception.UserNotFoundException;
import com.authplatform.authsvc.shared.security.SecurityUtils;
import io.micrometer.core.instrument.Counter;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;

@RestController
@RequestMapping("/api/v1/auth")
@Slf4j
@Tag(name = "Authentication", description = "Credential sign-in, password reset, email verification and sessions")
public class AuthController {

    private final AuthEngine authEngine;
    private final RateLimitService rateLimitService;
    private final TokenDelivery tokenDelivery;
    private final SecurityUtils securityUtils;
    private final Counter refreshCounter;
    private final Counter failedSignInCounter;

    public AuthController(
            AuthEngine authEngine,
            RateLimitService rateLimitService,
            TokenDelivery tokenDelivery,
            SecurityUtils securityUtils,
            @Qualifier("refreshCounter") Counter refreshCounter,
            @Qualifier("failedSignInCounter") Counter failedSignInCounter) {
        this.authEngine = authEngine;
        this.rateLimitService = rateLimitService;
        this.tokenDelivery = tokenDelivery;
        this.securityUtils = securityUtils;
        this.refreshCounter = refreshCounter;
        this.failedSignInCounter = failedSignInCounter;
    }

    @PostMapping("/register")
    @Operation(summary = "Register", description = "Creates a user with a credential account and signs them in")
    @ApiResponse(responseCode = "201", description = "User created")
    @ApiResponse(responseCode = "400", description = "Invalid input")
    @ApiResponse(responseCode = "409", description = "Email already registered")
    @ApiResponse(responseCode = "429", description = "Rate limit exceeded")
    public ResponseEntity<AuthResponse> register(@Valid @RequestBody RegisterRequest request,
                                                 HttpServletRequest httpRequest) {
        rateLimitService.checkRegistration(securityUtils.clientIp(httpRequest));
        log.info("Processing registration: email={}", securityUtils.maskEmail(request.email()));

        var result = authEngine.register(request.email(), request.password(), request.name());
        tokenDelivery.deliverEmailVerification(result.user(), result.verificationToken(),
                result.verificationTokenExpiresAt());

        return ResponseEntity.status(HttpStatus.CREATED).body(AuthResponse.of(result.user(), result.tokens()));
    }

    @PostMapping("/signin")
    @Operation(summary = "Sign in with email and password")
    @ApiResponse(responseCode = "200", description = "Signed in")
    @ApiResponse(responseCode = "401", description = "Invalid email or password")
    @ApiResponse(responseCode = "429", description = "Rate limit exceeded")
    public ResponseEntity<AuthResponse> signIn(@Valid @RequestBody SignInRequest request,
                                               HttpServletRequest httpRequest) {
        rateLimitService.checkSignIn(securityUtils.clientIp(httpRequest));
        try {
            var result = authEngine.signIn(request.email(), request.password());
            return ResponseEntity.ok(AuthResponse.of(result.user(), result.tokens()));
        } catch (InvalidCredentialsException e) {
            failedSignInCounter.increment();
            throw e;
        }
    }

    @PostMapping("/password/forgot")
    @Operation(summary = "Request a password reset", description = "Always accepted, whether or not the email exists")
    @ApiResponse(responseCode = "202", description = "Request accepted")
    @ApiResponse(responseCode = "429", description = "Rate limit exceeded")
    public ResponseEntity<Void> forgotPassword(@Valid @RequestBody EmailRequest request,
                                               HttpServletRequest httpRequest) {
        rateLimitService.checkPasswordReset(securityUtils.clientIp(httpRequest));
        try {
            var ticket = authEngine.requestPasswordReset(request.email());
            tokenDelivery.deliverPasswordReset(ticket.user(), ticket.resetToken(), ticket.expiresAt());
        } catch (UserNotFoundException e) {
            log.debug("Password reset for unknown email: {}", securityUtils.maskEmail(request.email()));
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).build();
    }

    @GetMapping("/password/reset/{token}")
    @Operation(summary = "Check a reset token", description = "Succeeds while the token is unused and unexpired")
    @ApiResponse(responseCode = "204", description = "Token is valid")
    @ApiResponse(responseCode = "400", description = "Invalid or expired token")
    public ResponseEntity<Void> verifyResetToken(@PathVariable String token) {
        authEngine.verifyResetToken(token);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/password/reset")
    @Operation(summary = "Reset password", description = "Consumes the reset token and signs the user in")
    @ApiResponse(responseCode = "200", description = "Password changed")
    @ApiResponse(responseCode = "400", description = "Invalid or expired token")
    public ResponseEntity<AuthResponse> resetPassword(@Valid @RequestBody ResetPasswordRequest request) {
        var result = authEngine.resetPassword(request.token(), request.newPassword());
        return ResponseEntity.ok(AuthResponse.of(result.user(), result.tokens()));
    }

    @PostMapping("/verification/send")
    @Operation(summary = "Send a verification email", description = "Always accepted, whether or not the email exists")
    @ApiResponse(responseCode = "202", description = "Request accepted")
    @ApiResponse(responseCode = "429", description = "Rate limit exceeded")
    public ResponseEntity<Void> sendVerification(@Valid @RequestBody EmailRequest request,
                                                 HttpServletRequest httpRequest) {
        rateLimitService.checkVerificationSend(securityUtils.clientIp(httpRequest));
        try {
            var ticket = authEngine.sendVerificationEmail(request.email());
            tokenDelivery.deliverEmailVerification(ticket.user(), ticket.verificationToken(), ticket.expiresAt());
        } catch (UserNotFoundException | EmailAlreadyVerifiedException e) {
            log.debug("Verification not sent: reason={}", e.getErrorCode());
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).build();
    }

    @PostMapping("/verification/confirm")
    @Operation(summary = "Confirm an email address")
    @ApiResponse(responseCode = "200", description = "Email verified")
    @ApiResponse(responseCode = "400", description = "Invalid or expired token")
    public ResponseEntity<UserResponse> confirmVerification(@Valid @RequestBody VerifyEmailRequest request) {
        return ResponseEntity.ok(UserResponse.from(authEngine.verifyEmail(request.token())));
    }

    @PostMapping("/token/refresh")
    @Operation(summary = "Rotate a refresh token", description = "Returns a new access token and a new refresh token")
    @ApiResponse(responseCode = "200", description = "Tokens rotated")
    @ApiResponse(responseCode = "400", description = "Invalid, expired or already used refresh token")
    public ResponseEntity<TokenResponse> refresh(@Valid @RequestBody RefreshTokenRequest request) {
        var tokens = authEngine.refreshAccessToken(request.refreshToken());
        refreshCounter.increment();
        return ResponseEntity.ok(TokenResponse.from(tokens));
    }

    @PostMapping("/signout")
    @Operation(summary = "Sign out of one session")
    @ApiResponse(responseCode = "204", description = "Session ended")
    @ApiResponse(responseCode = "404", description = "Session not found")
    public ResponseEntity<Void> signOut(
            @RequestBody(required = false) SignOutRequest request,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        String sessionToken = request != null && request.sessionToken() != null
                ? request.sessionToken()
                : currentSession(authorization).map(AuthSession::sessionId).orElse(null);
        authEngine.signOut(sessionToken);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/signout/all")
    @Operation(summary = "Sign out of every session of the current user")
    @ApiResponse(responseCode = "200", description = "Sessions ended")
    @ApiResponse(responseCode = "401", description = "Missing or invalid bearer token")
    public ResponseEntity<SignOutAllResponse> signOutAll(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        Optional<AuthSession> session = currentSession(authorization);
        if (session.isEmpty()) {
            return unauthorized();
        }
        int deleted = authEngine.signOutAllDevices(session.get().user().id());
        return ResponseEntity.ok(new SignOutAllResponse(deleted));
    }

    @GetMapping("/session")
    @Operation(summary = "Current session", description = "Resolves the bearer token to its user and expiry")
    @ApiResponse(responseCode = "200", description = "Session is valid")
    @ApiResponse(responseCode = "401", description = "Missing, invalid or revoked token")
    public ResponseEntity<SessionResponse> session(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        return currentSession(authorization)
                .map(s -> ResponseEntity.ok(SessionResponse.from(s)))
                .orElseGet(AuthController::unauthorized);
    }

    private Optional<AuthSession> currentSession(String authorization) {
        String token = securityUtils.extractBearerToken(authorization);
        return token == null ? Optional.empty() : authEngine.getSession(token);
    }

    private static <T> ResponseEntity<T> unauthorized() {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .header(HttpHeaders.WWW_AUTHENTICATE, "Bearer")
                .build();
    }
}
