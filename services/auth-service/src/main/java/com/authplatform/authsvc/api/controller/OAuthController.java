package com.authplatform.authsvc.api.controller;

import com.authplatform.authsvc.api.dto.response.AuthResponse;
import com.authplatform.authsvc.config.AuthProperties;
import com.authplatform.authsvc.domain.engine.AuthEngine;
import com.authplatform.authsvc.shared.exception.CsrfStateMismatchException;
import com.authplatform.authsvc.shared.exception.IdentityProviderException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseCookie;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CookieValue;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;
import java.time.Duration;

/**
 * OAuth2 redirect and callback. The state travels in an HttpOnly cookie scoped to these paths.
 */
@RestController
@RequestMapping("/api/v1/auth/oauth")
@Slf4j
@Tag(name = "OAuth", description = "Sign-in through third-party identity providers")
public class OAuthController {

    public static final String STATE_COOKIE = "oauth_state";
    private static final String COOKIE_PATH = "/api/v1/auth/oauth";

    private final AuthEngine authEngine;
    private final AuthProperties.OAuth oauthProperties;

    public OAuthController(AuthEngine authEngine, AuthProperties properties) {
        this.authEngine = authEngine;
        this.oauthProperties = properties.oauth();
    }

    @GetMapping("/{provider}/authorize")
    @Operation(summary = "Start OAuth sign-in", description = "Redirects to the provider's consent page")
    @ApiResponse(responseCode = "302", description = "Redirect to provider")
    @ApiResponse(responseCode = "404", description = "Unknown provider")
    public ResponseEntity<Void> authorize(@PathVariable String provider) {
        var request = authEngine.getAuthorizationUrl(provider);
        return ResponseEntity.status(HttpStatus.FOUND)
                .location(URI.create(request.url()))
                .header(HttpHeaders.SET_COOKIE, stateCookie(request.state(), oauthProperties.stateMaxAge()).toString())
                .build();
    }

    @GetMapping("/{provider}/callback")
    @Operation(summary = "Complete OAuth sign-in", description = "Exchanges the code and signs the user in")
    @ApiResponse(responseCode = "200", description = "Signed in")
    @ApiResponse(responseCode = "403", description = "State mismatch")
    @ApiResponse(responseCode = "502", description = "Provider error")
    public ResponseEntity<AuthResponse> callback(
            @PathVariable String provider,
            @RequestParam(required = false) String code,
            @RequestParam(required = false) String state,
            @RequestParam(required = false) String error,
            @CookieValue(name = STATE_COOKIE, required = false) String expectedState) {
        if (expectedState == null) {
            log.warn("OAuth callback without state cookie: provider={}", provider);
            throw new CsrfStateMismatchException();
        }
        if (error != null) {
            throw new IdentityProviderException(provider, "Authorization denied by provider: " + error);
        }

        var result = authEngine.handleOAuthCallback(provider, code, expectedState, state);
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, stateCookie("", Duration.ZERO).toString())
                .body(AuthResponse.of(result.user(), result.tokens(), result.isNewUser()));
    }

    private ResponseCookie stateCookie(String value, Duration maxAge) {
        return ResponseCookie.from(STATE_COOKIE, value)
                .httpOnly(true)
                .secure(oauthProperties.secureCookie())
                .sameSite("Lax")
                .path(COOKIE_PATH)
                .maxAge(maxAge)
                .build();
    }
}
