package com.authplatform.authsvc.domain.engine;

import com.authplatform.authsvc.domain.model.User;
import com.authplatform.authsvc.domain.oauth.OAuthSignInService;
import com.authplatform.authsvc.domain.oauth.OAuthSignInService.AuthorizationRequest;
import com.authplatform.authsvc.domain.oauth.OAuthSignInService.OAuthSignInResult;
import com.authplatform.authsvc.domain.registration.RegistrationService;
import com.authplatform.authsvc.domain.registration.RegistrationService.RegistrationResult;
import com.authplatform.authsvc.domain.reset.PasswordResetService;
import com.authplatform.authsvc.domain.reset.PasswordResetService.ResetResult;
import com.authplatform.authsvc.domain.reset.PasswordResetService.ResetTicket;
import com.authplatform.authsvc.domain.session.AuthSession;
import com.authplatform.authsvc.domain.session.IssuedTokens;
import com.authplatform.authsvc.domain.session.SessionService;
import com.authplatform.authsvc.domain.signin.CredentialSignInService;
import com.authplatform.authsvc.domain.signin.CredentialSignInService.SignInResult;
import com.authplatform.authsvc.domain.verification.EmailVerificationService;
import com.authplatform.authsvc.domain.verification.EmailVerificationService.VerificationTicket;
import com.authplatform.authsvc.shared.crypto.TokenClaims;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Single entry point to every authentication flow. Holds no state of its own; adapters call
 * this and nothing below it.
 */
@Service
public class AuthEngine {

    private final RegistrationService registrationService;
    private final CredentialSignInService signInService;
    private final PasswordResetService passwordResetService;
    private final EmailVerificationService emailVerificationService;
    private final SessionService sessionService;
    private final OAuthSignInService oauthSignInService;

    public AuthEngine(
            RegistrationService registrationService,
            CredentialSignInService signInService,
            PasswordResetService passwordResetService,
            EmailVerificationService emailVerificationService,
            SessionService sessionService,
            OAuthSignInService oauthSignInService) {
        this.registrationService = registrationService;
        this.signInService = signInService;
        this.passwordResetService = passwordResetService;
        this.emailVerificationService = emailVerificationService;
        this.sessionService = sessionService;
        this.oauthSignInService = oauthSignInService;
    }

    public RegistrationResult register(String email, String password, String name) {
        return registrationService.register(email, password, name);
    }

    public SignInResult signIn(String email, String password) {
        return signInService.signIn(email, password);
    }

    public ResetTicket requestPasswordReset(String email) {
        return passwordResetService.requestReset(email);
    }

    public User verifyResetToken(String resetToken) {
        return passwordResetService.verifyResetToken(resetToken);
    }

    public ResetResult resetPassword(String resetToken, String newPassword) {
        return passwordResetService.resetPassword(resetToken, newPassword);
    }

    public VerificationTicket sendVerificationEmail(String email) {
        return emailVerificationService.sendVerification(email);
    }

    public User verifyEmail(String verificationToken) {
        return emailVerificationService.verify(verificationToken);
    }

    public IssuedTokens refreshAccessToken(String refreshToken) {
        return sessionService.refresh(refreshToken);
    }

    public void signOut(String sessionToken) {
        sessionService.signOut(sessionToken);
    }

    public int signOutAllDevices(String userId) {
        return sessionService.signOutAll(userId);
    }

    public Optional<AuthSession> getSession(String token) {
        return sessionService.getSession(token);
    }

    public Optional<TokenClaims> verifyToken(String token) {
        return sessionService.verifyToken(token);
    }

    public AuthorizationRequest getAuthorizationUrl(String providerId) {
        return oauthSignInService.authorizationUrl(providerId);
    }

    public OAuthSignInResult handleOAuthCallback(String providerId, String code, String expectedState,
                                                 String receivedState) {
        return oauthSignInService.handleCallback(providerId, code, expectedState, receivedState);
    }
}
