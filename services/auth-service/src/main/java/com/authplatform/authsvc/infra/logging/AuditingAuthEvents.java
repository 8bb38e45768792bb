package com.authplatform.authsvc.infra.logging;

import com.authplatform.authsvc.domain.hook.AuthEvents;
import com.authplatform.authsvc.domain.model.Account;
import com.authplatform.authsvc.domain.model.Session;
import com.authplatform.authsvc.domain.model.User;
import com.authplatform.authsvc.shared.security.SecurityUtils;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;

/**
 * Built-in listener: every lifecycle event becomes an audit line and a counter increment.
 */
@Component
@Order(0)
public class AuditingAuthEvents implements AuthEvents {

    private final AuditLogger auditLogger;
    private final MeterRegistry meterRegistry;
    private final SecurityUtils securityUtils;
    private final Clock clock;

    public AuditingAuthEvents(AuditLogger auditLogger, MeterRegistry meterRegistry, SecurityUtils securityUtils,
                              Clock clock) {
        this.auditLogger = auditLogger;
        this.meterRegistry = meterRegistry;
        this.securityUtils = securityUtils;
        this.clock = clock;
    }

    @Override
    public void onCreateUser(User user) {
        meterRegistry.counter("auth.user.created.total").increment();
        audit("USER_CREATED", user.getId(), "User created",
                Map.of("email", securityUtils.maskEmail(user.getEmail())));
    }

    @Override
    public void onSignIn(User user, Account account) {
        String method = account == null ? "unknown" : account.getProvider();
        meterRegistry.counter("auth.signin.total", "provider", method).increment();
        audit("USER_SIGNED_IN", user.getId(), "User signed in", Map.of("provider", method));
    }

    @Override
    public void onSignOut(Session session) {
        meterRegistry.counter("auth.signout.total").increment();
        audit("USER_SIGNED_OUT", session.getUserId(), "Session ended", Map.of());
    }

    @Override
    public void onLinkAccount(User user, Account account) {
        meterRegistry.counter("auth.account.linked.total", "provider", account.getProvider()).increment();
        audit("ACCOUNT_LINKED", user.getId(), "Account linked", Map.of("provider", account.getProvider()));
    }

    private void audit(String type, String userId, String description, Map<String, String> metadata) {
        auditLogger.log(AuditEvent.of(type, userId, securityUtils.getCurrentCorrelationId(), description,
                metadata, clock.instant()));
    }
}
