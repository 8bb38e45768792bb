package com.authplatform.authsvc.domain.hook;

import com.authplatform.authsvc.domain.model.Account;
import com.authplatform.authsvc.domain.model.Session;
import com.authplatform.authsvc.domain.model.User;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.function.Consumer;

/**
 * Fans lifecycle events out to every registered {@link AuthEvents} listener, in order.
 * A listener that throws is logged and skipped.
 */
@Slf4j
public class AuthEventPublisher {

    private final List<AuthEvents> listeners;

    public AuthEventPublisher(List<AuthEvents> listeners) {
        this.listeners = List.copyOf(listeners);
    }

    public void userCreated(User user) {
        fire("createUser", l -> l.onCreateUser(user));
    }

    public void signedIn(User user, Account account) {
        fire("signIn", l -> l.onSignIn(user, account));
    }

    public void signedOut(Session session) {
        fire("signOut", l -> l.onSignOut(session));
    }

    public void accountLinked(User user, Account account) {
        fire("linkAccount", l -> l.onLinkAccount(user, account));
    }

    private void fire(String event, Consumer<AuthEvents> call) {
        for (AuthEvents listener : listeners) {
            try {
                call.accept(listener);
            } catch (RuntimeException e) {
                log.warn("Event listener failed: event={}, listener={}", event,
                        listener.getClass().getSimpleName(), e);
            }
        }
    }
}
