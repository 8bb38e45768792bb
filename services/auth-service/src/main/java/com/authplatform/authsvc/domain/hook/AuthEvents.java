package com.authplatform.authsvc.domain.hook;

import com.authplatform.authsvc.domain.model.Account;
import com.authplatform.authsvc.domain.model.Session;
import com.authplatform.authsvc.domain.model.User;

/**
 * Side-effect listeners fired at lifecycle points. Return values are ignored and a failing
 * listener does not fail the operation that fired it.
 */
public interface AuthEvents {

    default void onCreateUser(User user) {
    }

    /**
     * @param account the account used to sign in; null for flows that are not tied to one
     */
    default void onSignIn(User user, Account account) {
    }

    default void onSignOut(Session session) {
    }

    default void onLinkAccount(User user, Account account) {
    }
}
