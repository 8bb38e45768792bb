package com.authplatform.authsvc.domain.oauth;

import com.authplatform.authsvc.domain.hook.AuthEvents;
import com.authplatform.authsvc.domain.model.Account;
import com.authplatform.authsvc.domain.model.User;
import com.authplatform.authsvc.domain.port.IdentityProvider;
import com.authplatform.authsvc.domain.port.OAuthProfile;
import com.authplatform.authsvc.domain.port.ProviderTokens;
import com.authplatform.authsvc.domain.port.ProviderType;
import com.authplatform.authsvc.shared.exception.CsrfStateMismatchException;
import com.authplatform.authsvc.shared.exception.IdentityProviderException;
import com.authplatform.authsvc.shared.exception.ProviderNotFoundException;
import com.authplatform.authsvc.support.AuthEngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OAuthSignInServiceTest {

    private static final String STATE = "a1b2c3";

    private final IdentityProvider github = mock(IdentityProvider.class);
    private final List<String> events = new ArrayList<>();
    private AuthEngineFixture fixture;

    @BeforeEach
    void setUp() {
        when(github.id()).thenReturn("github");
        when(github.type()).thenReturn(ProviderType.OAUTH);
        when(github.authorizationUrl(anyString()))
                .thenAnswer(inv -> "https://github.com/login/oauth/authorize?state=" + inv.getArgument(0));

        fixture = AuthEngineFixture.builder()
                .provider(github)
                .listener(new AuthEvents() {
                    @Override
                    public void onCreateUser(User user) {
                        events.add("createUser");
                    }

                    @Override
                    public void onLinkAccount(User user, Account account) {
                        events.add("linkAccount:" + account.getProvider());
                    }

                    @Override
                    public void onSignIn(User user, Account account) {
                        events.add("signIn:" + account.getProvider());
                    }
                })
                .build();
    }

    @Test
    void authorizationUrlCarriesAFreshState() {
        var first = fixture.engine.getAuthorizationUrl("github");
        var second = fixture.engine.getAuthorizationUrl("github");

        assertThat(first.state()).matches("[0-9a-f]{64}").isNotEqualTo(second.state());
        assertThat(first.url()).endsWith("state=" + first.state());
    }

    @Test
    void stateMismatchFailsWithoutCallingTheProvider() {
        assertThatThrownBy(() -> fixture.engine.handleOAuthCallback("github", "code", STATE, "forged"))
                .isInstanceOf(CsrfStateMismatchException.class);
        assertThatThrownBy(() -> fixture.engine.handleOAuthCallback("github", "code", STATE, null))
                .isInstanceOf(CsrfStateMismatchException.class);

        verify(github, never()).exchangeCode(anyString());
    }

    @Test
    void blankExpectedStateIsRejected() {
        assertThatThrownBy(() -> fixture.engine.handleOAuthCallback("github", "code", "", ""))
                .isInstanceOf(CsrfStateMismatchException.class);
        assertThatThrownBy(() -> fixture.engine.handleOAuthCallback("github", "code", "  ", "  "))
                .isInstanceOf(CsrfStateMismatchException.class);

        verify(github, never()).exchangeCode(anyString());
    }

    @Test
    void oversizedProviderProfileIsBoundedOnCreate() {
        when(github.exchangeCode("code-long")).thenReturn(new OAuthProfile("gh-77", "long@example.com",
                "N".repeat(150), "https://avatars.example.com/" + "x".repeat(3000),
                new ProviderTokens("gho_access", null, null, "bearer", null, null)));

        var result = fixture.engine.handleOAuthCallback("github", "code-long", STATE, STATE);

        assertThat(result.isNewUser()).isTrue();
        assertThat(result.user().getName()).isEqualTo("N".repeat(100));
        assertThat(result.user().getImage()).isNull();
        assertThat(fixture.storage.getUser(result.user().getId()))
                .get()
                .satisfies(u -> assertThat(u.getName()).hasSize(100));
    }

    @Test
    void firstSignInCreatesVerifiedUserAndLinksAccount() {
        when(github.exchangeCode("code-1")).thenReturn(new OAuthProfile("gh-42", "Erin@Example.com", "Erin",
                "https://avatars.example.com/erin.png",
                new ProviderTokens("gho_access", null, null, "bearer", "read:user user:email", null)));

        var result = fixture.engine.handleOAuthCallback("github", "code-1", STATE, STATE);

        assertThat(result.isNewUser()).isTrue();
        assertThat(result.user().getEmail()).isEqualTo("erin@example.com");
        assertThat(result.user().getEmailVerified()).isEqualTo(fixture.clock.instant());
        assertThat(result.user().getImage()).isEqualTo("https://avatars.example.com/erin.png");
        assertThat(fixture.storage.getAccount("github", "gh-42"))
                .get()
                .satisfies(a -> {
                    assertThat(a.getUserId()).isEqualTo(result.user().getId());
                    assertThat(a.getAccessToken()).isEqualTo("gho_access");
                });
        assertThat(events).containsExactly("createUser", "linkAccount:github", "signIn:github");
    }

    @Test
    void returningUserIsResolvedByLinkedAccount() {
        when(github.exchangeCode(anyString())).thenReturn(
                new OAuthProfile("gh-42", "erin@example.com", "Erin", null,
                        new ProviderTokens("first", "r1", null, "bearer", null, null)),
                new OAuthProfile("gh-42", "changed@example.com", "Erin", null,
                        new ProviderTokens("second", null, Instant.parse("2024-02-01T00:00:00Z"), "bearer", null, null)));

        var first = fixture.engine.handleOAuthCallback("github", "c1", null, null);
        events.clear();
        var second = fixture.engine.handleOAuthCallback("github", "c2", null, null);

        assertThat(second.isNewUser()).isFalse();
        assertThat(second.user().getId()).isEqualTo(first.user().getId());
        Account account = fixture.storage.getAccount("github", "gh-42").orElseThrow();
        assertThat(account.getAccessToken()).isEqualTo("second");
        assertThat(account.getRefreshToken()).isEqualTo("r1");
        assertThat(events).containsExactly("signIn:github");
        verify(github, times(2)).exchangeCode(anyString());
    }

    @Test
    void linksProviderToExistingUserWithSameEmail() {
        var registered = fixture.engine.register("erin@example.com", "Passw0rd!", null);
        events.clear();
        when(github.exchangeCode("code")).thenReturn(new OAuthProfile("gh-42", "erin@example.com", "Erin", null));

        var result = fixture.engine.handleOAuthCallback("github", "code", STATE, STATE);

        assertThat(result.isNewUser()).isFalse();
        assertThat(result.user().getId()).isEqualTo(registered.user().getId());
        assertThat(fixture.storage.getUserByAccount("github", "gh-42")).get()
                .extracting(User::getId).isEqualTo(registered.user().getId());
        assertThat(events).containsExactly("linkAccount:github", "signIn:github");
    }

    @Test
    void profileWithoutEmailCannotCreateAUser() {
        when(github.exchangeCode("code")).thenReturn(new OAuthProfile("gh-42", null, "Erin", null));

        assertThatThrownBy(() -> fixture.engine.handleOAuthCallback("github", "code", STATE, STATE))
                .isInstanceOf(IdentityProviderException.class);
        assertThat(fixture.storage.getAccount("github", "gh-42")).isEmpty();
    }

    @Test
    void unknownProviderIsRejected() {
        assertThatThrownBy(() -> fixture.engine.getAuthorizationUrl("gitlab"))
                .isInstanceOf(ProviderNotFoundException.class);
        assertThatThrownBy(() -> fixture.engine.handleOAuthCallback("gitlab", "code", STATE, STATE))
                .isInstanceOf(ProviderNotFoundException.class);
    }
}
