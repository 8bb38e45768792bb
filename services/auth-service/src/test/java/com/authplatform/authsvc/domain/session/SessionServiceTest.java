package com.authplatform.authsvc.domain.session;

import com.authplatform.authsvc.domain.engine.SessionStrategy;
import com.authplatform.authsvc.domain.hook.AuthCallbacks;
import com.authplatform.authsvc.domain.hook.AuthEvents;
import com.authplatform.authsvc.domain.model.Session;
import com.authplatform.authsvc.domain.model.User;
import com.authplatform.authsvc.shared.crypto.TokenClaims;
import com.authplatform.authsvc.shared.exception.InvalidOrExpiredTokenException;
import com.authplatform.authsvc.shared.exception.RefreshTokensDisabledException;
import com.authplatform.authsvc.shared.exception.SessionNotFoundException;
import com.authplatform.authsvc.support.AuthEngineFixture;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionServiceTest {

    @Nested
    class RefreshTokens {

        private final AuthEngineFixture fixture = AuthEngineFixture.builder()
                .settings(s -> s.refreshTokensEnabled(true))
                .build();

        @Test
        void refreshRotatesAndRetiresTheOldToken() {
            var issued = fixture.engine.register("alice@example.com", "Passw0rd!", null).tokens();
            assertThat(issued.refreshToken()).matches("[0-9a-f]{64}");

            fixture.clock.advance(Duration.ofMinutes(5));
            var refreshed = fixture.engine.refreshAccessToken(issued.refreshToken());

            assertThat(refreshed.refreshToken()).isNotEqualTo(issued.refreshToken());
            assertThat(refreshed.sessionToken()).isEqualTo(issued.sessionToken());
            assertThat(refreshed.accessToken()).isNotEqualTo(issued.accessToken());
            assertThatThrownBy(() -> fixture.engine.refreshAccessToken(issued.refreshToken()))
                    .isInstanceOf(InvalidOrExpiredTokenException.class);

            fixture.engine.refreshAccessToken(refreshed.refreshToken());
        }

        @Test
        void expiredRefreshTokenIsRejected() {
            var issued = fixture.engine.register("alice@example.com", "Passw0rd!", null).tokens();

            fixture.clock.advance(Duration.ofDays(31));

            assertThatThrownBy(() -> fixture.engine.refreshAccessToken(issued.refreshToken()))
                    .isInstanceOf(InvalidOrExpiredTokenException.class);
        }

        @Test
        void concurrentRefreshWithSameTokenHasExactlyOneWinner() throws Exception {
            String refreshToken = fixture.engine.register("alice@example.com", "Passw0rd!", null)
                    .tokens().refreshToken();
            int callers = 8;
            CountDownLatch start = new CountDownLatch(1);
            ExecutorService pool = Executors.newFixedThreadPool(callers);
            try {
                List<Future<IssuedTokens>> results = new ArrayList<>();
                for (int i = 0; i < callers; i++) {
                    Callable<IssuedTokens> call = () -> {
                        start.await();
                        return fixture.engine.refreshAccessToken(refreshToken);
                    };
                    results.add(pool.submit(call));
                }
                start.countDown();

                int succeeded = 0;
                int rejected = 0;
                for (Future<IssuedTokens> result : results) {
                    try {
                        result.get();
                        succeeded++;
                    } catch (java.util.concurrent.ExecutionException e) {
                        assertThat(e.getCause()).isInstanceOf(InvalidOrExpiredTokenException.class);
                        rejected++;
                    }
                }
                assertThat(succeeded).isEqualTo(1);
                assertThat(rejected).isEqualTo(callers - 1);
            } finally {
                pool.shutdownNow();
            }
        }

        @Test
        void signOutAllRevokesEveryRefreshToken() {
            var registered = fixture.engine.register("alice@example.com", "Passw0rd!", null);
            var second = fixture.engine.signIn("alice@example.com", "Passw0rd!").tokens();

            int deleted = fixture.engine.signOutAllDevices(registered.user().getId());

            assertThat(deleted).isEqualTo(2);
            assertThatThrownBy(() -> fixture.engine.refreshAccessToken(second.refreshToken()))
                    .isInstanceOf(InvalidOrExpiredTokenException.class);
        }
    }

    @Nested
    class StatelessTokens {

        private final AuthEngineFixture fixture = AuthEngineFixture.create();

        @Test
        void refreshFailsWhenRefreshTokensAreDisabled() {
            assertThatThrownBy(() -> fixture.engine.refreshAccessToken("anything"))
                    .isInstanceOf(RefreshTokensDisabledException.class);
        }

        @Test
        void getSessionResolvesTheSignedToken() {
            var registered = fixture.engine.register("alice@example.com", "Passw0rd!", "Alice");

            AuthSession session = fixture.engine.getSession(registered.tokens().accessToken()).orElseThrow();

            assertThat(session.user().id()).isEqualTo(registered.user().getId());
            assertThat(session.user().email()).isEqualTo("alice@example.com");
            assertThat(session.sessionId()).isNull();
            assertThat(session.expires()).isEqualTo(registered.tokens().accessTokenExpiresAt());
        }

        @Test
        void getSessionIsEmptyForGarbageExpiredOrOrphanedTokens() {
            var registered = fixture.engine.register("alice@example.com", "Passw0rd!", null);
            String token = registered.tokens().accessToken();

            assertThat(fixture.engine.getSession("not.a.jwt")).isEmpty();
            assertThat(fixture.engine.getSession(null)).isEmpty();

            fixture.storage.deleteUser(registered.user().getId());
            assertThat(fixture.engine.getSession(token)).isEmpty();
        }

        @Test
        void tokensStopVerifyingAfterMaxAge() {
            String token = fixture.engine.register("alice@example.com", "Passw0rd!", null).tokens().accessToken();

            fixture.clock.advance(Duration.ofDays(30).plusMinutes(1));

            assertThat(fixture.engine.verifyToken(token)).isEmpty();
            assertThat(fixture.engine.getSession(token)).isEmpty();
        }
    }

    @Nested
    class DatabaseSessions {

        private final List<String> signedOut = new ArrayList<>();
        private final AuthEngineFixture fixture = AuthEngineFixture.builder()
                .settings(s -> s.sessionStrategy(SessionStrategy.DATABASE))
                .listener(new AuthEvents() {
                    @Override
                    public void onSignOut(Session session) {
                        signedOut.add(session.getUserId());
                    }
                })
                .build();

        @Test
        void signOutRevokesTheSessionBehindTheToken() {
            var registered = fixture.engine.register("alice@example.com", "Passw0rd!", null);
            var tokens = registered.tokens();
            assertThat(tokens.sessionToken()).isNotBlank();
            assertThat(tokens.refreshToken()).isNull();
            assertThat(fixture.engine.getSession(tokens.accessToken()))
                    .get()
                    .extracting(AuthSession::sessionId)
                    .isEqualTo(tokens.sessionToken());

            fixture.engine.signOut(tokens.sessionToken());

            assertThat(fixture.engine.getSession(tokens.accessToken())).isEmpty();
            assertThat(fixture.engine.verifyToken(tokens.accessToken())).isPresent();
            assertThat(signedOut).containsExactly(registered.user().getId());
        }

        @Test
        void signOutOfUnknownSessionFails() {
            assertThatThrownBy(() -> fixture.engine.signOut("no-such-session"))
                    .isInstanceOf(SessionNotFoundException.class);
        }
    }

    @Nested
    class Hooks {

        @Test
        void callbacksShapeClaimsAndSession() {
            AuthEngineFixture fixture = AuthEngineFixture.builder()
                    .callback(new AuthCallbacks() {
                        @Override
                        public TokenClaims shapeClaims(TokenClaims claims, User user) {
                            var custom = new java.util.HashMap<>(claims.customClaims());
                            custom.put("role", "admin");
                            return claims.toBuilder().customClaims(custom).build();
                        }

                        @Override
                        public AuthSession shapeSession(AuthSession session, TokenClaims claims) {
                            return session.withAttribute("role", claims.customClaim("role"));
                        }
                    })
                    .build();
            String token = fixture.engine.register("alice@example.com", "Passw0rd!", null).tokens().accessToken();

            assertThat(fixture.engine.verifyToken(token).orElseThrow().customClaim("role")).isEqualTo("admin");
            assertThat(fixture.engine.getSession(token).orElseThrow().attributes()).containsEntry("role", "admin");
        }

        @Test
        void failingEventListenerDoesNotBreakTheFlow() {
            List<String> later = new ArrayList<>();
            AuthEngineFixture fixture = AuthEngineFixture.builder()
                    .listener(new AuthEvents() {
                        @Override
                        public void onCreateUser(User user) {
                            throw new IllegalStateException("listener down");
                        }
                    })
                    .listener(new AuthEvents() {
                        @Override
                        public void onCreateUser(User user) {
                            later.add(user.getEmail());
                        }
                    })
                    .build();

            var result = fixture.engine.register("alice@example.com", "Passw0rd!", null);

            assertThat(result.tokens().accessToken()).isNotBlank();
            assertThat(later).containsExactly("alice@example.com");
        }

        @Test
        void failingCallbackFailsTheOperation() {
            AuthEngineFixture fixture = AuthEngineFixture.builder()
                    .callback(new AuthCallbacks() {
                        @Override
                        public TokenClaims shapeClaims(TokenClaims claims, User user) {
                            throw new IllegalStateException("claims service down");
                        }
                    })
                    .build();

            assertThatThrownBy(() -> fixture.engine.register("alice@example.com", "Passw0rd!", null))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("claims service down");
        }
    }
}
