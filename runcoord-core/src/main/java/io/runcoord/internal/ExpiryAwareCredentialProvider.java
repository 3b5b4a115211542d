package io.runcoord.internal;

import io.runcoord.CredentialProvider;
import io.runcoord.TokenRefresher;
import io.runcoord.TokenSource;
import io.runcoord.core.CredentialRefreshException;
import io.runcoord.core.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hands out stored tokens and refreshes them shortly before they expire.
 *
 * <p>Refreshes for one user are serialized so that concurrent occurrences owned by the same user do
 * not race to redeem the same refresh token.
 */
public class ExpiryAwareCredentialProvider implements CredentialProvider {
    private static final Logger log = LoggerFactory.getLogger(ExpiryAwareCredentialProvider.class);

    public static final Duration DEFAULT_REFRESH_BUFFER = Duration.ofMinutes(15);

    private final TokenSource tokens;
    private final TokenRefresher refresher;
    private final Duration refreshBuffer;
    private final Clock clock;

    private final ConcurrentHashMap<String, Object> userLocks = new ConcurrentHashMap<>();

    public ExpiryAwareCredentialProvider(TokenSource tokens, TokenRefresher refresher, Duration refreshBuffer, Clock clock) {
        this.tokens = Objects.requireNonNull(tokens, "tokens must not be null");
        this.refresher = Objects.requireNonNull(refresher, "refresher must not be null");
        this.refreshBuffer = Objects.requireNonNull(refreshBuffer, "refreshBuffer must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (refreshBuffer.isNegative()) {
            throw new IllegalArgumentException("refreshBuffer must not be negative");
        }
    }

    @Override
    public Token getValidToken(String userId) {
        Objects.requireNonNull(userId, "userId must not be null");

        Object lock = userLocks.computeIfAbsent(userId, k -> new Object());
        synchronized (lock) {
            Token current = tokens.load(userId)
                    .orElseThrow(() -> new CredentialRefreshException("no credential stored for user " + userId, true));

            Instant now = clock.instant();
            if (!current.expiresWithin(refreshBuffer, now)) {
                return current;
            }

            if (current.refreshToken() == null || current.refreshToken().isBlank()) {
                throw new CredentialRefreshException("credential of user " + userId + " expired and cannot be refreshed", true);
            }

            log.info("runcoord refreshing credential userId={} expiresAt={}", userId, current.expiresAt());

            Token refreshed;
            try {
                refreshed = refresher.refresh(current.refreshToken());
            } catch (CredentialRefreshException e) {
                log.warn("runcoord credential refresh failed userId={} permanent={} msg={}", userId, e.isPermanent(), e.getMessage());
                throw e;
            } catch (RuntimeException e) {
                log.warn("runcoord credential refresh failed userId={} msg={}", userId, e.getMessage());
                throw new CredentialRefreshException("credential refresh failed for user " + userId + ": " + e.getMessage(), false, e);
            }

            if (refreshed == null || refreshed.accessToken() == null) {
                throw new CredentialRefreshException("credential refresh returned no access token for user " + userId, false);
            }

            // providers that do not rotate refresh tokens omit them from the response
            if (refreshed.refreshToken() == null) {
                refreshed = new Token(refreshed.accessToken(), current.refreshToken(), refreshed.expiresAt());
            }
            tokens.store(userId, refreshed);
            return refreshed;
        }
    }
}
