package io.runcoord.core;

import java.time.Duration;
import java.time.Instant;

/**
 * Access credential for the external execution API.
 *
 * @param accessToken  bearer token sent with each request
 * @param refreshToken token used to obtain a new access token; may be null
 * @param expiresAt    expiry of the access token; null means it never expires
 */
public record Token(String accessToken, String refreshToken, Instant expiresAt) {

    public boolean expiresWithin(Duration buffer, Instant now) {
        if (expiresAt == null) {
            return false;
        }
        return !expiresAt.isAfter(now.plus(buffer));
    }

    @Override
    public String toString() {
        return "Token[expiresAt=" + expiresAt + "]";
    }
}
