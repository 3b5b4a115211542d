package io.runcoord;

import io.runcoord.core.CredentialRefreshException;
import io.runcoord.core.Token;

public interface TokenRefresher {

    /**
     * Exchanges a refresh token for a new access token.
     *
     * @throws CredentialRefreshException with {@code permanent = true} when the grant is revoked or invalid
     */
    Token refresh(String refreshToken) throws CredentialRefreshException;
}
