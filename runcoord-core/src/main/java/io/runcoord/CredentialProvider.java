package io.runcoord;

import io.runcoord.core.CredentialRefreshException;
import io.runcoord.core.Token;

/**
 * Supplies a credential that is valid for the duration of one API call.
 */
public interface CredentialProvider {

    Token getValidToken(String userId) throws CredentialRefreshException;
}
