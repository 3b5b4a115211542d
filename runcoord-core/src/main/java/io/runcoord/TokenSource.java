package io.runcoord;

import io.runcoord.core.Token;

import java.util.Optional;

/**
 * Where user credentials are kept.
 */
public interface TokenSource {

    Optional<Token> load(String userId);

    void store(String userId, Token token);
}
