package io.runcoord.core;

/**
 * Raised when no usable credential can be produced for a user.
 *
 * <p>{@code permanent} is set when the refresh mechanism reports the credential itself as invalid
 * (revoked grant, missing refresh token); anything else is worth retrying.
 */
public class CredentialRefreshException extends RuntimeException {

    private final boolean permanent;

    public CredentialRefreshException(String message, boolean permanent) {
        super(message);
        this.permanent = permanent;
    }

    public CredentialRefreshException(String message, boolean permanent, Throwable cause) {
        super(message, cause);
        this.permanent = permanent;
    }

    public boolean isPermanent() {
        return permanent;
    }
}
