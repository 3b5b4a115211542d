package io.runcoord.core;

/**
 * Closed set of reasons an occurrence attempt can fail.
 *
 * <p>Retryable kinds surface as transient dispatch errors and are retried with backoff; the rest are
 * permanent configuration errors and end the occurrence on the first failure. {@link #summary()} is
 * the text shown in the schedule history instead of the raw classification.
 */
public enum FailureKind {
    NETWORK(true, "Could not reach the execution service"),
    TIMEOUT(true, "The execution service did not respond in time"),
    RATE_LIMITED(true, "The execution service is throttling requests"),
    SERVER_ERROR(true, "The execution service reported an internal error"),
    CREDENTIAL_TRANSIENT(true, "Could not refresh the account credentials"),

    INVALID_CONFIGURATION(false, "The query or its parameters are invalid"),
    VALIDATION(false, "The execution request was rejected as invalid"),
    AUTHORIZATION_DENIED(false, "The account is not authorized to run this query"),
    CREDENTIAL_REVOKED(false, "The account credentials are no longer valid, reconnect the account"),
    UNEXPECTED(false, "The run failed unexpectedly");

    private final boolean retryable;
    private final String summary;

    FailureKind(boolean retryable, String summary) {
        this.retryable = retryable;
        this.summary = summary;
    }

    public boolean retryable() {
        return retryable;
    }

    public String summary() {
        return summary;
    }
}
