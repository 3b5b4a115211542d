package io.runcoord.core;

/**
 * Error reported by the external execution API.
 *
 * <p>{@code statusCode} is the HTTP status of the failed call, or {@code 0} when the request never got a
 * response.
 */
public class ExecutionApiException extends RuntimeException {

    private final int statusCode;

    public ExecutionApiException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public ExecutionApiException(int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }
}
