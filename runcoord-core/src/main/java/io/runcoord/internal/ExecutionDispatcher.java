package io.runcoord.internal;

import io.runcoord.CredentialProvider;
import io.runcoord.ExecutionApi;
import io.runcoord.RunHistory;
import io.runcoord.core.CredentialRefreshException;
import io.runcoord.core.DispatchResult;
import io.runcoord.core.ExecutionApiException;
import io.runcoord.core.ExecutionHandle;
import io.runcoord.core.ExecutionRequest;
import io.runcoord.core.ExecutionStatus;
import io.runcoord.core.FailureKind;
import io.runcoord.core.Occurrence;
import io.runcoord.core.RunTrigger;
import io.runcoord.core.Schedule;
import io.runcoord.core.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Performs one dispatch attempt of a claimed occurrence against the external execution API.
 *
 * <p>Never throws for API or credential problems: every failure is folded into a {@link DispatchResult}
 * carrying a {@link FailureKind}. The API call runs on {@code callExecutor} and is abandoned after
 * {@code dispatchTimeout}, which counts as a transient failure.
 */
public class ExecutionDispatcher {
    private static final Logger log = LoggerFactory.getLogger(ExecutionDispatcher.class);

    private final CredentialProvider credentials;
    private final ExecutionApi api;
    private final ExecutionRequestFactory requestFactory;
    private final RunHistory history;
    private final Duration dispatchTimeout;
    private final ExecutorService callExecutor;

    public ExecutionDispatcher(
            CredentialProvider credentials,
            ExecutionApi api,
            ExecutionRequestFactory requestFactory,
            RunHistory history,
            Duration dispatchTimeout,
            ExecutorService callExecutor
    ) {
        this.credentials = Objects.requireNonNull(credentials, "credentials must not be null");
        this.api = Objects.requireNonNull(api, "api must not be null");
        this.requestFactory = Objects.requireNonNull(requestFactory, "requestFactory must not be null");
        this.history = Objects.requireNonNull(history, "history must not be null");
        this.dispatchTimeout = Objects.requireNonNull(dispatchTimeout, "dispatchTimeout must not be null");
        this.callExecutor = Objects.requireNonNull(callExecutor, "callExecutor must not be null");
    }

    public DispatchResult dispatch(Schedule schedule, Occurrence occurrence, int attempt) {
        Objects.requireNonNull(schedule, "schedule must not be null");
        Objects.requireNonNull(occurrence, "occurrence must not be null");
        if (occurrence.window() == null) {
            throw new IllegalStateException("occurrence window has not been computed: " + occurrence.scheduleId());
        }

        Token token;
        try {
            token = credentials.getValidToken(schedule.userId());
        } catch (CredentialRefreshException e) {
            FailureKind kind = e.isPermanent() ? FailureKind.CREDENTIAL_REVOKED : FailureKind.CREDENTIAL_TRANSIENT;
            return DispatchResult.rejected(kind, e.getMessage());
        }

        ExecutionRequest request;
        try {
            request = requestFactory.build(
                    schedule,
                    occurrence.window(),
                    token,
                    RunTrigger.SCHEDULED,
                    occurrence.runId(),
                    attempt,
                    Map.of()
            );
        } catch (IllegalArgumentException e) {
            return DispatchResult.rejected(FailureKind.INVALID_CONFIGURATION, e.getMessage());
        }

        log.debug("runcoord dispatching scheduleId={} attempt={} window={}", schedule.id(), attempt, occurrence.window());

        ExecutionHandle handle;
        Future<ExecutionHandle> call = callExecutor.submit(() -> api.dispatch(request));
        try {
            handle = call.get(dispatchTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            return DispatchResult.rejected(FailureKind.TIMEOUT,
                    "no response within " + dispatchTimeout.toSeconds() + "s");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            call.cancel(true);
            return DispatchResult.rejected(FailureKind.TIMEOUT, "interrupted while waiting for the execution API");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            FailureKind kind = classify(cause);
            return DispatchResult.rejected(kind, cause.getMessage());
        }

        if (handle == null) {
            return DispatchResult.rejected(FailureKind.UNEXPECTED, "execution API returned no handle");
        }

        // the run is live downstream from here on: a failed history write must not turn into a re-dispatch
        if (occurrence.runId() != null) {
            try {
                history.attachHandle(occurrence.runId(), handle, attempt);
            } catch (RuntimeException e) {
                log.error("runcoord attachHandle failed scheduleId={} runId={} handle={} msg={}",
                        schedule.id(), occurrence.runId(), handle, e.getMessage(), e);
            }
        }
        return DispatchResult.dispatched(handle);
    }

    /**
     * Looks up the downstream status of a dispatched run.
     */
    public ExecutionStatus statusOf(String userId, ExecutionHandle handle) {
        Objects.requireNonNull(handle, "handle must not be null");
        return api.getStatus(handle, credentials.getValidToken(userId));
    }

    /**
     * Maps an exception raised by the API client to a failure kind.
     */
    public static FailureKind classify(Throwable error) {
        if (error instanceof ExecutionApiException apiError) {
            return classifyStatus(apiError.statusCode(), apiError);
        }
        if (error instanceof CredentialRefreshException credentialError) {
            return credentialError.isPermanent() ? FailureKind.CREDENTIAL_REVOKED : FailureKind.CREDENTIAL_TRANSIENT;
        }
        if (hasIoCause(error)) {
            return FailureKind.NETWORK;
        }
        if (error instanceof IllegalArgumentException) {
            return FailureKind.INVALID_CONFIGURATION;
        }
        return FailureKind.UNEXPECTED;
    }

    private static FailureKind classifyStatus(int status, Throwable error) {
        if (status == 0) {
            return FailureKind.NETWORK;
        }
        if (status == 429) {
            return FailureKind.RATE_LIMITED;
        }
        if (status == 408) {
            return FailureKind.TIMEOUT;
        }
        if (status >= 500) {
            return FailureKind.SERVER_ERROR;
        }
        if (status == 401 || status == 403) {
            return FailureKind.AUTHORIZATION_DENIED;
        }
        if (status == 400 || status == 422) {
            return FailureKind.VALIDATION;
        }
        if (status >= 400) {
            return FailureKind.INVALID_CONFIGURATION;
        }
        return hasIoCause(error) ? FailureKind.NETWORK : FailureKind.UNEXPECTED;
    }

    private static boolean hasIoCause(Throwable error) {
        Throwable t = error;
        int depth = 0;
        while (t != null && depth++ < 10) {
            if (t instanceof IOException || t instanceof UncheckedIOException) {
                return true;
            }
            t = t.getCause();
        }
        return false;
    }
}
