package io.runcoord;

import io.runcoord.core.ExecutionApiException;
import io.runcoord.core.ExecutionHandle;
import io.runcoord.core.ExecutionRequest;
import io.runcoord.core.ExecutionStatus;
import io.runcoord.core.Token;

/**
 * External analytics execution API.
 *
 * <p>Contract quirks: timestamps are submitted without zone suffix, data is no fresher than the
 * reporting lag, and rate limits come back as HTTP 429.
 */
public interface ExecutionApi {

    ExecutionHandle dispatch(ExecutionRequest request) throws ExecutionApiException;

    ExecutionStatus getStatus(ExecutionHandle handle, Token token) throws ExecutionApiException;
}
