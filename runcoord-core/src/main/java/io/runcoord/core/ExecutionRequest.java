package io.runcoord.core;

import java.util.Map;

/**
 * Request sent to the external execution API.
 *
 * <p>{@code parameters} already contains the formatted {@code startDate}/{@code endDate} values.
 */
public record ExecutionRequest(
        String instanceId,
        String queryId,
        String query,
        Token token,
        ReportWindow window,
        Map<String, Object> parameters,
        RunTrigger trigger
) {
    public ExecutionRequest {
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
    }
}
