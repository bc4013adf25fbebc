package com.apitool.service.api;

import com.apitool.model.execution.ExecutionOutcome;
import com.apitool.model.execution.OutboundRequest;

public interface ToolInvoker {
    /**
     * Sends the request once, without retrying, and maps the response.
     *
     * @param request The assembled request.
     * @return {@link com.apitool.model.execution.Succeeded} for a 2xx answer, otherwise a
     *         {@link com.apitool.model.execution.Failed} of kind {@code UPSTREAM_ERROR}.
     */
    ExecutionOutcome invoke(OutboundRequest request);
}
