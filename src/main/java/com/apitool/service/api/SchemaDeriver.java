package com.apitool.service.api;

import com.apitool.model.ApiOperation;
import com.apitool.model.execution.DerivedInputSchema;

public interface SchemaDeriver {
    /**
     * Flattens the operation's parameters, server variables and object body properties into one
     * object schema. Never throws: on failure the returned schema is empty and annotated.
     *
     * @param operation The normalized operation.
     * @return The derived schema, possibly degraded.
     */
    DerivedInputSchema derive(ApiOperation operation);
}
