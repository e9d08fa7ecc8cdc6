package com.async.trace.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * How an instrumented computation finished. Recorded in the trace only,
 * never used to alter control flow.
 *
 * @param status      success or error
 * @param description description of the error, {@code null} on success
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AsyncOutcome(Status status, String description) {

    private static final AsyncOutcome SUCCESS = new AsyncOutcome(Status.SUCCESS, null);

    public AsyncOutcome {
        Objects.requireNonNull(status, "status is required");
        if (status == Status.ERROR) {
            Objects.requireNonNull(description, "description is required for an error outcome");
        }
    }

    public static AsyncOutcome success() {
        return SUCCESS;
    }

    public static AsyncOutcome error(String description) {
        return new AsyncOutcome(Status.ERROR, description);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public enum Status { SUCCESS, ERROR }
}
