package com.scholary.podfeed.api;

/** Result of a cancel request; {@code cancelled=false} once the job is publishing or finished. */
public record CancelResponse(String jobId, boolean cancelled) {}
