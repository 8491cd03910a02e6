package com.scholary.podfeed.process;

import java.io.IOException;
import java.time.Duration;

/** Thrown when a subprocess outlives its timeout. The process has already been killed. */
public class CommandTimeoutException extends IOException {

  private final Duration timeout;

  public CommandTimeoutException(String program, Duration timeout) {
    super(String.format("%s timed out after %ds", program, timeout.toSeconds()));
    this.timeout = timeout;
  }

  public Duration getTimeout() {
    return timeout;
  }
}
