package com.consullo.frames.remote;

import java.time.Duration;

/**
 * A command did not finish within the executor's timeout.
 *
 * @since 1.0
 */
public class TargetTimeoutException extends RemoteExecutionException {

  private static final long serialVersionUID = 1L;

  private final String command;
  private final Duration timeout;

  public TargetTimeoutException(String command, Duration timeout) {
    super("Timed out after " + timeout.toMillis() + " ms running: " + command);
    this.command = command;
    this.timeout = timeout;
  }

  public String command() {
    return command;
  }

  public Duration timeout() {
    return timeout;
  }
}
