package com.consullo.frames.remote;

/**
 * Failure of a command sent through a {@link RemoteExecutor}.
 *
 * @since 1.0
 */
public class RemoteExecutionException extends Exception {

  private static final long serialVersionUID = 1L;

  public RemoteExecutionException(String message) {
    super(message);
  }

  public RemoteExecutionException(String message, Throwable cause) {
    super(message, cause);
  }
}
