package com.consullo.frames.remote;

/**
 * The target could not be reached at all (device offline, not attached, transport gone).
 *
 * @since 1.0
 */
public class TargetNotRespondingException extends RemoteExecutionException {

  private static final long serialVersionUID = 1L;

  public TargetNotRespondingException(String message) {
    super(message);
  }

  public TargetNotRespondingException(String message, Throwable cause) {
    super(message, cause);
  }
}
