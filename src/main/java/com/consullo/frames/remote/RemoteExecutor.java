package com.consullo.frames.remote;

/**
 * Synchronous command channel to the device that frames are collected from.
 *
 * <p>Implementations block for the whole round trip and return the command's textual output. A hung
 * channel is only detected when the implementation itself raises {@link TargetTimeoutException}.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface RemoteExecutor {

  /**
   * Runs a shell command on the target.
   *
   * @param command command line to run on the target
   * @return combined output of the command
   * @throws TargetNotRespondingException if the target is unreachable
   * @throws TargetTimeoutException if the command did not complete in time
   * @throws RemoteExecutionException for any other failure of the channel or the command
   */
  String execute(final String command) throws RemoteExecutionException;
}
