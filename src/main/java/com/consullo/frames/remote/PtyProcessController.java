package com.consullo.frames.remote;

import java.io.InputStream;
import java.util.concurrent.CompletableFuture;

/**
 * Minimal controller for a PTY-attached subprocess that runs one shell command to completion.
 *
 * <p>Implementations must provide:
 * - access to the PTY output stream
 * - exit monitoring
 *
 * @since 1.0
 */
public interface PtyProcessController extends AutoCloseable {

  InputStream getPtyOutput() throws Exception;

  CompletableFuture<Integer> onExit() throws Exception;

  boolean isAlive() throws Exception;

  @Override
  void close() throws Exception;
}
