package com.consullo.frames.remote;

/**
 * Spawns PTY-attached processes. {@link PtyShellExecutor} goes through this seam so the process layer
 * can be replaced in tests.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface PtyProcessLauncher {

  PtyProcessController launch(final PtyProcessConfig config) throws Exception;
}
