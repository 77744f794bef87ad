package com.consullo.frames.remote;

import com.pty4j.PtyProcess;
import com.pty4j.PtyProcessBuilder;
import java.io.InputStream;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * PTY controller implemented with pty4j.
 *
 * <p>Running shell commands under a PTY keeps tools such as {@code adb} in line-buffered mode. The PTY
 * translates {@code \n} into {@code \r\n}, which is why every consumer of the output normalizes line
 * endings.
 *
 * @since 1.0
 */
public final class PtyProcessControllerPty4j implements PtyProcessController {

  private static final Logger LOGGER = LoggerFactory.getLogger(PtyProcessControllerPty4j.class);

  private final PtyProcess process;
  private final CompletableFuture<Integer> exitFuture;

  /**
   * Spawns a PTY-attached process.
   *
   * @param config process configuration (command, working directory, environment, initial size)
   * @throws Exception if process cannot be started
   */
  public PtyProcessControllerPty4j(final PtyProcessConfig config) throws Exception {
    Validate.notNull(config, "config must not be null");
    Validate.notNull(config.command(), "command must not be null");
    Validate.isTrue(!config.command().isEmpty(), "command must not be empty");
    Validate.notNull(config.workingDirectory(), "workingDirectory must not be null");
    Validate.isTrue(config.initialColumns() > 0, "initialColumns must be positive");
    Validate.isTrue(config.initialRows() > 0, "initialRows must be positive");

    final String[] cmd = config.command().toArray(new String[0]);

    final Map<String, String> env = new HashMap<>(System.getenv());
    if (config.environment() != null) {
      env.putAll(config.environment());
    }

    final PtyProcessBuilder builder = new PtyProcessBuilder(cmd);
    builder.setDirectory(config.workingDirectory().toString());
    builder.setEnvironment(env);
    builder.setInitialColumns(config.initialColumns());
    builder.setInitialRows(config.initialRows());
    builder.setRedirectErrorStream(true);

    LOGGER.debug("Spawning {}", config.command());
    this.process = builder.start();

    this.exitFuture = new CompletableFuture<>();
    startExitMonitorThread();
  }

  @Override
  public InputStream getPtyOutput() throws Exception {
    return this.process.getInputStream();
  }

  @Override
  public CompletableFuture<Integer> onExit() throws Exception {
    return this.exitFuture;
  }

  @Override
  public boolean isAlive() throws Exception {
    return this.process.isAlive();
  }

  @Override
  public void close() throws Exception {
    if (this.process.isAlive()) {
      this.process.destroy();
    }
  }

  /**
   * Starts a monitor thread that completes the exit future when the subprocess terminates.
   */
  private void startExitMonitorThread() {
    final Thread monitor = new Thread(() -> {
      try {
        final int code = this.process.waitFor();
        this.exitFuture.complete(code);
      } catch (final Exception e) {
        this.exitFuture.completeExceptionally(e);
      }
    }, "PtyProcessExitMonitor");
    monitor.setDaemon(true);
    monitor.start();
  }
}
