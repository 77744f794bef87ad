package com.consullo.frames.remote;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link RemoteExecutor} that runs every command in its own PTY-attached process.
 *
 * <p>
 * Each call spawns {@code commandPrefix + command}, drains the PTY output on a
 * reader thread and waits at most {@code commandTimeout} for it to finish.
 * Output that shows the device is gone is reported as
 * {@link TargetNotRespondingException}; a non-zero exit status is reported as a
 * plain {@link RemoteExecutionException}.
 * </p>
 */
public final class PtyShellExecutor implements RemoteExecutor {

  private static final Logger LOGGER = LoggerFactory.getLogger(PtyShellExecutor.class);

  static final int PTY_COLUMNS = 4096;
  static final int PTY_ROWS = 64;

  private static final String[] UNREACHABLE_MARKERS = {
    "error: device offline",
    "error: no devices/emulators found",
    "error: closed",
  };

  private final ShellExecutorConfig config;
  private final PtyProcessLauncher launcher;

  public PtyShellExecutor(final ShellExecutorConfig config) {
    this(config, PtyProcessControllerPty4j::new);
  }

  public PtyShellExecutor(final ShellExecutorConfig config, final PtyProcessLauncher launcher) {
    Validate.notNull(config, "config must not be null");
    Validate.notNull(config.commandPrefix(), "commandPrefix must not be null");
    Validate.notNull(config.workingDirectory(), "workingDirectory must not be null");
    Validate.notNull(config.commandTimeout(), "commandTimeout must not be null");
    Validate.isTrue(!config.commandTimeout().isNegative() && !config.commandTimeout().isZero(),
        "commandTimeout must be positive");
    Validate.notNull(launcher, "launcher must not be null");
    this.config = config;
    this.launcher = launcher;
  }

  @Override
  public String execute(final String command) throws RemoteExecutionException {
    Validate.notBlank(command, "command must not be blank");

    final List<String> argv = new ArrayList<>(config.commandPrefix());
    argv.add(command);
    final PtyProcessConfig processConfig = new PtyProcessConfig(
        argv, config.workingDirectory(), config.environment(), PTY_COLUMNS, PTY_ROWS);

    final PtyProcessController process;
    try {
      process = launcher.launch(processConfig);
    } catch (final Exception e) {
      throw new TargetNotRespondingException("Could not spawn " + argv, e);
    }

    try {
      final long deadline = System.nanoTime() + config.commandTimeout().toNanos();
      final String output = readOutput(process, command, deadline);
      checkReachable(command, output);

      final int exitCode = awaitExit(process, command, deadline);
      if (exitCode != 0) {
        throw new RemoteExecutionException(
            "Command exited with status " + exitCode + ": " + command + "\n" + output);
      }
      LOGGER.trace("execute: {} returned {} chars", command, output.length());
      return output;
    } finally {
      try {
        process.close();
      } catch (final Exception e) {
        LOGGER.debug("Failed closing process for {}: {}", command, e.getMessage());
      }
    }
  }

  private String readOutput(final PtyProcessController process, final String command, final long deadline)
      throws RemoteExecutionException {
    final CompletableFuture<String> output = new CompletableFuture<>();
    final Thread reader = new Thread(() -> {
      try {
        output.complete(drain(process.getPtyOutput()));
      } catch (final Exception e) {
        output.completeExceptionally(e);
      }
    }, "PtyShellReader");
    reader.setDaemon(true);
    reader.start();

    try {
      return output.get(remainingNanos(deadline), TimeUnit.NANOSECONDS);
    } catch (final TimeoutException e) {
      throw new TargetTimeoutException(command, config.commandTimeout());
    } catch (final ExecutionException e) {
      throw new RemoteExecutionException("Failed reading output of: " + command, e.getCause());
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RemoteExecutionException("Interrupted while running: " + command, e);
    }
  }

  private int awaitExit(final PtyProcessController process, final String command, final long deadline)
      throws RemoteExecutionException {
    try {
      return process.onExit().get(remainingNanos(deadline), TimeUnit.NANOSECONDS);
    } catch (final TimeoutException e) {
      throw new TargetTimeoutException(command, config.commandTimeout());
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RemoteExecutionException("Interrupted while running: " + command, e);
    } catch (final Exception e) {
      throw new RemoteExecutionException("Failed waiting for exit of: " + command, e);
    }
  }

  private static void checkReachable(final String command, final String output) throws TargetNotRespondingException {
    for (String marker : UNREACHABLE_MARKERS) {
      if (output.contains(marker)) {
        throw new TargetNotRespondingException("Target not responding (" + marker + ") running: " + command);
      }
    }
    if (output.contains("error: device '") && output.contains("' not found")) {
      throw new TargetNotRespondingException("Target not found running: " + command);
    }
  }

  private static long remainingNanos(final long deadline) {
    return Math.max(0L, deadline - System.nanoTime());
  }

  private static String drain(final InputStream in) throws Exception {
    final ByteArrayOutputStream out = new ByteArrayOutputStream();
    final byte[] buffer = new byte[8192];
    while (true) {
      final int n;
      try {
        n = in.read(buffer);
      } catch (final IOException e) {
        // Linux PTYs report EIO once the child side has closed.
        break;
      }
      if (n < 0) {
        break;
      }
      out.write(buffer, 0, n);
    }
    return out.toString(Charset.defaultCharset());
  }
}
