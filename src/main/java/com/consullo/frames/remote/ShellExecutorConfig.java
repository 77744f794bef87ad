package com.consullo.frames.remote;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Settings for {@link PtyShellExecutor}.
 *
 * @param commandPrefix words placed before each command (e.g., ["adb", "-s", serial, "shell"])
 * @param workingDirectory working directory for spawned processes
 * @param environment environment variables to add/override (may be null)
 * @param commandTimeout longest time a single command may run before {@link TargetTimeoutException}
 * @since 1.0
 */
public record ShellExecutorConfig(
    List<String> commandPrefix,
    Path workingDirectory,
    Map<String, String> environment,
    Duration commandTimeout) {
}
