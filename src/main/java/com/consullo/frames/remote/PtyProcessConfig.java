package com.consullo.frames.remote;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Configuration for spawning one PTY-attached shell command.
 *
 * @param command command and arguments (e.g., ["adb", "-s", "emulator-5554", "shell", "dumpsys SurfaceFlinger --list"])
 * @param workingDirectory working directory for the spawned process
 * @param environment environment variables to add/override (may be null)
 * @param initialColumns initial PTY columns; wide enough that dump lines are not wrapped
 * @param initialRows initial PTY rows
 * @since 1.0
 */
public record PtyProcessConfig(
    List<String> command,
    Path workingDirectory,
    Map<String, String> environment,
    int initialColumns,
    int initialRows) {
}
