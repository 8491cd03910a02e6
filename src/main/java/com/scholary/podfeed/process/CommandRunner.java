package com.scholary.podfeed.process;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;

/**
 * Runs an external tool as a blocking subprocess.
 *
 * <p>The pipeline talks to yt-dlp, ffmpeg and ffprobe only through this interface, so tests can
 * script tool behaviour without the binaries being installed.
 */
public interface CommandRunner {

  /**
   * Run a command to completion.
   *
   * @param command the program and its arguments
   * @param timeout upper bound on the run; the process is killed when it expires
   * @param outputListener receives each line of combined stdout/stderr as it is produced
   * @return exit status and the captured output
   * @throws CommandTimeoutException if the timeout expires
   * @throws IOException if the process cannot be started
   * @throws InterruptedException if the calling thread is interrupted; the process is killed
   */
  CommandResult run(List<String> command, Duration timeout, Consumer<String> outputListener)
      throws IOException, InterruptedException;

  default CommandResult run(List<String> command, Duration timeout)
      throws IOException, InterruptedException {
    return run(command, timeout, line -> {});
  }
}
