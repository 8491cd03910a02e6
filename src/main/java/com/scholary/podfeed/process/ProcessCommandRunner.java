package com.scholary.podfeed.process;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}.
 *
 * <p>stderr is merged into stdout (ffmpeg and yt-dlp both report on stderr). Output is pumped
 * line-by-line on a helper thread so the calling thread can enforce the timeout while the tool is
 * still writing. At most {@value #MAX_CAPTURED_LINES} lines are retained.
 *
 * <p>On timeout or interruption the whole process tree is killed, since yt-dlp runs ffmpeg as a
 * child. Draining the remaining output is bounded by {@link #OUTPUT_DRAIN_TIMEOUT}: a stray
 * grandchild still holding the pipe must not keep the caller waiting.
 */
@Component
public class ProcessCommandRunner implements CommandRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProcessCommandRunner.class);

  static final int MAX_CAPTURED_LINES = 2000;
  static final Duration OUTPUT_DRAIN_TIMEOUT = Duration.ofSeconds(5);

  @Override
  public CommandResult run(List<String> command, Duration timeout, Consumer<String> outputListener)
      throws IOException, InterruptedException {
    String program = command.get(0);
    LOGGER.debug("Executing: {}", String.join(" ", command));

    Process process = new ProcessBuilder(command).redirectErrorStream(true).start();
    Deque<String> captured = new ArrayDeque<>();
    Thread pump = startOutputPump(process, program, captured, outputListener);

    try {
      if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        LOGGER.warn("{} exceeded timeout of {}s, killing process", program, timeout.toSeconds());
        destroyTree(process);
        pump.join(OUTPUT_DRAIN_TIMEOUT.toMillis());
        throw new CommandTimeoutException(program, timeout);
      }
      pump.join(OUTPUT_DRAIN_TIMEOUT.toMillis());
      if (pump.isAlive()) {
        LOGGER.warn("{} exited but its output is still open, not waiting for it", program);
      }
    } catch (InterruptedException e) {
      LOGGER.warn("Interrupted while waiting for {}, killing process", program);
      destroyTree(process);
      throw e;
    }

    int exitCode = process.exitValue();
    if (exitCode != 0) {
      LOGGER.warn("{} exited with code {}", program, exitCode);
    }
    synchronized (captured) {
      return new CommandResult(exitCode, new ArrayList<>(captured));
    }
  }

  private static void destroyTree(Process process) {
    process.descendants().forEach(ProcessHandle::destroyForcibly);
    process.destroyForcibly();
  }

  private Thread startOutputPump(
      Process process, String program, Deque<String> captured, Consumer<String> outputListener) {
    var mdc = MDC.getCopyOfContextMap();
    Thread pump =
        new Thread(
            () -> {
              if (mdc != null) {
                MDC.setContextMap(mdc);
              }
              try (BufferedReader reader =
                  new BufferedReader(
                      new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8),
                      8192)) {
                String line;
                while ((line = reader.readLine()) != null) {
                  synchronized (captured) {
                    captured.addLast(line);
                    if (captured.size() > MAX_CAPTURED_LINES) {
                      captured.removeFirst();
                    }
                  }
                  outputListener.accept(line);
                }
              } catch (IOException e) {
                // Stream closes when the process is killed.
                LOGGER.debug("Output stream of {} closed: {}", program, e.getMessage());
              } finally {
                MDC.clear();
              }
            },
            "cmd-output-" + program);
    pump.setDaemon(true);
    pump.start();
    return pump;
  }
}
