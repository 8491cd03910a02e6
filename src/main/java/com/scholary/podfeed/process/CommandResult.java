package com.scholary.podfeed.process;

import java.util.List;

/**
 * Outcome of a finished subprocess.
 *
 * @param exitCode the process exit status
 * @param output captured output lines, oldest first (bounded, see {@link ProcessCommandRunner})
 */
public record CommandResult(int exitCode, List<String> output) {

  public CommandResult {
    output = List.copyOf(output);
  }

  public boolean succeeded() {
    return exitCode == 0;
  }

  public String stdout() {
    return String.join("\n", output);
  }

  /** The last few lines, for error messages. */
  public String tail(int lines) {
    int from = Math.max(0, output.size() - lines);
    return String.join("\n", output.subList(from, output.size()));
  }
}
