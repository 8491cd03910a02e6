package com.scholary.podfeed.acquire;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses yt-dlp progress lines.
 *
 * <p>With {@code --newline} every update is its own line, e.g.:
 *
 * <pre>
 * [download]  42.0% of ~  3.20MiB at    1.10MiB/s ETA 00:02 (frag 1/3)
 * [download] 100% of    3.20MiB in 00:00:02 at 1.52MiB/s
 * </pre>
 */
final class DownloadProgressParser {

  private static final Pattern PERCENT_PATTERN =
      Pattern.compile("^\\[download\\]\\s+([0-9]+(?:\\.[0-9]+)?)%");
  private static final Pattern RATE_PATTERN =
      Pattern.compile("\\bat\\s+(.+?)(?=\\s+ETA\\b|\\s+\\(|\\s*$)");
  private static final Pattern ETA_PATTERN = Pattern.compile("\\bETA\\s+(\\S+)");

  private static final String UNKNOWN = "N/A";

  private DownloadProgressParser() {}

  static Optional<AcquisitionProgress> parse(String line) {
    if (line == null) {
      return Optional.empty();
    }
    String trimmed = line.trim();
    Matcher percent = PERCENT_PATTERN.matcher(trimmed);
    if (!percent.find()) {
      return Optional.empty();
    }
    double value = Math.min(100.0, Double.parseDouble(percent.group(1)));

    Matcher rate = RATE_PATTERN.matcher(trimmed);
    String transferRate = rate.find() ? rate.group(1).trim() : UNKNOWN;

    Matcher eta = ETA_PATTERN.matcher(trimmed);
    String remaining = eta.find() ? eta.group(1) : value >= 100.0 ? "0s" : UNKNOWN;

    return Optional.of(new AcquisitionProgress(value, transferRate, remaining));
  }
}
