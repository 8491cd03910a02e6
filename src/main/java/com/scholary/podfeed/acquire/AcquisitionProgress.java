package com.scholary.podfeed.acquire;

/**
 * One download progress sample as reported by the extraction tool.
 *
 * @param percentComplete 0-100
 * @param transferRate human-readable rate, e.g. {@code 1.10MiB/s}, or {@code N/A}
 * @param estimatedTimeRemaining human-readable ETA, e.g. {@code 00:02}, or {@code N/A}
 */
public record AcquisitionProgress(
    double percentComplete, String transferRate, String estimatedTimeRemaining) {}
