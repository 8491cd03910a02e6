package com.scholary.podfeed.acquire;

import java.nio.file.Path;

/**
 * Raw media written to the job's scratch directory, plus whatever metadata came with it.
 *
 * <p>The caller owns {@code rawFile} and must clean it up.
 */
public record AcquiredMedia(Path rawFile, MediaMetadata metadata) {}
