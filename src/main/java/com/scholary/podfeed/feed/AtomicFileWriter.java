package com.scholary.podfeed.feed;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.stream.Stream;

/**
 * Replaces a file so readers only ever see the old or the new content in full.
 *
 * <p>The new content goes to a hidden sibling temp file, is forced to disk, and is then renamed
 * over the target with {@link StandardCopyOption#ATOMIC_MOVE}. If anything fails before the
 * rename the temp file is removed and the target is untouched. A temp file left behind by a crash
 * is never read; {@link #removeStaleTempFiles} clears it on the next start.
 */
final class AtomicFileWriter {

  static final String TEMP_SUFFIX = ".tmp";

  /** Streams content into the temp file. */
  @FunctionalInterface
  interface ContentWriter {
    void writeTo(OutputStream out) throws IOException;
  }

  private AtomicFileWriter() {}

  static void write(Path target, ContentWriter content) throws IOException {
    Path dir = target.toAbsolutePath().getParent();
    Files.createDirectories(dir);
    Path temp = Files.createTempFile(dir, tempPrefix(target), TEMP_SUFFIX);

    boolean moved = false;
    try {
      try (FileChannel channel =
              FileChannel.open(
                  temp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING);
          OutputStream out = Channels.newOutputStream(channel)) {
        content.writeTo(out);
        out.flush();
        channel.force(true);
      }
      Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
      moved = true;
    } finally {
      if (!moved) {
        Files.deleteIfExists(temp);
      }
    }
  }

  /** @return number of stale temp files removed */
  static int removeStaleTempFiles(Path target) throws IOException {
    Path dir = target.toAbsolutePath().getParent();
    if (!Files.isDirectory(dir)) {
      return 0;
    }
    String prefix = tempPrefix(target);
    int removed = 0;
    try (Stream<Path> files = Files.list(dir)) {
      for (Path file : (Iterable<Path>) files::iterator) {
        String name = file.getFileName().toString();
        if (name.startsWith(prefix) && name.endsWith(TEMP_SUFFIX) && Files.deleteIfExists(file)) {
          removed++;
        }
      }
    }
    return removed;
  }

  static String tempPrefix(Path target) {
    return "." + target.getFileName() + ".";
  }
}
