package com.scholary.podfeed.feed;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AtomicFileWriterTest {

  @TempDir Path tempDir;

  @Test
  void write_shouldReplaceTargetAndLeaveNoTempFile() throws Exception {
    Path target = tempDir.resolve("rss.xml");
    Files.writeString(target, "old");

    AtomicFileWriter.write(target, out -> out.write("new".getBytes(StandardCharsets.UTF_8)));

    assertThat(target).hasContent("new");
    assertThat(listNames()).containsExactly("rss.xml");
  }

  @Test
  void write_shouldCreateMissingDirectories() throws Exception {
    Path target = tempDir.resolve("data/podcast/rss.xml");

    AtomicFileWriter.write(target, out -> out.write('x'));

    assertThat(target).hasContent("x");
  }

  @Test
  void write_shouldKeepOldContentWhenWriterFailsHalfway() throws Exception {
    Path target = tempDir.resolve("rss.xml");
    Files.writeString(target, "intact");

    assertThatThrownBy(
            () ->
                AtomicFileWriter.write(
                    target,
                    out -> {
                      out.write("partial".getBytes(StandardCharsets.UTF_8));
                      throw new IOException("disk full");
                    }))
        .isInstanceOf(IOException.class)
        .hasMessage("disk full");

    assertThat(target).hasContent("intact");
    assertThat(listNames()).containsExactly("rss.xml");
  }

  @Test
  void removeStaleTempFiles_shouldOnlyRemoveOwnTempFiles() throws Exception {
    Path target = tempDir.resolve("rss.xml");
    Files.writeString(target, "doc");
    Files.writeString(tempDir.resolve(".rss.xml.12345.tmp"), "<rss><chan");
    Files.writeString(tempDir.resolve("other.tmp"), "keep");

    int removed = AtomicFileWriter.removeStaleTempFiles(target);

    assertThat(removed).isEqualTo(1);
    assertThat(listNames()).containsExactlyInAnyOrder("rss.xml", "other.tmp");
  }

  private java.util.List<String> listNames() throws IOException {
    try (Stream<Path> files = Files.list(tempDir)) {
      return files.map(p -> p.getFileName().toString()).toList();
    }
  }
}
