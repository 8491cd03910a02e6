package com.scholary.podfeed.media;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.podfeed.media.MediaStorage.StoredMedia;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LocalMediaStorageTest {

  @TempDir Path tempDir;

  private Path mediaDir;
  private LocalMediaStorage storage;

  @BeforeEach
  void setUp() {
    mediaDir = tempDir.resolve("media");
    storage =
        new LocalMediaStorage(
            new MediaProperties(mediaDir.toString(), "https://pods.example.com/media/"));
  }

  @Test
  void store_shouldMoveFileAndReportUrlAndSize() throws Exception {
    Path source = Files.write(tempDir.resolve("scratch.mp3"), new byte[] {1, 2, 3, 4, 5});

    StoredMedia stored = storage.store(source, "0123456789abcdef.mp3");

    assertThat(stored.url()).isEqualTo("https://pods.example.com/media/0123456789abcdef.mp3");
    assertThat(stored.sizeBytes()).isEqualTo(5L);
    assertThat(source).doesNotExist();
    assertThat(mediaDir.resolve("0123456789abcdef.mp3")).hasBinaryContent(new byte[] {1, 2, 3, 4, 5});
    assertThat(storage.exists("0123456789abcdef.mp3")).isTrue();
  }

  @Test
  void delete_shouldReportWhetherFileExisted() throws Exception {
    storage.store(Files.write(tempDir.resolve("a.mp3"), new byte[] {1}), "a.mp3");

    assertThat(storage.delete("a.mp3")).isTrue();
    assertThat(storage.exists("a.mp3")).isFalse();
    assertThat(storage.delete("a.mp3")).isFalse();
  }

  @Test
  void urlFor_shouldEncodeFileName() {
    assertThat(storage.urlFor("my file.mp3"))
        .isEqualTo("https://pods.example.com/media/my%20file.mp3");
  }

  @Test
  void store_shouldRejectNamesOutsideMediaDirectory() throws Exception {
    Path source = Files.write(tempDir.resolve("x.mp3"), new byte[] {1});

    assertThatThrownBy(() -> storage.store(source, "../escape.mp3"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> storage.delete(".hidden"))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
