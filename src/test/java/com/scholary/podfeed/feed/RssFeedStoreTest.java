package com.scholary.podfeed.feed;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.podfeed.feed.FeedStore.AddResult;
import com.scholary.podfeed.media.MediaStorage;
import com.scholary.podfeed.media.MediaStorageException;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RssFeedStoreTest {

  private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

  @TempDir Path tempDir;

  @Mock private MediaStorage mediaStorage;

  private Path feedFile;
  private FeedDocumentCodec codec;
  private Clock clock;

  @BeforeEach
  void setUp() {
    feedFile = tempDir.resolve("podcast/rss.xml");
    codec = spy(new FeedDocumentCodec(FeedDocumentCodecTest.PROPERTIES));
    clock = Clock.fixed(Instant.parse("2024-06-01T00:00:00Z"), ZoneOffset.UTC);
  }

  @Test
  void load_shouldStartEmptyWhenDocumentIsAbsent() {
    RssFeedStore store = newStore(50);

    store.load();

    assertThat(store.listEntries()).isEmpty();
    assertThat(store.snapshot().revision()).isZero();
    assertThat(feedFile).doesNotExist();
  }

  @Test
  void addEntry_shouldPersistAndSurviveReload() {
    RssFeedStore store = loadedStore(50);

    AddResult result = store.addEntry(entry("aaaaaaaaaaaaaaaa", T0));

    assertThat(result).isEqualTo(AddResult.inserted());
    assertThat(store.snapshot().revision()).isEqualTo(1L);
    assertThat(feedFile).exists();

    RssFeedStore reloaded = loadedStore(50);
    assertThat(reloaded.listEntries()).containsExactly(entry("aaaaaaaaaaaaaaaa", T0));
  }

  @Test
  void addEntry_shouldBeNoOpForDuplicateId() throws Exception {
    RssFeedStore store = loadedStore(50);
    store.addEntry(entry("aaaaaaaaaaaaaaaa", T0));
    byte[] before = Files.readAllBytes(feedFile);

    AddResult result = store.addEntry(entry("aaaaaaaaaaaaaaaa", T0.plusSeconds(60)));

    assertThat(result).isEqualTo(AddResult.alreadyPresent());
    assertThat(store.snapshot().size()).isEqualTo(1);
    assertThat(store.snapshot().revision()).isEqualTo(1L);
    assertThat(Files.readAllBytes(feedFile)).isEqualTo(before);
  }

  @Test
  void addEntry_shouldKeepPreviousDocumentWhenPersistCrashesMidWrite() throws Exception {
    RssFeedStore store = loadedStore(50);
    store.addEntry(entry("aaaaaaaaaaaaaaaa", T0));
    byte[] before = Files.readAllBytes(feedFile);

    doAnswer(
            invocation -> {
              OutputStream out = invocation.getArgument(2);
              out.write("<?xml version=\"1.0\"?><rss><channel><item><title>half"
                  .getBytes(StandardCharsets.UTF_8));
              throw new IOException("simulated crash");
            })
        .when(codec)
        .write(anyList(), any(), any());

    assertThatThrownBy(() -> store.addEntry(entry("bbbbbbbbbbbbbbbb", T0.plusSeconds(60))))
        .isInstanceOf(FeedPersistException.class)
        .hasRootCauseMessage("simulated crash");

    assertThat(Files.readAllBytes(feedFile)).isEqualTo(before);
    assertThat(store.contains("bbbbbbbbbbbbbbbb")).isFalse();
    assertThat(store.snapshot().revision()).isEqualTo(1L);
    assertThat(tempFiles()).isEmpty();

    RssFeedStore recovered = loadedStore(50);
    assertThat(recovered.listEntries()).containsExactly(entry("aaaaaaaaaaaaaaaa", T0));
  }

  @Test
  void addEntry_shouldWrapCodecRuntimeFailureAsPersistError() throws Exception {
    RssFeedStore store = loadedStore(50);
    doThrow(new IllegalStateException("boom")).when(codec).write(anyList(), any(), any());

    assertThatThrownBy(() -> store.addEntry(entry("aaaaaaaaaaaaaaaa", T0)))
        .isInstanceOf(FeedPersistException.class);
    assertThat(store.listEntries()).isEmpty();
    assertThat(feedFile).doesNotExist();
  }

  @Test
  void load_shouldIgnoreAndRemoveStaleTempFile() throws Exception {
    RssFeedStore store = loadedStore(50);
    store.addEntry(entry("aaaaaaaaaaaaaaaa", T0));
    Files.writeString(feedFile.resolveSibling(".rss.xml.999.tmp"), "<rss><channel><item>");

    RssFeedStore reloaded = loadedStore(50);

    assertThat(reloaded.listEntries()).hasSize(1);
    assertThat(tempFiles()).isEmpty();
  }

  @Test
  void load_shouldFailFastOnCorruptDocument() throws Exception {
    Files.createDirectories(feedFile.getParent());
    Files.writeString(feedFile, "<rss version=\"2.0\"><channel><item><title>trunc");
    RssFeedStore store = newStore(50);

    assertThatThrownBy(store::load).isInstanceOf(FeedPersistException.class);
    assertThat(feedFile).hasContent("<rss version=\"2.0\"><channel><item><title>trunc");
  }

  @Test
  void listEntries_shouldReturnNewestFirstCappedToMaxItems() {
    RssFeedStore store = loadedStore(3);
    for (int i = 0; i < 4; i++) {
      store.addEntry(entry("entry000000000" + i + "0", T0.plusSeconds(i * 60L)));
    }

    assertThat(store.listEntries())
        .extracting(FeedEntry::id)
        .containsExactly("entry00000000030", "entry00000000020", "entry00000000010");
    assertThat(store.snapshot().size()).isEqualTo(4);
    assertThat(loadedStore(10).snapshot().size()).isEqualTo(4);
  }

  @Test
  void deleteEntry_shouldRemoveEntryAndArtifact() {
    RssFeedStore store = loadedStore(50);
    store.addEntry(entry("aaaaaaaaaaaaaaaa", T0));
    when(mediaStorage.delete("aaaaaaaaaaaaaaaa.mp3")).thenReturn(true);

    assertThat(store.deleteEntry("aaaaaaaaaaaaaaaa").found()).isTrue();
    assertThat(store.listEntries()).isEmpty();
    verify(mediaStorage).delete("aaaaaaaaaaaaaaaa.mp3");
    assertThat(loadedStore(50).listEntries()).isEmpty();

    assertThat(store.deleteEntry("aaaaaaaaaaaaaaaa").found()).isFalse();
  }

  @Test
  void deleteEntry_shouldReportNotFoundWithoutTouchingStorage() {
    RssFeedStore store = loadedStore(50);

    assertThat(store.deleteEntry("missing").found()).isFalse();
    verify(mediaStorage, never()).delete(any());
  }

  @Test
  void deleteEntry_shouldSucceedWhenArtifactCannotBeRemoved() {
    RssFeedStore store = loadedStore(50);
    store.addEntry(entry("aaaaaaaaaaaaaaaa", T0));
    when(mediaStorage.delete("aaaaaaaaaaaaaaaa.mp3"))
        .thenThrow(new MediaStorageException("read-only", new IOException("EROFS")));

    assertThat(store.deleteEntry("aaaaaaaaaaaaaaaa").found()).isTrue();
    assertThat(store.contains("aaaaaaaaaaaaaaaa")).isFalse();
  }

  @Test
  void deleteEntry_shouldKeepEntryWhenPersistFails() throws Exception {
    RssFeedStore store = loadedStore(50);
    store.addEntry(entry("aaaaaaaaaaaaaaaa", T0));
    doThrow(new IOException("disk full")).when(codec).write(anyList(), any(), any());

    assertThatThrownBy(() -> store.deleteEntry("aaaaaaaaaaaaaaaa"))
        .isInstanceOf(FeedPersistException.class);
    assertThat(store.contains("aaaaaaaaaaaaaaaa")).isTrue();
    verify(mediaStorage, never()).delete(any());
  }

  @Test
  void concurrentAdds_shouldAllBePersistedWhileReadersSeeCompleteSnapshots() throws Exception {
    RssFeedStore store = loadedStore(1000);
    int writers = 8;
    int perWriter = 10;
    ExecutorService pool = Executors.newFixedThreadPool(writers + 2);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<?>> futures = new ArrayList<>();

    for (int w = 0; w < writers; w++) {
      int writer = w;
      futures.add(
          pool.submit(
              () -> {
                start.await();
                for (int i = 0; i < perWriter; i++) {
                  String id = String.format("w%02di%02d0000000000", writer, i);
                  store.addEntry(entry(id, T0.plusSeconds(writer * 100L + i)));
                }
                return null;
              }));
    }
    for (int r = 0; r < 2; r++) {
      futures.add(
          pool.submit(
              () -> {
                start.await();
                long lastRevision = -1;
                for (int i = 0; i < 200; i++) {
                  FeedSnapshot snapshot = store.snapshot();
                  assertThat(snapshot.size()).isEqualTo((int) snapshot.revision());
                  assertThat(snapshot.revision()).isGreaterThanOrEqualTo(lastRevision);
                  lastRevision = snapshot.revision();
                }
                return null;
              }));
    }
    start.countDown();
    for (Future<?> future : futures) {
      future.get(30, TimeUnit.SECONDS);
    }
    pool.shutdown();

    assertThat(store.snapshot().size()).isEqualTo(writers * perWriter);
    assertThat(loadedStore(1000).snapshot().size()).isEqualTo(writers * perWriter);
  }

  @Test
  void rebaseMediaUrls_shouldPointEnclosuresAtCurrentBaseUrl() {
    RssFeedStore store = loadedStore(50);
    store.addEntry(entry("aaaaaaaaaaaaaaaa", T0));
    store.addEntry(entry("bbbbbbbbbbbbbbbb", T0.plusSeconds(60)));
    when(mediaStorage.exists(anyString())).thenReturn(true);
    when(mediaStorage.urlFor(anyString()))
        .thenAnswer(invocation -> "https://cdn.example.org/audio/" + invocation.getArgument(0));

    int changed = store.rebaseMediaUrls();

    assertThat(changed).isEqualTo(2);
    assertThat(store.snapshot().revision()).isEqualTo(3L);
    assertThat(store.find("aaaaaaaaaaaaaaaa").orElseThrow().mediaUrl())
        .isEqualTo("https://cdn.example.org/audio/aaaaaaaaaaaaaaaa.mp3");
    RssFeedStore reloaded = loadedStore(50);
    assertThat(reloaded.listEntries())
        .extracting(FeedEntry::mediaUrl)
        .containsExactly(
            "https://cdn.example.org/audio/bbbbbbbbbbbbbbbb.mp3",
            "https://cdn.example.org/audio/aaaaaaaaaaaaaaaa.mp3");
    assertThat(reloaded.listEntries().get(0).title()).isEqualTo("Title bbbbbbbbbbbbbbbb");
  }

  @Test
  void rebaseMediaUrls_shouldLeaveCurrentUrlsUntouched() throws Exception {
    RssFeedStore store = loadedStore(50);
    store.addEntry(entry("aaaaaaaaaaaaaaaa", T0));
    byte[] before = Files.readAllBytes(feedFile);
    when(mediaStorage.exists(anyString())).thenReturn(false);
    when(mediaStorage.urlFor(anyString()))
        .thenAnswer(invocation -> "https://pods.example.com/media/" + invocation.getArgument(0));

    assertThat(store.rebaseMediaUrls()).isZero();

    assertThat(store.snapshot().revision()).isEqualTo(1L);
    assertThat(Files.readAllBytes(feedFile)).isEqualTo(before);
  }

  @Test
  void rebaseMediaUrls_failedPersistShouldKeepPreviousUrls() throws Exception {
    RssFeedStore store = loadedStore(50);
    store.addEntry(entry("aaaaaaaaaaaaaaaa", T0));
    byte[] before = Files.readAllBytes(feedFile);
    when(mediaStorage.exists(anyString())).thenReturn(true);
    when(mediaStorage.urlFor(anyString()))
        .thenAnswer(invocation -> "https://cdn.example.org/audio/" + invocation.getArgument(0));
    doThrow(new IllegalStateException("boom")).when(codec).write(anyList(), any(), any());

    assertThatThrownBy(store::rebaseMediaUrls).isInstanceOf(FeedPersistException.class);

    assertThat(store.find("aaaaaaaaaaaaaaaa").orElseThrow().mediaUrl())
        .isEqualTo("https://pods.example.com/media/aaaaaaaaaaaaaaaa.mp3");
    assertThat(store.snapshot().revision()).isEqualTo(1L);
    assertThat(Files.readAllBytes(feedFile)).isEqualTo(before);
  }

  private RssFeedStore newStore(int maxItems) {
    FeedProperties properties =
        new FeedProperties(
            feedFile.toString(), maxItems, "Test Feed", "desc", "https://pods.example.com", "en",
            "Tester", null, null);
    return new RssFeedStore(properties, codec, mediaStorage, clock);
  }

  private RssFeedStore loadedStore(int maxItems) {
    RssFeedStore store = newStore(maxItems);
    store.load();
    return store;
  }

  private List<Path> tempFiles() throws IOException {
    try (Stream<Path> files = Files.list(feedFile.getParent())) {
      return files.filter(p -> p.getFileName().toString().endsWith(".tmp")).toList();
    }
  }

  static FeedEntry entry(String id, Instant publishedAt) {
    return new FeedEntry(
        id,
        "Title " + id,
        "Description " + id,
        120L,
        "https://pods.example.com/media/" + id + ".mp3",
        "audio/mpeg",
        1024L,
        publishedAt,
        null,
        null);
  }
}
