package com.scholary.podfeed.transcode;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.podfeed.support.FakeCommandRunner;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DurationReaderTest {

  private FakeCommandRunner runner;
  private DurationReader durationReader;

  @BeforeEach
  void setUp() {
    runner = new FakeCommandRunner();
    durationReader =
        new DurationReader(
            runner, new DurationReaderProperties("ffprobe", Duration.ofSeconds(30)), new ObjectMapper());
  }

  @Test
  void durationSeconds_shouldRoundFormatDuration() throws Exception {
    runner.on("ffprobe", FakeCommandRunner.ffprobe("215.62"));

    assertThat(durationReader.durationSeconds(Path.of("a.mp3"))).contains(216L);
    assertThat(runner.invocationsOf("ffprobe").get(0)).contains("-show_format", "a.mp3");
  }

  @Test
  void durationSeconds_shouldBeEmptyWhenToolFails() throws Exception {
    runner.on("ffprobe", (command, output) -> FakeCommandRunner.exit(1));

    assertThat(durationReader.durationSeconds(Path.of("a.mp3"))).isEmpty();
  }

  @Test
  void durationSeconds_shouldBeEmptyWhenDurationMissingOrGarbled() throws Exception {
    runner.on("ffprobe", (command, output) -> FakeCommandRunner.ok("{\"format\":{}}"));
    assertThat(durationReader.durationSeconds(Path.of("a.mp3"))).isEmpty();

    runner.on("ffprobe", FakeCommandRunner.ffprobe("N/A"));
    assertThat(durationReader.durationSeconds(Path.of("a.mp3"))).isEmpty();

    runner.on("ffprobe", (command, output) -> FakeCommandRunner.ok("not json"));
    assertThat(durationReader.durationSeconds(Path.of("a.mp3"))).isEmpty();
  }

  @Test
  void durationSeconds_shouldBeEmptyWhenToolIsMissing() throws Exception {
    assertThat(durationReader.durationSeconds(Path.of("a.mp3"))).isEmpty();
  }
}
