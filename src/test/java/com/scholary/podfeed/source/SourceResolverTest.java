package com.scholary.podfeed.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class SourceResolverTest {

  private static final String ID = "dQw4w9WgXcQ";

  private SourceResolver resolver;

  @BeforeEach
  void setUp() {
    resolver =
        new SourceResolver(
            new SourceProperties(
                List.of("youtube.com", "www.youtube.com", "m.youtube.com"),
                List.of("youtu.be"),
                "[A-Za-z0-9_-]{11}",
                "https://www.youtube.com/watch?v=%s"));
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "https://www.youtube.com/watch?v=dQw4w9WgXcQ",
        "https://www.youtube.com/watch?v=dQw4w9WgXcQ&t=15s",
        "https://www.youtube.com/watch?feature=share&v=dQw4w9WgXcQ&list=PL123",
        "http://youtube.com/watch?v=dQw4w9WgXcQ",
        "https://m.youtube.com/watch?v=dQw4w9WgXcQ",
        "https://youtu.be/dQw4w9WgXcQ",
        "https://youtu.be/dQw4w9WgXcQ?t=42",
        "https://www.youtube.com/embed/dQw4w9WgXcQ",
        "https://www.youtube.com/v/dQw4w9WgXcQ",
        "https://www.youtube.com/live/dQw4w9WgXcQ?si=abc",
        "https://www.youtube.com/shorts/dQw4w9WgXcQ",
        "www.youtube.com/watch?v=dQw4w9WgXcQ",
        "  https://WWW.YOUTUBE.COM/watch?v=dQw4w9WgXcQ  "
      })
  void resolve_shouldReduceEquivalentLocatorsToSameId(String locator) {
    assertThat(resolver.resolve(locator)).isEqualTo(ID);
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "",
        "   ",
        "not a url at all",
        "ftp://www.youtube.com/watch?v=dQw4w9WgXcQ",
        "https://vimeo.com/123456",
        "https://www.youtube.com/watch?v=short",
        "https://www.youtube.com/watch?list=PL123",
        "https://www.youtube.com/channel/UC123",
        "https://youtu.be/",
        "https://www.youtube.com/watch?v=dQw4w9WgXc!"
      })
  void resolve_shouldRejectUnrecognisedInput(String locator) {
    assertThatThrownBy(() -> resolver.resolve(locator))
        .isInstanceOf(InvalidSourceException.class);
  }

  @Test
  void resolve_shouldRejectNull() {
    assertThatThrownBy(() -> resolver.resolve(null))
        .isInstanceOf(InvalidSourceException.class)
        .hasMessageContaining("required");
  }

  @Test
  void canonicalLocator_shouldResolveBackToSameId() {
    String canonical = resolver.canonicalLocator(ID);

    assertThat(canonical).isEqualTo("https://www.youtube.com/watch?v=" + ID);
    assertThat(resolver.resolve(canonical)).isEqualTo(ID);
  }

  @Test
  void resolve_shouldHonourConfiguredHostsAndIdPattern() {
    SourceResolver custom =
        new SourceResolver(
            new SourceProperties(
                List.of("example.com"),
                List.of(),
                "[A-Za-z0-9_-]+",
                "https://example.com/watch?v=%s"));

    assertThat(custom.resolve("https://example.com/watch?v=abc123&t=15s")).isEqualTo("abc123");
    assertThat(custom.resolve("https://example.com/watch?v=abc123")).isEqualTo("abc123");
    assertThatThrownBy(() -> custom.resolve("https://www.youtube.com/watch?v=" + ID))
        .isInstanceOf(InvalidSourceException.class);
  }
}
