package com.scholary.podfeed.api;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.scholary.podfeed.feed.FeedEntry;
import com.scholary.podfeed.service.IngestOrchestrator;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = FeedController.class)
class FeedControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockBean private IngestOrchestrator orchestrator;

  @Test
  void listEntries_shouldReturnEntriesInOrder() throws Exception {
    when(orchestrator.listEntries())
        .thenReturn(
            List.of(
                entry("bbbbbbbbbbbbbbbb", "2024-05-02T10:00:00Z"),
                entry("aaaaaaaaaaaaaaaa", "2024-05-01T10:00:00Z")));

    mockMvc
        .perform(get("/api/entries"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(2))
        .andExpect(jsonPath("$[0].id").value("bbbbbbbbbbbbbbbb"))
        .andExpect(
            jsonPath("$[0].mediaUrl").value("https://pods.example.com/media/bbbbbbbbbbbbbbbb.mp3"))
        .andExpect(jsonPath("$[0].publishedAt").value("2024-05-02T10:00:00Z"))
        .andExpect(jsonPath("$[1].id").value("aaaaaaaaaaaaaaaa"));
  }

  @Test
  void deleteEntry_shouldReportFoundEvenWhenMissing() throws Exception {
    when(orchestrator.deleteEntry("aaaaaaaaaaaaaaaa")).thenReturn(true);
    when(orchestrator.deleteEntry("missing")).thenReturn(false);

    mockMvc
        .perform(delete("/api/entries/aaaaaaaaaaaaaaaa"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.found").value(true));
    mockMvc
        .perform(delete("/api/entries/missing"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.found").value(false));
  }

  private static FeedEntry entry(String id, String publishedAt) {
    return new FeedEntry(
        id,
        "Title " + id,
        null,
        60L,
        "https://pods.example.com/media/" + id + ".mp3",
        "audio/mpeg",
        100L,
        Instant.parse(publishedAt),
        null,
        null);
  }
}
