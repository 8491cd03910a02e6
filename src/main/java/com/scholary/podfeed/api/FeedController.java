package com.scholary.podfeed.api;

import com.scholary.podfeed.service.IngestOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

/** REST API for the published feed entries. */
@RestController
@Tag(name = "Feed", description = "List and delete feed entries")
public class FeedController {

  private final IngestOrchestrator orchestrator;

  public FeedController(IngestOrchestrator orchestrator) {
    this.orchestrator = orchestrator;
  }

  @GetMapping("/api/entries")
  @Operation(summary = "List entries", description = "Newest entries first, capped to max-items")
  public List<EntryResponse> listEntries() {
    return orchestrator.listEntries().stream().map(EntryResponse::from).toList();
  }

  @DeleteMapping("/api/entries/{id}")
  @Operation(
      summary = "Delete entry",
      description = "Remove an entry and its audio file; found=false if it did not exist")
  public ResponseEntity<DeleteEntryResponse> deleteEntry(@PathVariable String id) {
    return ResponseEntity.ok(new DeleteEntryResponse(id, orchestrator.deleteEntry(id)));
  }
}
