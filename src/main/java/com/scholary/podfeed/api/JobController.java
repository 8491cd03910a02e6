package com.scholary.podfeed.api;

import com.scholary.podfeed.service.IngestOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.io.IOException;
import java.io.InputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * REST API for ingest jobs.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Submitting a remote locator or an uploaded file (returns job ID immediately)
 *   <li>Job status polling
 *   <li>Cancelling a job that has not started publishing
 * </ul>
 *
 * <p>Malformed locators are rejected with 400 before any job exists. Everything that goes wrong
 * later is reported through the job status.
 */
@RestController
@Tag(name = "Jobs", description = "Submit media and follow ingest jobs")
public class JobController {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobController.class);

  private final IngestOrchestrator orchestrator;

  public JobController(IngestOrchestrator orchestrator) {
    this.orchestrator = orchestrator;
  }

  @PostMapping(value = "/api/jobs", consumes = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Submit remote source",
      description = "Resolve the locator and start an ingest job; poll the returned job ID")
  public ResponseEntity<AsyncJobResponse> submit(@Valid @RequestBody SubmitRequest request) {
    LOGGER.info("Submit request: url={}", request.url());
    String jobId =
        orchestrator.submitRemote(request.url(), request.title(), request.description());
    return ResponseEntity.accepted().body(AsyncJobResponse.forJob(jobId));
  }

  @PostMapping(value = "/api/jobs/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  @Operation(
      summary = "Submit uploaded file",
      description = "Start an ingest job for an uploaded audio or video file")
  public ResponseEntity<AsyncJobResponse> upload(
      @RequestParam("file") MultipartFile file,
      @RequestParam(value = "title", required = false) String title,
      @RequestParam(value = "description", required = false) String description)
      throws IOException {
    LOGGER.info("Upload request: name={}, size={}", file.getOriginalFilename(), file.getSize());
    String jobId;
    try (InputStream content = file.getInputStream()) {
      jobId = orchestrator.submitUpload(content, file.getOriginalFilename(), title, description);
    }
    return ResponseEntity.accepted().body(AsyncJobResponse.forJob(jobId));
  }

  @GetMapping("/api/jobs/{id}")
  @Operation(summary = "Get job status", description = "Check the status of an ingest job")
  public ResponseEntity<JobStatusResponse> getJobStatus(@PathVariable String id) {
    return orchestrator
        .status(id)
        .map(JobStatusResponse::from)
        .map(ResponseEntity::ok)
        .orElse(ResponseEntity.notFound().build());
  }

  @DeleteMapping("/api/jobs/{id}")
  @Operation(
      summary = "Cancel job",
      description = "Cancel a job that is queued, downloading or converting")
  public ResponseEntity<CancelResponse> cancel(@PathVariable String id) {
    return orchestrator
        .cancel(id)
        .map(cancelled -> ResponseEntity.ok(new CancelResponse(id, cancelled)))
        .orElse(ResponseEntity.notFound().build());
  }
}
