/**
 * REST controller for polling and steering import jobs
 * Uploading and starting imports happen at the upload boundary; this surface only observes
 *
 * Features:
 * - Lists an owner's jobs and returns single status documents
 * - Accepts cancellation requests
 * - Accepts book-matching resolutions for blocked reading-history imports
 * - Serves the error log as a CSV download
 */
package com.williamcallahan.book_import_engine.controller;

import com.williamcallahan.book_import_engine.model.BookResolution;
import com.williamcallahan.book_import_engine.model.ImportJob;
import com.williamcallahan.book_import_engine.service.job.ImportJobService;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/imports/{owner}/jobs")
public class ImportJobController {

    private static final MediaType TEXT_CSV = MediaType.parseMediaType("text/csv");

    private final ImportJobService importJobService;

    public ImportJobController(ImportJobService importJobService) {
        this.importJobService = importJobService;
    }

    @GetMapping
    public ResponseEntity<List<ImportJob>> listJobs(@PathVariable String owner) {
        return ResponseEntity.ok(importJobService.listJobs(owner));
    }

    @GetMapping("/{jobId}")
    public ResponseEntity<ImportJob> getJob(@PathVariable String owner, @PathVariable String jobId) {
        return ResponseEntity.ok(importJobService.getJob(owner, jobId));
    }

    @PostMapping("/{jobId}/cancel")
    public ResponseEntity<ImportJob> cancel(@PathVariable String owner, @PathVariable String jobId) {
        return ResponseEntity.accepted().body(importJobService.requestCancellation(owner, jobId));
    }

    /**
     * Body maps group keys to resolutions; groups left out are skipped.
     */
    @PostMapping("/{jobId}/resolutions")
    public ResponseEntity<ImportJob> submitResolutions(@PathVariable String owner,
                                                       @PathVariable String jobId,
                                                       @RequestBody Map<String, BookResolution> resolutions) {
        return ResponseEntity.accepted().body(importJobService.submitBookResolutions(owner, jobId, resolutions));
    }

    @GetMapping("/{jobId}/errors.csv")
    public ResponseEntity<byte[]> errorReport(@PathVariable String owner, @PathVariable String jobId) {
        byte[] report = importJobService.renderErrorReport(owner, jobId);
        return ResponseEntity.ok()
            .contentType(TEXT_CSV)
            .header(HttpHeaders.CONTENT_DISPOSITION,
                ContentDisposition.attachment().filename("import-errors-" + jobId + ".csv").build().toString())
            .body(report);
    }
}
