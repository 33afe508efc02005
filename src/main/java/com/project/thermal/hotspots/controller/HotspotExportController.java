package com.project.thermal.hotspots.controller;

import com.project.thermal.hotspots.service.HotspotCsvExporter;
import com.project.thermal.hotspots.service.StorageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;

/** Download of the per-run hotspot table. */
@Controller
public class HotspotExportController {
    private static final Logger log = LoggerFactory.getLogger(HotspotExportController.class);

    private final StorageService storageService;

    public HotspotExportController(StorageService storageService) {
        this.storageService = storageService;
    }

    @GetMapping("/hotspots/{runId}/" + HotspotCsvExporter.FILENAME)
    public ResponseEntity<byte[]> exportCsv(@PathVariable String runId) {
        return storageService.readRunFile(runId, HotspotCsvExporter.FILENAME)
                .map(bytes -> ResponseEntity.ok()
                        .header(HttpHeaders.CONTENT_DISPOSITION,
                                "attachment; filename=\"hotspot_stats_" + runId + ".csv\"")
                        .contentType(MediaType.parseMediaType("text/csv; charset=UTF-8"))
                        .contentLength(bytes.length)
                        .body(bytes))
                .orElseGet(() -> {
                    log.warn("No hotspot export for run {}", runId);
                    return ResponseEntity.notFound().build();
                });
    }
}
