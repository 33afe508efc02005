package com.project.thermal.hotspots.service;

import com.project.thermal.hotspots.DTOs.HotspotReport;
import com.project.thermal.hotspots.pipeline.DetectionParameters;
import com.project.thermal.hotspots.pipeline.GradientField;
import com.project.thermal.hotspots.pipeline.Grid;
import com.project.thermal.hotspots.pipeline.HotspotDetection;
import com.project.thermal.hotspots.pipeline.HotspotPipeline;
import com.project.thermal.hotspots.pipeline.Region;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Runs one thermal CSV through loading, detection, rendering and export.
 */
@Service
public class HotspotDetectionService {
    private static final Logger log = LoggerFactory.getLogger(HotspotDetectionService.class);
    private static final int HISTOGRAM_BINS = 64;

    private final CsvGridLoader gridLoader;
    private final HotspotPipeline pipeline;
    private final GridStatistics statistics;
    private final HotspotRenderingService renderer;
    private final HotspotCsvExporter exporter;
    private final GradientField gradientField = new GradientField();
    private final double clipLo;
    private final double clipHi;

    public HotspotDetectionService(CsvGridLoader gridLoader,
                                   HotspotPipeline pipeline,
                                   GridStatistics statistics,
                                   HotspotRenderingService renderer,
                                   HotspotCsvExporter exporter,
                                   @Value("${app.hotspots.clip-lo:2}") double clipLo,
                                   @Value("${app.hotspots.clip-hi:98}") double clipHi) {
        this.gridLoader = gridLoader;
        this.pipeline = pipeline;
        this.statistics = statistics;
        this.renderer = renderer;
        this.exporter = exporter;
        this.clipLo = clipLo;
        this.clipHi = clipHi;
    }

    public HotspotReport analyze(byte[] csv, CsvGridLoader.Shape shapeOverride, DetectionParameters params) {
        params.validate();
        CsvGridLoader.LoadedGrid loaded = gridLoader.load(csv, shapeOverride);
        Grid grid = loaded.grid();
        log.info("Loaded {} grid (encoding {}, {} numeric rows of median width {} observed)",
                loaded.shape(), loaded.encoding(), loaded.observedRows(), loaded.medianCols());
        return analyze(grid, loaded.encoding(), params);
    }

    public HotspotReport analyze(Grid grid, String encoding, DetectionParameters params) {
        log.info("Starting hotspot detection for {}x{} grid, sigma={}, percentile={}, minArea={}, ringWidth={}",
                grid.rows(), grid.cols(), params.gaussianSigma(), params.gradientPercentile(),
                params.minRegionArea(), params.ringWidth());

        GridStatistics.Summary tempStats = statistics.describe(grid, clipLo, clipHi);
        Grid rawGradient = gradientField.gradient(grid);
        GridStatistics.Summary gradStats = statistics.describe(rawGradient, clipLo, clipHi);
        log.debug("Temperature stats:\n{}", tempStats.describe("C"));

        HotspotDetection detection = pipeline.detect(grid, params);

        if (!detection.hasHotspots()) {
            log.warn("No hotspots detected with current parameters");
        } else {
            Region top = detection.regions().get(0);
            log.info("Detected {} hotspots; hottest Tmax={} at ({}, {}), DeltaT={}",
                    detection.regions().size(), top.tMax(), top.row(), top.col(), top.deltaT());
        }

        return new HotspotReport(
                grid.rows(), grid.cols(), encoding,
                tempStats, gradStats,
                detection.tau(), detection.candidates().count(),
                detection.regions(),
                renderer.renderThermal(grid, tempStats.clipLow(), tempStats.clipHigh(),
                        detection.labels(), detection.regions()),
                renderer.renderThermalInferno(grid, tempStats.clipLow(), tempStats.clipHigh()),
                renderer.renderHistogram(grid, HISTOGRAM_BINS),
                renderer.renderGradientMap(rawGradient),
                renderer.renderGradient(detection.smoothedGradient(), detection.candidates()),
                renderer.renderMask(detection.mask()),
                renderer.renderTopRegions(detection.labels(), detection.regions()),
                exporter.export(detection.regions())
        );
    }
}
