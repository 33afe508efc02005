package com.project.thermal.hotspots.controller;

import com.project.thermal.hotspots.DTOs.HotspotReport;
import com.project.thermal.hotspots.exceptions.HotspotDetectionException;
import com.project.thermal.hotspots.pipeline.DetectionParameters;
import com.project.thermal.hotspots.pipeline.Region;
import com.project.thermal.hotspots.service.CsvGridLoader;
import com.project.thermal.hotspots.service.HotspotCsvExporter;
import com.project.thermal.hotspots.service.HotspotDetectionService;
import com.project.thermal.hotspots.service.StorageService;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Controller
@Validated
public class HotspotController {
    private static final Logger log = LoggerFactory.getLogger(HotspotController.class);

    static final String THERMAL_PNG = "thermal_hotspot_overlay.png";
    static final String GRADIENT_PNG = "gradient_threshold_overlay.png";
    static final String MASK_PNG = "binary_mask.png";
    static final String THERMAL_INFERNO_PNG = "thermal_inferno.png";
    static final String HISTOGRAM_PNG = "histogram.png";
    static final String GRADIENT_MAP_PNG = "gradient_map.png";
    static final String TOP_REGIONS_PNG = "top3_hotspots_mask.png";

    private static final long MAX_UPLOAD_BYTES = 10 * 1024 * 1024; // 10MB
    private static final int SUMMARY_SIZE = 3;

    private final HotspotDetectionService detectionService;
    private final StorageService storageService;

    @Value("${app.hotspots.default-gaussian-sigma:1.0}")
    private double defaultGaussianSigma;
    @Value("${app.hotspots.default-gradient-percentile:97}")
    private double defaultGradientPercentile;
    @Value("${app.hotspots.default-min-region-area:50}")
    private int defaultMinRegionArea;
    @Value("${app.hotspots.default-ring-width:5}")
    private int defaultRingWidth;

    public HotspotController(HotspotDetectionService detectionService, StorageService storageService) {
        this.detectionService = detectionService;
        this.storageService = storageService;
    }

    @GetMapping("/hotspots")
    public String showForm(Model model) {
        addDefaults(model);
        return "hotspots";
    }

    @PostMapping(value = "/hotspots", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public String handleUpload(
            @RequestParam("file") @NotNull MultipartFile file,
            @RequestParam(name = "gaussianSigma", defaultValue = "1.0")
            @DecimalMin(value = "0.0", inclusive = false, message = "Gaussian sigma must be greater than 0")
            @DecimalMax(value = "20.0", message = "Gaussian sigma must not exceed 20")
            double gaussianSigma,
            @RequestParam(name = "gradientPercentile", defaultValue = "97")
            @DecimalMin(value = "0.0", message = "Percentile must be at least 0")
            @DecimalMax(value = "100.0", message = "Percentile must not exceed 100")
            double gradientPercentile,
            @RequestParam(name = "minRegionArea", defaultValue = "50")
            @Min(value = 1, message = "Minimum region area must be at least 1 pixel")
            int minRegionArea,
            @RequestParam(name = "ringWidth", defaultValue = "5")
            @Min(value = 0, message = "Ring width must not be negative")
            @Max(value = 100, message = "Ring width must not exceed 100 pixels")
            int ringWidth,
            @RequestParam(name = "shapeRows", required = false)
            @Min(value = 1, message = "Shape rows must be at least 1")
            @Max(value = CsvGridLoader.Shape.MAX_SIDE, message = "Shape rows must not exceed 2560")
            Integer shapeRows,
            @RequestParam(name = "shapeCols", required = false)
            @Min(value = 1, message = "Shape columns must be at least 1")
            @Max(value = CsvGridLoader.Shape.MAX_SIDE, message = "Shape columns must not exceed 2560")
            Integer shapeCols,
            Model model
    ) throws IOException {

        validateUploadedFile(file);
        DetectionParameters params =
                new DetectionParameters(gaussianSigma, gradientPercentile, minRegionArea, ringWidth).validate();
        CsvGridLoader.Shape shapeOverride = shapeOverride(shapeRows, shapeCols);

        log.info("Processing file: {} ({}KB), {}", file.getOriginalFilename(), file.getSize() / 1024, params);

        String runId = storageService.newRunId();
        var storedInput = storageService.store(runId, file);
        log.debug("File stored as: {}", storedInput.filename());

        try {
            HotspotReport report = detectionService.analyze(file.getBytes(), shapeOverride, params);

            var thermal = storageService.storeRunFile(runId, THERMAL_PNG, report.thermalPng());
            var gradient = storageService.storeRunFile(runId, GRADIENT_PNG, report.gradientPng());
            var mask = storageService.storeRunFile(runId, MASK_PNG, report.maskPng());
            storageService.storeRunFile(runId, HotspotCsvExporter.FILENAME, report.csv());
            model.addAttribute("thermalInfernoPath",
                    webPath(storageService.storeRunFile(runId, THERMAL_INFERNO_PNG, report.thermalInfernoPng())));
            model.addAttribute("histogramPath",
                    webPath(storageService.storeRunFile(runId, HISTOGRAM_PNG, report.histogramPng())));
            model.addAttribute("gradientMapPath",
                    webPath(storageService.storeRunFile(runId, GRADIENT_MAP_PNG, report.gradientMapPng())));
            model.addAttribute("topRegionsPath",
                    webPath(storageService.storeRunFile(runId, TOP_REGIONS_PNG, report.topRegionsPng())));

            populateResultModel(model, runId, thermal, gradient, mask, report, params);

            log.info("Hotspot detection completed for {} (run {})", file.getOriginalFilename(), runId);
            return "result";

        } catch (HotspotDetectionException e) {
            log.warn("Hotspot detection failed for {}: {}", file.getOriginalFilename(), e.getMessage());
            addDefaults(model);
            model.addAttribute("error", e.getMessage());
            model.addAttribute("suggestion", getSuggestionForError(e.getMessage()));
            return "hotspots";
        }
    }

    private void validateUploadedFile(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("Please choose a CSV file to upload");
        }
        String name = file.getOriginalFilename() == null ? "" : file.getOriginalFilename().toLowerCase(Locale.ROOT);
        if (!name.endsWith(".csv") && !name.endsWith(".txt")) {
            throw new IllegalArgumentException("Unsupported file type: " + file.getOriginalFilename()
                    + ". Upload a thermal CSV export (.csv or .txt)");
        }
        if (file.getSize() > MAX_UPLOAD_BYTES) {
            throw new IllegalArgumentException("File is too large. Maximum size: 10MB");
        }
    }

    private static CsvGridLoader.Shape shapeOverride(Integer rows, Integer cols) {
        if (rows == null && cols == null) {
            return null;
        }
        if (rows == null || cols == null) {
            throw new IllegalArgumentException("Shape override needs both rows and columns");
        }
        return new CsvGridLoader.Shape(rows, cols);
    }

    private void addDefaults(Model model) {
        model.addAttribute("defaultGaussianSigma", defaultGaussianSigma);
        model.addAttribute("defaultGradientPercentile", defaultGradientPercentile);
        model.addAttribute("defaultMinRegionArea", defaultMinRegionArea);
        model.addAttribute("defaultRingWidth", defaultRingWidth);
    }

    private void populateResultModel(Model model, String runId,
                                     StorageService.StoredFile thermal, StorageService.StoredFile gradient,
                                     StorageService.StoredFile mask, HotspotReport report,
                                     DetectionParameters params) {

        model.addAttribute("runId", runId);
        model.addAttribute("thermalPath", webPath(thermal));
        model.addAttribute("gradientPath", webPath(gradient));
        model.addAttribute("maskPath", webPath(mask));
        model.addAttribute("csvPath", "/hotspots/" + runId + "/" + HotspotCsvExporter.FILENAME);

        model.addAttribute("rows", report.rows());
        model.addAttribute("cols", report.cols());
        model.addAttribute("encoding", report.encoding());
        model.addAttribute("params", params);
        model.addAttribute("tau", String.format(Locale.ROOT, "%.4f", report.tau()));
        model.addAttribute("candidatePixels", report.candidatePixels());
        model.addAttribute("temperatureStats", report.temperatureStats().describe("°C"));
        model.addAttribute("gradientStats", report.gradientStats().describe("°C/pixel"));

        model.addAttribute("hotspots", report.regions().size());
        model.addAttribute("hotspotDetails", createHotspotDetails(report.regions()));
        model.addAttribute("topHotspots", createHotspotDetails(report.top(SUMMARY_SIZE)));
    }

    private static String webPath(StorageService.StoredFile file) {
        return "/" + file.relativeWebPath();
    }

    private List<HotspotDetails> createHotspotDetails(List<Region> regions) {
        List<HotspotDetails> details = new ArrayList<>();
        for (int i = 0; i < regions.size(); i++) {
            Region r = regions.get(i);
            details.add(new HotspotDetails(
                    i + 1, r.id(), r.areaPx(),
                    fmt(r.tMax()), fmt(r.tMean()), fmt(r.tBg()), fmt(r.deltaT()),
                    r.row(), r.col()
            ));
        }
        return details;
    }

    private static String fmt(double v) {
        return String.format(Locale.ROOT, "%.3f", v);
    }

    private String getSuggestionForError(String errorMessage) {
        if (errorMessage.contains("No numeric data rows")) {
            return "Export the thermal image as CSV with one row per sensor line (index, then temperatures).";
        } else if (errorMessage.contains("Percentile") || errorMessage.contains("must be")) {
            return "Check the detection parameters and try again.";
        } else if (errorMessage.contains("Non-finite")) {
            return "The export contains invalid temperatures. Re-export the file from the camera software.";
        }
        return "Try different parameters or another export.";
    }

    // One row of the result table
    public static record HotspotDetails(int rank, int id, int areaPx, String tMax, String tMean,
                                        String tBg, String deltaT, int row, int col) {}
}
