package com.project.thermal.hotspots.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Gradient-first, hottest-first hotspot detection.
 *
 * <p>Sharp thermal transitions are located on the smoothed grid (gradient magnitude above a
 * percentile), rebuilt into solid bodies by morphology, labeled, filtered by area and relabeled.
 * The surviving regions are then measured on the original grid and ranked by peak temperature,
 * with the contrast against the local ring background as tie-break.
 *
 * <p>The smoothing, morphology and labeling strategies are injected once; every call is a pure
 * function of the grid and parameters, so one instance can serve concurrent callers.
 */
public class HotspotPipeline {
    private static final Logger log = LoggerFactory.getLogger(HotspotPipeline.class);

    private final SmoothingFilter smoothing;
    private final GradientField gradientField;
    private final Thresholder thresholder;
    private final MorphologyEngine morphology;
    private final ComponentLabeler labeler;
    private final RegionFilter regionFilter;
    private final RegionAnalyzer regionAnalyzer;

    public HotspotPipeline(SmoothingFilter smoothing, MorphologyEngine morphology, ComponentLabeler labeler) {
        this(smoothing, new GradientField(), new Thresholder(), morphology, labeler,
                new RegionFilter(), new RegionAnalyzer(morphology));
    }

    public HotspotPipeline(SmoothingFilter smoothing,
                           GradientField gradientField,
                           Thresholder thresholder,
                           MorphologyEngine morphology,
                           ComponentLabeler labeler,
                           RegionFilter regionFilter,
                           RegionAnalyzer regionAnalyzer) {
        this.smoothing = smoothing;
        this.gradientField = gradientField;
        this.thresholder = thresholder;
        this.morphology = morphology;
        this.labeler = labeler;
        this.regionFilter = regionFilter;
        this.regionAnalyzer = regionAnalyzer;
    }

    /** Pure-array strategies throughout. */
    public static HotspotPipeline arrayBacked() {
        return new HotspotPipeline(new SeparableGaussianFilter(), new ArrayMorphologyEngine(),
                new FloodFillComponentLabeler());
    }

    /** OpenCV strategies; the caller must have checked {@link OpenCvSupport#isAvailable()}. */
    public static HotspotPipeline openCvBacked() {
        return new HotspotPipeline(new OpenCvGaussianFilter(), new OpenCvMorphologyEngine(),
                new OpenCvComponentLabeler());
    }

    public HotspotDetection detect(Grid grid, DetectionParameters params) {
        params.validate();
        Grid smoothed = smoothing.smooth(grid, params.gaussianSigma());
        Grid magnitude = gradientField.gradient(smoothed);
        Thresholder.Result thresholded = thresholder.threshold(magnitude, params.gradientPercentile());
        double tau = thresholded.tau();

        // a cutoff at the field minimum would take in the edgeless background, so only values above it count
        BinaryMask candidates = tau > magnitude.min()
                ? thresholded.mask()
                : thresholder.above(magnitude, tau);
        log.debug("Gradient cutoff tau={} at p{} selects {} candidate pixels",
                tau, params.gradientPercentile(), candidates.count());

        BinaryMask refined = morphology.refine(candidates);
        LabelMap initial = labeler.label(refined);
        BinaryMask kept = regionFilter.filter(initial, params.minRegionArea());
        LabelMap labels = labeler.label(kept);
        log.debug("{} regions after morphology, {} with area >= {}",
                initial.count(), labels.count(), params.minRegionArea());

        List<Region> regions = regionAnalyzer.analyze(grid, labels, params.ringWidth());
        return new HotspotDetection(magnitude, tau, candidates, kept, labels, regions);
    }
}
