package com.project.thermal.hotspots.pipeline;

import com.project.thermal.hotspots.exceptions.InvalidInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.function.IntPredicate;

/**
 * Measures each labeled region on the original grid and ranks the regions hottest first.
 *
 * <p>The local background of a region is the median temperature of the ring obtained by dilating
 * the region by {@code ringWidth} and removing the region itself. When that ring is empty the
 * median of every pixel outside the region is used, and failing that the median of the grid.
 */
public class RegionAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(RegionAnalyzer.class);

    /** Peak descending, then contrast descending, then identifier. */
    public static final Comparator<Region> RANKING = Comparator
            .comparingDouble(Region::tMax).reversed()
            .thenComparing(Comparator.comparingDouble(Region::deltaT).reversed())
            .thenComparingInt(Region::id);

    private final MorphologyEngine morphology;

    public RegionAnalyzer(MorphologyEngine morphology) {
        this.morphology = morphology;
    }

    public List<Region> analyze(Grid grid, LabelMap labels, int ringWidth) {
        DetectionParameters.requireRadius("ringWidth", ringWidth);
        if (!grid.sameShape(labels.rows(), labels.cols())) {
            throw new InvalidInputException("Label map " + labels.rows() + "x" + labels.cols()
                    + " does not match grid " + grid.rows() + "x" + grid.cols());
        }

        final int n = labels.count();
        final int w = grid.cols();
        final double[] t = grid.data();
        final int[] lab = labels.data();

        int[] area = new int[n + 1];
        double[] sum = new double[n + 1];
        double[] max = new double[n + 1];
        int[] maxIdx = new int[n + 1];
        Arrays.fill(max, Double.NEGATIVE_INFINITY);

        for (int i = 0; i < lab.length; i++) {
            int l = lab[i];
            if (l == 0) continue;
            area[l]++;
            sum[l] += t[i];
            // strict comparison keeps the first peak in row-major order
            if (t[i] > max[l]) {
                max[l] = t[i];
                maxIdx[l] = i;
            }
        }

        List<Region> regions = new ArrayList<>(n);
        for (int l = 1; l <= n; l++) {
            if (area[l] == 0) continue;
            BinaryMask regionMask = labels.regionMask(l);
            double tBg = localBackground(t, regionMask, ringWidth);
            double tMean = sum[l] / area[l];
            regions.add(new Region(l, area[l], max[l], tMean, tBg, max[l] - tBg, maxIdx[l] / w, maxIdx[l] % w));
            log.debug("Region {}: area={} Tmax={} Tbg={}", l, area[l], max[l], tBg);
        }

        regions.sort(RANKING);
        return regions;
    }

    private double localBackground(double[] t, BinaryMask regionMask, int ringWidth) {
        boolean[] region = regionMask.data();
        boolean[] expanded = morphology.dilate(regionMask, ringWidth).data();

        double[] ring = collect(t, i -> expanded[i] && !region[i]);
        if (ring.length > 0) {
            return Percentiles.median(ring);
        }
        double[] outside = collect(t, i -> !region[i]);
        if (outside.length > 0) {
            return Percentiles.median(outside);
        }
        return Percentiles.median(t);
    }

    private static double[] collect(double[] t, IntPredicate include) {
        int count = 0;
        for (int i = 0; i < t.length; i++) if (include.test(i)) count++;
        double[] out = new double[count];
        int k = 0;
        for (int i = 0; i < t.length; i++) if (include.test(i)) out[k++] = t[i];
        return out;
    }
}
