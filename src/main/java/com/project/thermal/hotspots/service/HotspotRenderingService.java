package com.project.thermal.hotspots.service;

import com.project.thermal.hotspots.exceptions.HotspotDetectionException;
import com.project.thermal.hotspots.pipeline.BinaryMask;
import com.project.thermal.hotspots.pipeline.Grid;
import com.project.thermal.hotspots.pipeline.LabelMap;
import com.project.thermal.hotspots.pipeline.Region;
import org.springframework.stereotype.Service;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.util.List;
import javax.imageio.ImageIO;

/** Diagnostic PNGs for a detection run. Pure rendering: nothing here feeds back into the results. */
@Service
public class HotspotRenderingService {

    private static final Color MASK_OBJECT_COLOR = new Color(0, 180, 255);
    private static final Color MASK_BACKGROUND   = new Color(0, 0, 0);
    private static final Color CONTOUR_COLOR     = new Color(0, 255, 255);
    private static final Color PEAK_COLOR        = Color.WHITE;
    private static final Color[] RANK_COLORS = {new Color(255, 0, 0), new Color(0, 200, 0), new Color(0, 0, 255)};
    private static final Color HISTOGRAM_BAR     = new Color(70, 110, 180);
    private static final int PEAK_MARKER_ARM = 3;
    private static final int HISTOGRAM_WIDTH = 640;
    private static final int HISTOGRAM_HEIGHT = 360;
    private static final int HISTOGRAM_MARGIN = 20;
    private static final int[][] INFERNO = {
            {0, 0, 4}, {87, 16, 110}, {188, 55, 84}, {249, 142, 9}, {252, 255, 164}};

    /**
     * Thermal image in the jet palette scaled to {@code [lo, hi]}, with the three hottest regions
     * outlined (red, green, blue) and the top peak marked.
     */
    public byte[] renderThermal(Grid grid, double lo, double hi, LabelMap labels, List<Region> ranked) {
        final int w = grid.cols(), h = grid.rows();
        BufferedImage img = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        double span = hi > lo ? hi - lo : 1.0;
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                img.setRGB(x, y, jet((grid.get(y, x) - lo) / span));
            }
        }

        for (int i = Math.min(ranked.size(), RANK_COLORS.length) - 1; i >= 0; i--) {
            outline(img, labels.regionMask(ranked.get(i).id()), RANK_COLORS[i].getRGB());
        }
        if (!ranked.isEmpty()) {
            Region top = ranked.get(0);
            markPeak(img, top.row(), top.col());
        }
        return toPng(img);
    }

    /** Same image in the inferno palette. */
    public byte[] renderThermalInferno(Grid grid, double lo, double hi) {
        return toPng(paint(grid, lo, hi));
    }

    /** Raw gradient magnitude in the inferno palette, scaled to its own range. */
    public byte[] renderGradientMap(Grid magnitude) {
        return toPng(paint(magnitude, magnitude.min(), magnitude.max()));
    }

    /** Gradient magnitude in grayscale with the outline of the candidate pixels drawn in cyan. */
    public byte[] renderGradient(Grid magnitude, BinaryMask candidates) {
        final int w = magnitude.cols(), h = magnitude.rows();
        double min = magnitude.min(), max = magnitude.max();
        double span = max > min ? max - min : 1.0;
        BufferedImage img = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);

        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int g = clamp((int) Math.round(255 * (magnitude.get(y, x) - min) / span));
                img.setRGB(x, y, (g << 16) | (g << 8) | g);
            }
        }
        if (!candidates.isEmpty()) {
            outline(img, candidates, CONTOUR_COLOR.getRGB());
        }
        return toPng(img);
    }

    /**
     * Temperature histogram with {@code bins} equal-width bins over {@code [min, max]}.
     * A grid without range puts every value in the first bin.
     */
    public byte[] renderHistogram(Grid grid, int bins) {
        if (bins <= 0) {
            throw new IllegalArgumentException("bins must be positive, got " + bins);
        }
        long[] counts = histogram(grid, bins);
        long peak = 1;
        for (long c : counts) peak = Math.max(peak, c);

        BufferedImage img = new BufferedImage(HISTOGRAM_WIDTH, HISTOGRAM_HEIGHT, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = img.createGraphics();
        try {
            graphics.setColor(Color.WHITE);
            graphics.fillRect(0, 0, HISTOGRAM_WIDTH, HISTOGRAM_HEIGHT);

            int plotW = HISTOGRAM_WIDTH - 2 * HISTOGRAM_MARGIN;
            int plotH = HISTOGRAM_HEIGHT - 2 * HISTOGRAM_MARGIN;
            int baseline = HISTOGRAM_MARGIN + plotH;
            graphics.setColor(HISTOGRAM_BAR);
            for (int b = 0; b < bins; b++) {
                int x0 = HISTOGRAM_MARGIN + b * plotW / bins;
                int x1 = HISTOGRAM_MARGIN + (b + 1) * plotW / bins;
                int barH = (int) Math.round((double) counts[b] * plotH / peak);
                graphics.fillRect(x0, baseline - barH, Math.max(1, x1 - x0 - 1), barH);
            }
            graphics.setColor(Color.BLACK);
            graphics.drawLine(HISTOGRAM_MARGIN, baseline, HISTOGRAM_MARGIN + plotW, baseline);
            graphics.drawLine(HISTOGRAM_MARGIN, HISTOGRAM_MARGIN, HISTOGRAM_MARGIN, baseline);
        } finally {
            graphics.dispose();
        }
        return toPng(img);
    }

    static long[] histogram(Grid grid, int bins) {
        double min = grid.min(), max = grid.max();
        double span = max - min;
        long[] counts = new long[bins];
        for (int r = 0; r < grid.rows(); r++) {
            for (int c = 0; c < grid.cols(); c++) {
                int b = span > 0 ? (int) ((grid.get(r, c) - min) / span * bins) : 0;
                counts[Math.min(b, bins - 1)]++;
            }
        }
        return counts;
    }

    /** The three hottest regions filled in their rank colors on black. */
    public byte[] renderTopRegions(LabelMap labels, List<Region> ranked) {
        final int w = labels.cols(), h = labels.rows();
        BufferedImage img = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        int n = Math.min(ranked.size(), RANK_COLORS.length);
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int id = labels.get(y, x);
                for (int i = 0; i < n; i++) {
                    if (ranked.get(i).id() == id) {
                        img.setRGB(x, y, RANK_COLORS[i].getRGB());
                        break;
                    }
                }
            }
        }
        return toPng(img);
    }

    /** Solid mask on a black background. */
    public byte[] renderMask(BinaryMask mask) {
        final int w = mask.cols(), h = mask.rows();
        BufferedImage img = new BufferedImage(w, h, BufferedImage.TYPE_INT_ARGB);
        int maskARGB = (0xFF << 24) | (MASK_OBJECT_COLOR.getRed() << 16) |
                (MASK_OBJECT_COLOR.getGreen() << 8) | MASK_OBJECT_COLOR.getBlue();

        Graphics2D graphics = img.createGraphics();
        graphics.setColor(MASK_BACKGROUND);
        graphics.fillRect(0, 0, w, h);
        graphics.dispose();

        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                if (mask.get(y, x)) img.setRGB(x, y, maskARGB);
            }
        }
        return toPng(img);
    }

    private static BufferedImage paint(Grid grid, double lo, double hi) {
        final int w = grid.cols(), h = grid.rows();
        BufferedImage img = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        double span = hi > lo ? hi - lo : 1.0;
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                img.setRGB(x, y, inferno((grid.get(y, x) - lo) / span));
            }
        }
        return img;
    }

    /** Paints the region pixels that touch the grid border or a 4-neighbor outside the region. */
    private static void outline(BufferedImage img, BinaryMask region, int rgb) {
        final int w = region.cols(), h = region.rows();
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                if (!region.get(y, x)) continue;
                boolean edge = x == 0 || y == 0 || x == w - 1 || y == h - 1
                        || !region.get(y, x - 1) || !region.get(y, x + 1)
                        || !region.get(y - 1, x) || !region.get(y + 1, x);
                if (edge) img.setRGB(x, y, rgb);
            }
        }
    }

    private static void markPeak(BufferedImage img, int row, int col) {
        int rgb = PEAK_COLOR.getRGB();
        for (int d = -PEAK_MARKER_ARM; d <= PEAK_MARKER_ARM; d++) {
            if (col + d >= 0 && col + d < img.getWidth()) img.setRGB(col + d, row, rgb);
            if (row + d >= 0 && row + d < img.getHeight()) img.setRGB(col, row + d, rgb);
        }
    }

    /** Jet colormap for {@code v} in [0, 1]; values outside are clipped. */
    static int jet(double v) {
        v = Math.max(0, Math.min(1, v));
        int r = clamp((int) Math.round(255 * clamp01(1.5 - Math.abs(4 * v - 3))));
        int g = clamp((int) Math.round(255 * clamp01(1.5 - Math.abs(4 * v - 2))));
        int b = clamp((int) Math.round(255 * clamp01(1.5 - Math.abs(4 * v - 1))));
        return (r << 16) | (g << 8) | b;
    }

    /** Inferno colormap for {@code v} in [0, 1], linear between five anchors; values outside are clipped. */
    static int inferno(double v) {
        v = clamp01(v);
        double pos = v * (INFERNO.length - 1);
        int i = Math.min((int) pos, INFERNO.length - 2);
        double f = pos - i;
        int rgb = 0;
        for (int ch = 0; ch < 3; ch++) {
            double c = INFERNO[i][ch] + f * (INFERNO[i + 1][ch] - INFERNO[i][ch]);
            rgb = (rgb << 8) | clamp((int) Math.round(c));
        }
        return rgb;
    }

    private static double clamp01(double v) {
        return Math.max(0, Math.min(1, v));
    }

    private static int clamp(int v) {
        return (v < 0) ? 0 : Math.min(255, v);
    }

    private static byte[] toPng(BufferedImage img) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            ImageIO.write(img, "png", baos);
            return baos.toByteArray();
        }
        catch (Exception e) {
            throw new HotspotDetectionException("Failed to encode image", e);
        }
    }
}
