package com.project.thermal.hotspots.service;

import com.project.thermal.hotspots.exceptions.InvalidInputException;
import com.project.thermal.hotspots.exceptions.InvalidParameterException;
import com.project.thermal.hotspots.pipeline.Grid;
import com.project.thermal.hotspots.pipeline.Percentiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads FLUKE/FLIR style CSV exports into a clean temperature grid.
 *
 * <p>Export headers are skipped until the first numeric row ({@code index,temperature,...}); the
 * index column is dropped. The grid is snapped to the closest standard sensor shape (or an explicit
 * override), rows are truncated or padded, and missing cells are imputed with the row median, or
 * the global median when a row has no values.
 */
@Component
public class CsvGridLoader {
    private static final Logger log = LoggerFactory.getLogger(CsvGridLoader.class);

    public static final List<Shape> STANDARD_SHAPES = List.of(new Shape(480, 640), new Shape(240, 320));

    private static final List<Charset> ENCODINGS = List.of(
            StandardCharsets.UTF_8, StandardCharsets.UTF_16, StandardCharsets.UTF_16LE, StandardCharsets.UTF_16BE);

    public record Shape(int rows, int cols) {
        /** Four full 480x640 frames. */
        public static final long MAX_PIXELS = 4L * 480 * 640;
        public static final int MAX_SIDE = 2560;

        public Shape {
            if (rows <= 0 || cols <= 0) {
                throw new InvalidParameterException("Grid shape must be positive, got " + rows + "x" + cols);
            }
            if ((long) rows * cols > MAX_PIXELS) {
                throw new InvalidParameterException("Grid shape " + rows + "x" + cols
                        + " exceeds the limit of " + MAX_PIXELS + " pixels");
            }
        }

        @Override
        public String toString() {
            return rows + "x" + cols;
        }
    }

    public record LoadedGrid(Grid grid, String encoding, Shape shape, int observedRows, int medianCols) {}

    private record Decoded(String encoding, List<String> lines) {}

    public LoadedGrid load(byte[] content, Shape shapeOverride) {
        Decoded decoded = decode(content);
        List<String> lines = decoded.lines();

        // header lines before the data and stray text lines inside it are skipped alike
        List<double[]> rows = new ArrayList<>();
        for (String line : lines) {
            String[] tokens = tokenize(line);
            if (!isNumericRow(tokens)) continue;
            double[] vals = new double[tokens.length - 1];
            for (int i = 1; i < tokens.length; i++) {
                vals[i - 1] = safeDouble(tokens[i]);
            }
            rows.add(vals);
        }
        if (rows.isEmpty()) {
            throw new InvalidInputException("No numeric data rows found in the CSV.");
        }

        int observedRows = rows.size();
        double[] widths = rows.stream().mapToDouble(r -> r.length).toArray();
        int medianCols = (int) Percentiles.median(widths);
        Shape target = shapeOverride != null ? shapeOverride : closestStandardShape(observedRows, medianCols);
        log.debug("Parsed {} numeric rows (median {} columns) using {}, target shape {}",
                observedRows, medianCols, decoded.encoding(), target);

        double globalMedian = median(rows.stream().flatMapToDouble(Arrays::stream).toArray());

        double[] grid = new double[Math.multiplyExact(target.rows(), target.cols())];
        for (int r = 0; r < target.rows(); r++) {
            double[] row = new double[target.cols()];
            Arrays.fill(row, Double.NaN);
            if (r < rows.size()) {
                double[] src = rows.get(r);
                System.arraycopy(src, 0, row, 0, Math.min(src.length, row.length));
            }
            double fill = r < rows.size() ? median(row, globalMedian) : globalMedian;
            for (int c = 0; c < row.length; c++) {
                grid[r * target.cols() + c] = Double.isNaN(row[c]) ? fill : row[c];
            }
        }

        return new LoadedGrid(Grid.of(target.rows(), target.cols(), grid), decoded.encoding(), target,
                observedRows, medianCols);
    }

    static Shape closestStandardShape(int observedRows, int medianCols) {
        Shape best = null;
        int bestScore = Integer.MAX_VALUE;
        for (Shape s : STANDARD_SHAPES) {
            int score = Math.abs(observedRows - s.rows()) + Math.abs(medianCols - s.cols());
            if (score < bestScore) {
                best = s;
                bestScore = score;
            }
        }
        return best;
    }

    /**
     * First encoding that decodes strictly into at least three lines without NUL characters wins;
     * otherwise UTF-8 with malformed bytes dropped.
     */
    private static Decoded decodeWith(byte[] content) {
        for (Charset cs : ENCODINGS) {
            try {
                String text = strictDecoder(cs).decode(ByteBuffer.wrap(content)).toString();
                List<String> lines = splitLines(text);
                if (lines.size() >= 3 && text.indexOf('\u0000') < 0) {
                    return new Decoded(cs.name(), lines);
                }
            } catch (CharacterCodingException e) {
                log.trace("Content is not valid {}: {}", cs.name(), e.getMessage());
            }
        }
        CharsetDecoder lenient = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.IGNORE)
                .onUnmappableCharacter(CodingErrorAction.IGNORE);
        try {
            String text = lenient.decode(ByteBuffer.wrap(content)).toString();
            return new Decoded("UTF-8 (ignore errors)", splitLines(text));
        } catch (CharacterCodingException e) {
            throw new InvalidInputException("Unable to decode CSV content: " + e.getMessage());
        }
    }

    private static Decoded decode(byte[] content) {
        if (content == null || content.length == 0) {
            throw new InvalidInputException("CSV content is empty.");
        }
        return decodeWith(content);
    }

    private static CharsetDecoder strictDecoder(Charset cs) {
        return cs.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
    }

    private static List<String> splitLines(String text) {
        if (!text.isEmpty() && text.charAt(0) == '\uFEFF') {
            text = text.substring(1);
        }
        return text.lines().toList();
    }

    private static String[] tokenize(String line) {
        String[] tokens = line.split(",", -1);
        for (int i = 0; i < tokens.length; i++) tokens[i] = tokens[i].trim();
        return tokens;
    }

    /** First token an integer, second a number. */
    static boolean isNumericRow(String[] tokens) {
        if (tokens.length < 2) {
            return false;
        }
        try {
            Long.parseLong(tokens[0]);
            Double.parseDouble(tokens[1]);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    // unparseable and non-finite cells count as missing
    private static double safeDouble(String token) {
        try {
            double v = Double.parseDouble(token);
            return Double.isFinite(v) ? v : Double.NaN;
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

    private static double median(double[] values) {
        return median(values, 0.0);
    }

    private static double median(double[] values, double fallback) {
        double[] present = Arrays.stream(values).filter(v -> !Double.isNaN(v)).toArray();
        return present.length == 0 ? fallback : Percentiles.median(present);
    }
}
