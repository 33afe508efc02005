package com.project.thermal.hotspots.pipeline;

import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Loads the bundled OpenCV native library once and converts between pipeline types and {@link Mat}. */
public final class OpenCvSupport {
    private static final Logger log = LoggerFactory.getLogger(OpenCvSupport.class);

    private static Boolean loaded;

    private OpenCvSupport() {}

    /** Loads the native library on first call; later calls return the cached outcome. */
    public static synchronized boolean isAvailable() {
        if (loaded == null) {
            try {
                nu.pattern.OpenCV.loadLocally();
                log.info("OpenCV loaded successfully");
                loaded = Boolean.TRUE;
            } catch (Exception | UnsatisfiedLinkError e) {
                log.error("Failed to load OpenCV", e);
                loaded = Boolean.FALSE;
            }
        }
        return loaded;
    }

    static Mat toMat(Grid grid) {
        Mat mat = new Mat(grid.rows(), grid.cols(), CvType.CV_64F);
        mat.put(0, 0, grid.data());
        return mat;
    }

    static Grid toGrid(Mat mat) {
        double[] values = new double[mat.rows() * mat.cols()];
        mat.get(0, 0, values);
        return Grid.wrap(mat.rows(), mat.cols(), values);
    }

    /** Foreground becomes 255, background 0. */
    static Mat toMat(BinaryMask mask) {
        boolean[] bits = mask.data();
        byte[] data = new byte[bits.length];
        for (int i = 0; i < bits.length; i++) {
            data[i] = bits[i] ? (byte) 255 : 0;
        }
        Mat mat = new Mat(mask.rows(), mask.cols(), CvType.CV_8UC1);
        mat.put(0, 0, data);
        return mat;
    }

    static BinaryMask toMask(Mat mat) {
        byte[] data = new byte[mat.rows() * mat.cols()];
        mat.get(0, 0, data);
        boolean[] bits = new boolean[data.length];
        for (int i = 0; i < data.length; i++) {
            bits[i] = data[i] != 0;
        }
        return BinaryMask.wrap(mat.rows(), mat.cols(), bits);
    }
}
