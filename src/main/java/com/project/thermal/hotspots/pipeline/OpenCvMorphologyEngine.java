package com.project.thermal.hotspots.pipeline;

import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Rect;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;

/**
 * Disk morphology backed by OpenCV. Borders are constant zero for erosion as well, so results
 * match {@link ArrayMorphologyEngine} pixel for pixel.
 */
public class OpenCvMorphologyEngine implements MorphologyEngine {

    private static final Point ANCHOR = new Point(-1, -1);
    private static final Scalar ZERO = new Scalar(0);
    private static final int FILL_MARK = 128;

    @Override
    public BinaryMask dilate(BinaryMask mask, int radius) {
        DetectionParameters.requireRadius("radius", radius);
        if (radius == 0) return mask;
        Mat kernel = diskKernel(radius);
        Mat src = OpenCvSupport.toMat(mask);
        Mat dst = new Mat();
        try {
            Imgproc.dilate(src, dst, kernel, ANCHOR, 1, Core.BORDER_CONSTANT, ZERO);
            return OpenCvSupport.toMask(dst);
        } finally {
            release(src, dst, kernel);
        }
    }

    @Override
    public BinaryMask erode(BinaryMask mask, int radius) {
        DetectionParameters.requireRadius("radius", radius);
        if (radius == 0) return mask;
        Mat kernel = diskKernel(radius);
        Mat src = OpenCvSupport.toMat(mask);
        Mat dst = new Mat();
        try {
            Imgproc.erode(src, dst, kernel, ANCHOR, 1, Core.BORDER_CONSTANT, ZERO);
            return OpenCvSupport.toMask(dst);
        } finally {
            release(src, dst, kernel);
        }
    }

    @Override
    public BinaryMask fillHoles(BinaryMask mask) {
        Mat src = OpenCvSupport.toMat(mask);
        Mat padded = new Mat();
        Mat floodMask = Mat.zeros(mask.rows() + 4, mask.cols() + 4, CvType.CV_8UC1);
        try {
            // a one pixel background frame connects every border-reachable pixel to (0, 0)
            Core.copyMakeBorder(src, padded, 1, 1, 1, 1, Core.BORDER_CONSTANT, ZERO);
            Imgproc.floodFill(padded, floodMask, new Point(0, 0), new Scalar(FILL_MARK),
                    new Rect(), ZERO, ZERO, 4);

            byte[] data = new byte[padded.rows() * padded.cols()];
            padded.get(0, 0, data);
            int pw = padded.cols();
            boolean[] out = new boolean[mask.rows() * mask.cols()];
            for (int y = 0; y < mask.rows(); y++) {
                for (int x = 0; x < mask.cols(); x++) {
                    out[y * mask.cols() + x] = (data[(y + 1) * pw + (x + 1)] & 0xFF) != FILL_MARK;
                }
            }
            return BinaryMask.wrap(mask.rows(), mask.cols(), out);
        } finally {
            release(src, padded, floodMask);
        }
    }

    private static Mat diskKernel(int radius) {
        int[][] offsets = MorphologyEngine.disk(radius);
        int size = 2 * radius + 1;
        Mat kernel = Mat.zeros(size, size, CvType.CV_8UC1);
        for (int[] o : offsets) {
            kernel.put(o[0] + radius, o[1] + radius, 1);
        }
        return kernel;
    }

    private static void release(Mat... mats) {
        for (Mat m : mats) m.release();
    }
}
