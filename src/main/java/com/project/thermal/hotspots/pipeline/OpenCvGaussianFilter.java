package com.project.thermal.hotspots.pipeline;

import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

/** Gaussian blur through {@link Imgproc#GaussianBlur} with replicated borders. */
public class OpenCvGaussianFilter implements SmoothingFilter {

    @Override
    public Grid smooth(Grid grid, double sigma) {
        DetectionParameters.requireSigma(sigma);
        int ksize = 2 * SmoothingFilter.kernelRadius(sigma) + 1;
        Mat src = OpenCvSupport.toMat(grid);
        Mat dst = new Mat();
        try {
            Imgproc.GaussianBlur(src, dst, new Size(ksize, ksize), sigma, sigma, Core.BORDER_REPLICATE);
            return OpenCvSupport.toGrid(dst);
        } finally {
            src.release();
            dst.release();
        }
    }
}
