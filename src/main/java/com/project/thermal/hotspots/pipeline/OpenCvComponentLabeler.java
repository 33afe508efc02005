package com.project.thermal.hotspots.pipeline;

import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

/** 4-connected labeling through {@link Imgproc#connectedComponents}. */
public class OpenCvComponentLabeler implements ComponentLabeler {

    @Override
    public LabelMap label(BinaryMask mask) {
        Mat src = OpenCvSupport.toMat(mask);
        Mat labels = new Mat();
        try {
            // the returned count includes the background label 0
            int n = Imgproc.connectedComponents(src, labels, 4, CvType.CV_32S);
            int[] data = new int[mask.rows() * mask.cols()];
            labels.get(0, 0, data);
            return LabelMap.wrap(mask.rows(), mask.cols(), data, n - 1);
        } finally {
            src.release();
            labels.release();
        }
    }
}
