package com.ttennebkram.rmstripes.fill;

import com.ttennebkram.rmstripes.util.MatUtils;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

/**
 * Constant-time rectangle sums over a 2D array, built with {@code Imgproc.integral}.
 */
final class SummedAreaTable {

    private final double[] table;
    private final int stride;

    SummedAreaTable(double[] data, int rows, int cols) {
        Mat source = MatUtils.fromDoubleArray(data, rows, cols);
        Mat integral = new Mat();
        try {
            Imgproc.integral(source, integral, CvType.CV_64F);
            this.table = MatUtils.toDoubleArray(integral);
            this.stride = cols + 1;
        } finally {
            MatUtils.release(source, integral);
        }
    }

    /**
     * Sum over rows {@code top..bottom} and columns {@code left..right}, all inclusive.
     */
    double sum(int top, int left, int bottom, int right) {
        int r0 = top * stride;
        int r1 = (bottom + 1) * stride;
        return table[r1 + right + 1] - table[r0 + right + 1] - table[r1 + left] + table[r0 + left];
    }
}
