package com.ttennebkram.rmstripes.util;

import com.ttennebkram.rmstripes.ConfigurationException;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;

/**
 * Conversions between single-channel OpenCV Mats and row-major Java arrays.
 * All methods return new buffers; inputs are never modified.
 */
public final class MatUtils {

    private MatUtils() {
    }

    /**
     * Copy a single-channel Mat into a row-major double array, converting the depth if needed.
     */
    public static double[] toDoubleArray(Mat mat) {
        requireSingleChannel(mat);

        Mat source = mat;
        if (mat.depth() != CvType.CV_64F) {
            source = new Mat();
            mat.convertTo(source, CvType.CV_64F);
        } else if (!mat.isContinuous()) {
            source = mat.clone();
        }

        double[] buffer = new double[(int) source.total()];
        source.get(0, 0, buffer);

        if (source != mat) {
            source.release();
        }
        return buffer;
    }

    /**
     * Copy a single-channel 8-bit Mat into a boolean array (non-zero = true).
     */
    public static boolean[] toBooleanArray(Mat mat) {
        requireSingleChannel(mat);

        Mat source = mat;
        if (mat.type() != CvType.CV_8UC1) {
            // compare() against zero instead of convertTo() so 0.5 or 256 do not saturate to 0/255
            source = new Mat();
            Core.compare(mat, new Scalar(0), source, Core.CMP_NE);
        } else if (!mat.isContinuous()) {
            source = mat.clone();
        }

        byte[] buffer = new byte[(int) source.total()];
        source.get(0, 0, buffer);
        if (source != mat) {
            source.release();
        }

        boolean[] result = new boolean[buffer.length];
        for (int i = 0; i < buffer.length; i++) {
            result[i] = buffer[i] != 0;
        }
        return result;
    }

    /**
     * Build a CV_64F Mat from a row-major array.
     */
    public static Mat fromDoubleArray(double[] data, int rows, int cols) {
        if (data.length != rows * cols) {
            throw new IllegalArgumentException(
                    "Buffer of " + data.length + " values does not fit " + rows + "x" + cols);
        }
        Mat mat = new Mat(rows, cols, CvType.CV_64F);
        mat.put(0, 0, data);
        return mat;
    }

    /**
     * Build a CV_8U mask Mat (255 where true) from a row-major array.
     */
    public static Mat fromBooleanArray(boolean[] data, int rows, int cols) {
        if (data.length != rows * cols) {
            throw new IllegalArgumentException(
                    "Buffer of " + data.length + " values does not fit " + rows + "x" + cols);
        }
        byte[] bytes = new byte[data.length];
        for (int i = 0; i < data.length; i++) {
            bytes[i] = data[i] ? (byte) 255 : 0;
        }
        Mat mat = new Mat(rows, cols, CvType.CV_8UC1);
        mat.put(0, 0, bytes);
        return mat;
    }

    /**
     * Build a CV_64F Mat from a rectangular 2D array, rows first.
     */
    public static Mat fromRows(double[][] rows) {
        int height = rows.length;
        int width = height == 0 ? 0 : rows[0].length;
        double[] data = new double[height * width];
        for (int r = 0; r < height; r++) {
            if (rows[r].length != width) {
                throw new IllegalArgumentException("Row " + r + " has " + rows[r].length + " values, expected " + width);
            }
            System.arraycopy(rows[r], 0, data, r * width, width);
        }
        return fromDoubleArray(data, height, width);
    }

    /**
     * Copy a Mat into a rectangular 2D array, rows first.
     */
    public static double[][] toRows(Mat mat) {
        double[] data = toDoubleArray(mat);
        double[][] rows = new double[mat.rows()][mat.cols()];
        for (int r = 0; r < rows.length; r++) {
            System.arraycopy(data, r * mat.cols(), rows[r], 0, mat.cols());
        }
        return rows;
    }

    /**
     * Convert to a new CV_64F Mat. Always returns a copy the caller owns.
     */
    public static Mat toDouble(Mat mat) {
        Mat output = new Mat();
        mat.convertTo(output, CvType.CV_64F);
        return output;
    }

    public static boolean sameShape(Mat a, Mat b) {
        return a.rows() == b.rows() && a.cols() == b.cols();
    }

    public static void requireSingleChannel(Mat mat) {
        if (mat == null || mat.empty()) {
            throw new ConfigurationException("Image is empty");
        }
        if (mat.channels() != 1) {
            throw new ConfigurationException(
                    "Expected a single band, got " + mat.channels() + " channels");
        }
    }

    /**
     * Release every non-null Mat.
     */
    public static void release(Mat... mats) {
        for (Mat m : mats) {
            if (m != null) {
                m.release();
            }
        }
    }
}
