package com.ttennebkram.rmstripes.fill;

import com.ttennebkram.rmstripes.ShapeMismatchException;
import com.ttennebkram.rmstripes.util.MatUtils;
import org.opencv.core.Mat;

/**
 * An image paired with its invalid-pixel mask.
 * Values at masked positions are undefined and must not enter any statistic.
 */
public final class MaskedImage {

    private final double[] values;
    private final boolean[] mask;
    private final int rows;
    private final int cols;

    /**
     * @param image single-channel image, any depth
     * @param mask  single-channel mask of the same shape, non-zero = invalid
     * @throws ShapeMismatchException if the shapes differ
     */
    public MaskedImage(Mat image, Mat mask) {
        MatUtils.requireSingleChannel(image);
        MatUtils.requireSingleChannel(mask);
        if (!MatUtils.sameShape(image, mask)) {
            throw ShapeMismatchException.of(image, mask);
        }
        this.values = MatUtils.toDoubleArray(image);
        this.mask = MatUtils.toBooleanArray(mask);
        this.rows = image.rows();
        this.cols = image.cols();
    }

    public int rows() {
        return rows;
    }

    public int cols() {
        return cols;
    }

    public int maskedCount() {
        int count = 0;
        for (boolean m : mask) {
            if (m) count++;
        }
        return count;
    }

    /** Copy of the values, row-major. */
    double[] values() {
        return values.clone();
    }

    /** Copy of the mask, row-major. */
    boolean[] mask() {
        return mask.clone();
    }
}
