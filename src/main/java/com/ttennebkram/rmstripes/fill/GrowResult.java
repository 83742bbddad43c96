package com.ttennebkram.rmstripes.fill;

import com.ttennebkram.rmstripes.util.MatUtils;
import org.opencv.core.Mat;

/**
 * Outcome of growing the valid region of a mask.
 *
 * {@code growCount} is the 1-based dilation step at which an originally invalid
 * pixel was first reached, or 0 for pixels that were valid from the start and
 * for pixels never reached.
 */
public final class GrowResult {

    private final int[] growCount;
    private final boolean[] originallyValid;
    private final int rows;
    private final int cols;
    private final int steps;

    GrowResult(int[] growCount, boolean[] originallyValid, int rows, int cols, int steps) {
        this.growCount = growCount;
        this.originallyValid = originallyValid;
        this.rows = rows;
        this.cols = cols;
        this.steps = steps;
    }

    public int rows() {
        return rows;
    }

    public int cols() {
        return cols;
    }

    /** Number of dilation steps that were requested. */
    public int getSteps() {
        return steps;
    }

    public int getGrowCount(int row, int col) {
        return growCount[row * cols + col];
    }

    /** True for pixels reached by growth (originally invalid, now covered). */
    public boolean isGrown(int row, int col) {
        return growCount[row * cols + col] > 0;
    }

    /** True for pixels of the grown valid region: original valid pixels plus grown ones. */
    public boolean isInGrownMask(int row, int col) {
        int i = row * cols + col;
        return originallyValid[i] || growCount[i] > 0;
    }

    /** Originally invalid pixels that no dilation step reached. */
    public boolean isUnreached(int row, int col) {
        int i = row * cols + col;
        return !originallyValid[i] && growCount[i] == 0;
    }

    public int grownCount() {
        int count = 0;
        for (int c : growCount) {
            if (c > 0) count++;
        }
        return count;
    }

    /**
     * CV_8U copy of the grown valid region, 255 where set.
     */
    public Mat getGrownMask() {
        boolean[] grown = new boolean[growCount.length];
        for (int i = 0; i < grown.length; i++) {
            grown[i] = originallyValid[i] || growCount[i] > 0;
        }
        return MatUtils.fromBooleanArray(grown, rows, cols);
    }
}
