package com.ttennebkram.rmstripes.fill;

import com.ttennebkram.rmstripes.ConfigurationException;
import com.ttennebkram.rmstripes.InvariantViolationException;
import com.ttennebkram.rmstripes.util.MatUtils;
import org.opencv.core.Mat;

/**
 * Fills masked pixels by growing the valid region outward.
 *
 * The valid region is dilated {@code nGrow} times (8-connected). A masked pixel reached
 * at step {@code t} takes a blend between the mean of its neighbourhood and a target
 * constant: {@code constant + (mean - constant) * (nGrow - t + 1) / nGrow}. Pixels next
 * to valid data take the neighbourhood mean; the blend decays toward the constant with
 * every further step. Masked pixels never reached are set to the constant.
 *
 * Neighbourhood means are taken over a {@code (2 kernelRadius + 1)^2} window, clamped
 * to the image, of one snapshot: valid pixels with their values and unreached pixels
 * with the constant. Grown pixels never contribute, so the result does not depend on
 * the order in which pixels are filled.
 */
public class MaskGrowthEngine {

    private final Dilation dilation;

    public MaskGrowthEngine() {
        this(new OpenCvDilation());
    }

    public MaskGrowthEngine(Dilation dilation) {
        this.dilation = dilation;
    }

    /**
     * Grow the valid region of {@code maskedImage} for {@code steps} dilation steps.
     */
    public GrowResult grow(MaskedImage maskedImage, int steps) {
        if (steps < 1) {
            throw new ConfigurationException("Number of grow steps must be at least 1, got " + steps);
        }
        int rows = maskedImage.rows();
        int cols = maskedImage.cols();
        boolean[] mask = maskedImage.mask();

        boolean[] valid = new boolean[mask.length];
        for (int i = 0; i < mask.length; i++) {
            valid[i] = !mask[i];
        }
        int[] growCount = new int[mask.length];

        Mat region = MatUtils.fromBooleanArray(valid, rows, cols);
        try {
            for (int step = 1; step <= steps; step++) {
                Mat next = dilation.dilate(region);
                region.release();
                region = next;

                boolean[] covered = MatUtils.toBooleanArray(region);
                int newlyCovered = 0;
                for (int i = 0; i < covered.length; i++) {
                    if (covered[i] && !valid[i] && growCount[i] == 0) {
                        growCount[i] = step;
                        newlyCovered++;
                    }
                }
                if (newlyCovered == 0) {
                    // Region is stable, later steps cannot reach anything new
                    break;
                }
            }
        } finally {
            region.release();
        }

        return new GrowResult(growCount, valid, rows, cols, steps);
    }

    /**
     * Fill every masked pixel of {@code maskedImage}.
     *
     * @param constant     value masked pixels decay toward
     * @param nGrow        number of dilation steps, at least 1
     * @param kernelRadius half-width of the averaging window, must exceed {@code nGrow}
     * @return new CV_64F image of the same shape with no masked pixels
     * @throws ConfigurationException      for invalid parameters
     * @throws InvariantViolationException if a masked pixel could not be assigned
     */
    public Mat fill(MaskedImage maskedImage, double constant, int nGrow, int kernelRadius) {
        validate(nGrow, kernelRadius);

        int rows = maskedImage.rows();
        int cols = maskedImage.cols();
        double[] values = maskedImage.values();
        boolean[] mask = maskedImage.mask();
        GrowResult grown = grow(maskedImage, nGrow);

        // Snapshot the averages are taken over: grown pixels carry zero weight
        double[] snapshot = new double[values.length];
        double[] weight = new double[values.length];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                int i = r * cols + c;
                if (!mask[i]) {
                    snapshot[i] = values[i];
                    weight[i] = 1;
                } else if (grown.isUnreached(r, c)) {
                    snapshot[i] = constant;
                    weight[i] = 1;
                }
            }
        }
        SummedAreaTable sums = new SummedAreaTable(snapshot, rows, cols);
        SummedAreaTable counts = new SummedAreaTable(weight, rows, cols);

        double[] output = new double[values.length];
        boolean[] assigned = new boolean[values.length];
        for (int r = 0; r < rows; r++) {
            int top = Math.max(0, r - kernelRadius);
            int bottom = Math.min(rows - 1, r + kernelRadius);
            for (int c = 0; c < cols; c++) {
                int i = r * cols + c;
                if (!mask[i]) {
                    output[i] = values[i];
                    assigned[i] = true;
                } else if (grown.isGrown(r, c)) {
                    int left = Math.max(0, c - kernelRadius);
                    int right = Math.min(cols - 1, c + kernelRadius);
                    double count = counts.sum(top, left, bottom, right);
                    if (count <= 0) {
                        throw new InvariantViolationException(String.format(
                                "No unmasked pixel within radius %d of grown pixel (%d, %d)", kernelRadius, r, c));
                    }
                    double mean = sums.sum(top, left, bottom, right) / count;
                    output[i] = blend(mean, constant, grown.getGrowCount(r, c), nGrow);
                    assigned[i] = true;
                } else if (grown.isUnreached(r, c)) {
                    output[i] = constant;
                    assigned[i] = true;
                }
            }
        }

        for (int i = 0; i < assigned.length; i++) {
            if (!assigned[i]) {
                throw new InvariantViolationException(
                        "Pixel (" + (i / cols) + ", " + (i % cols) + ") is still masked after filling");
            }
        }
        return MatUtils.fromDoubleArray(output, rows, cols);
    }

    /**
     * Value of a pixel reached at dilation step {@code growCount} out of {@code nGrow}.
     */
    public static double blend(double mean, double constant, int growCount, int nGrow) {
        int confidence = nGrow - growCount + 1;
        return constant + (mean - constant) * confidence / nGrow;
    }

    /**
     * @throws ConfigurationException unless {@code 1 <= nGrow < kernelRadius}
     */
    public static void validate(int nGrow, int kernelRadius) {
        if (nGrow < 1) {
            throw new ConfigurationException("Number of grow steps must be at least 1, got " + nGrow);
        }
        if (kernelRadius <= nGrow) {
            throw new ConfigurationException(
                    "Kernel radius (" + kernelRadius + ") must be larger than the number of grow steps (" + nGrow + ")");
        }
    }
}
