package com.ttennebkram.rmstripes.stripes;

import com.ttennebkram.rmstripes.ConfigurationException;
import com.ttennebkram.rmstripes.util.MatUtils;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Rect;

import java.util.ArrayList;
import java.util.List;

/**
 * Attenuates the low-frequency content of a coefficient array along its rows axis.
 *
 * Every column is transformed with a 1D DFT, the spectrum is centred and multiplied by
 * a Gaussian notch {@code 1 - exp(-(k - c)^2 / (2 sigma^2))} that is zero at the DC term
 * and tends to one away from it, then transformed back. Only the real part is kept.
 * Content that is constant down a column (a vertical stripe) is removed entirely.
 */
public class CoefficientDamper {

    /**
     * @param coefficients single-channel array (not modified)
     * @param sigma        width of the Gaussian notch in frequency bins, must be positive
     * @return new CV_64F array of the same shape
     * @throws ConfigurationException if sigma is not positive
     */
    public Mat damp(Mat coefficients, double sigma) {
        validateSigma(sigma);
        MatUtils.requireSingleChannel(coefficients);

        int rows = coefficients.rows();
        int cols = coefficients.cols();

        // Work on the transpose so each column becomes a row for DFT_ROWS
        Mat real = MatUtils.toDouble(coefficients);
        Mat transposed = new Mat();
        Core.transpose(real, transposed);
        real.release();

        Mat complex = new Mat();
        List<Mat> planes = new ArrayList<>();
        planes.add(transposed);
        planes.add(Mat.zeros(transposed.size(), CvType.CV_64F));
        Core.merge(planes, complex);
        MatUtils.release(planes.get(0), planes.get(1));

        Mat shifted = null;
        Mat weights = null;
        Mat filtered = new Mat();
        Mat unshifted = null;
        List<Mat> spectrumPlanes = new ArrayList<>();
        List<Mat> resultPlanes = new ArrayList<>();
        try {
            Core.dft(complex, complex, Core.DFT_ROWS);
            shifted = rollColumns(complex, rows / 2);

            weights = createNotchWeights(cols, rows, sigma);
            Core.split(shifted, spectrumPlanes);
            Core.multiply(spectrumPlanes.get(0), weights, spectrumPlanes.get(0));
            Core.multiply(spectrumPlanes.get(1), weights, spectrumPlanes.get(1));
            Core.merge(spectrumPlanes, filtered);

            unshifted = rollColumns(filtered, rows - rows / 2);
            Core.idft(unshifted, unshifted, Core.DFT_ROWS);

            // idft is unnormalised: divide by the transform length
            Core.split(unshifted, resultPlanes);
            Mat scaled = new Mat();
            resultPlanes.get(0).convertTo(scaled, -1, 1.0 / rows, 0);
            resultPlanes.add(scaled);

            Mat output = new Mat();
            Core.transpose(scaled, output);
            return output;
        } finally {
            MatUtils.release(complex, shifted, weights, filtered, unshifted);
            for (Mat p : spectrumPlanes) p.release();
            for (Mat p : resultPlanes) p.release();
        }
    }

    /**
     * @throws ConfigurationException unless sigma is a finite positive number
     */
    public static void validateSigma(double sigma) {
        if (!(sigma > 0) || Double.isInfinite(sigma)) {
            throw new ConfigurationException("sigma must be a positive number, got " + sigma);
        }
    }

    /**
     * Notch weights for a centred spectrum of {@code length} bins, repeated over {@code count} rows.
     */
    static Mat createNotchWeights(int count, int length, double sigma) {
        double[] profile = notchProfile(length, sigma);
        double[] data = new double[count * length];
        for (int r = 0; r < count; r++) {
            System.arraycopy(profile, 0, data, r * length, length);
        }
        return MatUtils.fromDoubleArray(data, count, length);
    }

    /**
     * Weight per centred frequency bin; the zero-frequency bin sits at {@code length / 2}.
     */
    static double[] notchProfile(int length, double sigma) {
        double[] profile = new double[length];
        int center = length / 2;
        double twoSigmaSq = 2.0 * sigma * sigma;
        for (int k = 0; k < length; k++) {
            double offset = k - center;
            profile[k] = 1.0 - Math.exp(-(offset * offset) / twoSigmaSq);
        }
        return profile;
    }

    /**
     * Circular shift of every row by {@code shift} columns to the right.
     */
    static Mat rollColumns(Mat input, int shift) {
        int cols = input.cols();
        int rows = input.rows();
        int s = ((shift % cols) + cols) % cols;

        Mat output = new Mat(rows, cols, input.type());
        if (s == 0) {
            input.copyTo(output);
            return output;
        }

        Mat head = new Mat(input, new Rect(0, 0, cols - s, rows));
        Mat tail = new Mat(input, new Rect(cols - s, 0, s, rows));
        Mat headTarget = new Mat(output, new Rect(s, 0, cols - s, rows));
        Mat tailTarget = new Mat(output, new Rect(0, 0, s, rows));
        head.copyTo(headTarget);
        tail.copyTo(tailTarget);
        MatUtils.release(head, tail, headTarget, tailTarget);
        return output;
    }
}
