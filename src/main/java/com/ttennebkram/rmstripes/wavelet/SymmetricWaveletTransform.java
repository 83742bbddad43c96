package com.ttennebkram.rmstripes.wavelet;

import com.ttennebkram.rmstripes.util.MatUtils;
import org.opencv.core.Mat;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Discrete wavelet transform with half-sample symmetric boundary extension
 * ({@code ... x1 x0 | x0 x1 ... xn-1 | xn-1 xn-2 ...}).
 *
 * A signal of length N analysed with a filter of length F yields
 * {@code floor((N + F - 1) / 2)} coefficients per channel; synthesis of M coefficients
 * yields {@code 2M - F + 2} samples. In 2D the rows axis is transformed first, so the
 * horizontal detail band is high-pass along rows and low-pass along columns.
 */
public class SymmetricWaveletTransform implements WaveletTransform2D {

    @Override
    public CoefficientPyramid decompose(Mat image, Wavelet wavelet, int levels) {
        if (levels < 1) {
            throw new IllegalArgumentException("Decomposition level must be at least 1, got " + levels);
        }
        MatUtils.requireSingleChannel(image);

        double[] lo = wavelet.getScalingDecomposition();
        double[] hi = wavelet.getWaveletDecomposition();

        Band current = new Band(MatUtils.toDoubleArray(image), image.rows(), image.cols());
        List<DetailLevel> details = new ArrayList<>(levels);

        for (int level = 0; level < levels; level++) {
            Band[] split = analyze2D(current, lo, hi);
            current = split[0];
            details.add(new DetailLevel(split[1].toMat(), split[2].toMat(), split[3].toMat()));
        }

        // Finest level was produced first
        Collections.reverse(details);
        return new CoefficientPyramid(new ApproximationLevel(current.toMat()), details, image.rows(), image.cols());
    }

    @Override
    public Mat reconstruct(CoefficientPyramid pyramid, Wavelet wavelet) {
        double[] lo = wavelet.getScalingReconstruction();
        double[] hi = wavelet.getWaveletReconstruction();

        Band current = Band.of(pyramid.getApproximation().getApproximation());
        for (DetailLevel level : pyramid.getDetails()) {
            // A reconstructed approximation can be one sample larger than the next detail level
            if (current.rows < level.rows() || current.cols < level.cols()) {
                throw new IllegalArgumentException(String.format(
                        "Approximation %dx%d is smaller than detail level %dx%d",
                        current.rows, current.cols, level.rows(), level.cols()));
            }
            current = current.crop(level.rows(), level.cols());
            current = synthesize2D(current,
                    Band.of(level.getHorizontal()),
                    Band.of(level.getVertical()),
                    Band.of(level.getDiagonal()),
                    lo, hi);
        }
        return current.crop(pyramid.getRows(), pyramid.getCols()).toMat();
    }

    /**
     * Returns {approximation, horizontal, vertical, diagonal}.
     */
    private Band[] analyze2D(Band input, double[] lo, double[] hi) {
        int outRows = analysisLength(input.rows, lo.length);
        int outCols = analysisLength(input.cols, lo.length);

        // Along the rows axis: every column becomes a low and a high column
        Band low = new Band(new double[outRows * input.cols], outRows, input.cols);
        Band high = new Band(new double[outRows * input.cols], outRows, input.cols);
        double[] column = new double[input.rows];
        double[] columnLow = new double[outRows];
        double[] columnHigh = new double[outRows];
        for (int c = 0; c < input.cols; c++) {
            input.readColumn(c, column);
            analyze(column, lo, hi, columnLow, columnHigh);
            low.writeColumn(c, columnLow);
            high.writeColumn(c, columnHigh);
        }

        // Along the columns axis
        Band approximation = new Band(new double[outRows * outCols], outRows, outCols);
        Band horizontal = new Band(new double[outRows * outCols], outRows, outCols);
        Band vertical = new Band(new double[outRows * outCols], outRows, outCols);
        Band diagonal = new Band(new double[outRows * outCols], outRows, outCols);
        double[] row = new double[input.cols];
        double[] rowLow = new double[outCols];
        double[] rowHigh = new double[outCols];
        for (int r = 0; r < outRows; r++) {
            low.readRow(r, row);
            analyze(row, lo, hi, rowLow, rowHigh);
            approximation.writeRow(r, rowLow);
            vertical.writeRow(r, rowHigh);

            high.readRow(r, row);
            analyze(row, lo, hi, rowLow, rowHigh);
            horizontal.writeRow(r, rowLow);
            diagonal.writeRow(r, rowHigh);
        }

        return new Band[]{approximation, horizontal, vertical, diagonal};
    }

    private Band synthesize2D(Band approximation, Band horizontal, Band vertical, Band diagonal,
                              double[] lo, double[] hi) {
        int inRows = approximation.rows;
        int inCols = approximation.cols;
        int outRows = synthesisLength(inRows, lo.length);
        int outCols = synthesisLength(inCols, lo.length);

        // Undo the columns axis
        Band low = new Band(new double[inRows * outCols], inRows, outCols);
        Band high = new Band(new double[inRows * outCols], inRows, outCols);
        double[] a = new double[inCols];
        double[] d = new double[inCols];
        double[] row = new double[outCols];
        for (int r = 0; r < inRows; r++) {
            approximation.readRow(r, a);
            vertical.readRow(r, d);
            synthesize(a, d, lo, hi, row);
            low.writeRow(r, row);

            horizontal.readRow(r, a);
            diagonal.readRow(r, d);
            synthesize(a, d, lo, hi, row);
            high.writeRow(r, row);
        }

        // Undo the rows axis
        Band output = new Band(new double[outRows * outCols], outRows, outCols);
        a = new double[inRows];
        d = new double[inRows];
        double[] column = new double[outRows];
        for (int c = 0; c < outCols; c++) {
            low.readColumn(c, a);
            high.readColumn(c, d);
            synthesize(a, d, lo, hi, column);
            output.writeColumn(c, column);
        }
        return output;
    }

    /**
     * Coefficients per channel produced from {@code signalLength} samples; at least one for any
     * non-empty signal.
     */
    public static int analysisLength(int signalLength, int filterLength) {
        return (signalLength + filterLength - 1) / 2;
    }

    static int synthesisLength(int coefficientCount, int filterLength) {
        return 2 * coefficientCount - filterLength + 2;
    }

    /**
     * Index into a signal of length n under half-sample symmetric extension.
     */
    static int symmetricIndex(int index, int n) {
        int period = 2 * n;
        int m = index % period;
        if (m < 0) {
            m += period;
        }
        return m >= n ? period - 1 - m : m;
    }

    /**
     * Filter and downsample by two: {@code out[o] = sum_j f[j] * x[2o + 1 - j]}.
     */
    static void analyze(double[] signal, double[] lo, double[] hi, double[] outLow, double[] outHigh) {
        int n = signal.length;
        int taps = lo.length;
        for (int o = 0; o < outLow.length; o++) {
            int center = 2 * o + 1;
            double sumLow = 0;
            double sumHigh = 0;
            for (int j = 0; j < taps; j++) {
                double v = signal[symmetricIndex(center - j, n)];
                sumLow += lo[j] * v;
                sumHigh += hi[j] * v;
            }
            outLow[o] = sumLow;
            outHigh[o] = sumHigh;
        }
    }

    /**
     * Upsample by two, filter, sum both channels and keep the central
     * {@code 2M - F + 2} samples of the full convolution.
     */
    static void synthesize(double[] low, double[] high, double[] lo, double[] hi, double[] out) {
        int taps = lo.length;
        int length = out.length;
        Arrays.fill(out, 0.0);
        for (int k = 0; k < low.length; k++) {
            for (int j = 0; j < taps; j++) {
                int m = 2 * k + j - (taps - 2);
                if (m >= 0 && m < length) {
                    out[m] += low[k] * lo[j] + high[k] * hi[j];
                }
            }
        }
    }

    /**
     * Row-major working buffer for one sub-band.
     */
    private static final class Band {
        final double[] data;
        final int rows;
        final int cols;

        Band(double[] data, int rows, int cols) {
            this.data = data;
            this.rows = rows;
            this.cols = cols;
        }

        static Band of(Mat mat) {
            return new Band(MatUtils.toDoubleArray(mat), mat.rows(), mat.cols());
        }

        Mat toMat() {
            return MatUtils.fromDoubleArray(data, rows, cols);
        }

        Band crop(int newRows, int newCols) {
            if (newRows == rows && newCols == cols) {
                return this;
            }
            double[] cropped = new double[newRows * newCols];
            for (int r = 0; r < newRows; r++) {
                System.arraycopy(data, r * cols, cropped, r * newCols, newCols);
            }
            return new Band(cropped, newRows, newCols);
        }

        void readRow(int r, double[] target) {
            System.arraycopy(data, r * cols, target, 0, cols);
        }

        void writeRow(int r, double[] source) {
            System.arraycopy(source, 0, data, r * cols, cols);
        }

        void readColumn(int c, double[] target) {
            for (int r = 0; r < rows; r++) {
                target[r] = data[r * cols + c];
            }
        }

        void writeColumn(int c, double[] source) {
            for (int r = 0; r < rows; r++) {
                data[r * cols + c] = source[r];
            }
        }
    }
}
