package com.ttennebkram.rmstripes.stripes;

import com.ttennebkram.rmstripes.ConfigurationException;
import com.ttennebkram.rmstripes.util.MatUtils;
import com.ttennebkram.rmstripes.wavelet.SymmetricWaveletTransform;
import com.ttennebkram.rmstripes.wavelet.Wavelets;
import org.junit.BeforeClass;
import org.junit.Test;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.Assert.*;

public class WaveletStripeFilterTest {

    private final WaveletStripeFilter filter = new WaveletStripeFilter();

    @BeforeClass
    public static void loadOpenCV() {
        nu.pattern.OpenCV.loadLocally();
    }

    @Test
    public void singleVerticalLineIsRemoved() {
        double[][] rows = new double[10][10];
        for (double[] row : rows) {
            row[5] = 1.0;
        }
        Mat output = filter.removeStripes(MatUtils.fromRows(rows), 4, "haar", 10);

        assertEquals(10, output.rows());
        assertEquals(10, output.cols());
        for (double v : MatUtils.toDoubleArray(output)) {
            assertTrue("|" + v + "| >= 0.1", Math.abs(v) < 0.1);
        }
    }

    @Test
    public void periodicStripesAreAttenuated() {
        int n = 32;
        double[][] base = new double[n][n];
        double[][] striped = new double[n][n];
        for (int r = 0; r < n; r++) {
            for (int c = 0; c < n; c++) {
                base[r][c] = Math.sin(r / 5.0) * Math.sin(c / 9.0);
                striped[r][c] = base[r][c] + (c % 8 == 3 ? 1.0 : 0.0);
            }
        }
        double[][] output = MatUtils.toRows(filter.removeStripes(MatUtils.fromRows(striped), 3, "db4", 2));

        double before = rms(striped, base);
        double after = rms(output, base);
        assertTrue("residual " + after + " vs stripes " + before, after < 0.5 * before);
    }

    @Test
    public void zerosStayZero() {
        Mat zeros = Mat.zeros(32, 32, CvType.CV_64F);
        Mat output = filter.removeStripes(zeros, 3, "db10", 10);
        for (double v : MatUtils.toDoubleArray(output)) {
            assertEquals(0.0, v, 0.0);
        }
    }

    @Test
    public void oddShapeIsPreserved() {
        Mat image = randomImage(33, 47, 2);
        Mat output = filter.removeStripes(image, 3, "db4", 5);
        assertEquals(33, output.rows());
        assertEquals(47, output.cols());
        assertEquals(CvType.CV_64F, output.type());
    }

    @Test
    public void integerInputIsAccepted() {
        Mat image = new Mat(16, 16, CvType.CV_16UC1);
        image.setTo(new Scalar(1000));
        Mat output = filter.removeStripes(image, 2, "sym8", 10);
        // A constant image is a pure DC term in every column of every detail band
        for (double v : MatUtils.toDoubleArray(output)) {
            assertEquals(1000.0, v, 1e-6);
        }
    }

    @Test
    public void parallelDampingMatchesSerial() {
        Mat image = randomImage(40, 36, 9);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            WaveletStripeFilter parallel = new WaveletStripeFilter(
                    new SymmetricWaveletTransform(), new CoefficientDamper(), executor);
            double[] expected = MatUtils.toDoubleArray(filter.removeStripes(image, 3, "sym5", 4));
            double[] actual = MatUtils.toDoubleArray(parallel.removeStripes(image, 3, "sym5", 4));
            assertArrayEquals(expected, actual, 0.0);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void parallelFailureReleasesDampedBands() {
        // haar on 40x36 at level 3: coarsest details are 5 rows, the next level 10
        List<Mat> coarsest = Collections.synchronizedList(new ArrayList<>());
        CoefficientDamper failing = new CoefficientDamper() {
            @Override
            public Mat damp(Mat coefficients, double sigma) {
                if (coefficients.rows() == 10) {
                    throw new IllegalStateException("damping failed at level 2");
                }
                Mat result = super.damp(coefficients, sigma);
                if (coefficients.rows() == 5) {
                    coarsest.add(result);
                }
                return result;
            }
        };

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            WaveletStripeFilter parallel = new WaveletStripeFilter(new SymmetricWaveletTransform(), failing, executor);
            try {
                parallel.removeStripes(randomImage(40, 36, 5), 3, "haar", 4);
                fail("expected the damping failure to propagate");
            } catch (IllegalStateException e) {
                assertEquals("damping failed at level 2", e.getMessage());
            }
            assertEquals(2, coarsest.size());
            for (Mat band : coarsest) {
                assertTrue(band.empty());
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void inputIsNotModified() {
        Mat image = randomImage(20, 20, 4);
        double[] before = MatUtils.toDoubleArray(image);
        filter.removeStripes(image, 2, "db2", 3);
        assertArrayEquals(before, MatUtils.toDoubleArray(image), 0.0);
    }

    @Test(expected = ConfigurationException.class)
    public void unknownWaveletIsRejected() {
        filter.removeStripes(randomImage(16, 16, 1), 2, "nope", 10);
    }

    @Test(expected = ConfigurationException.class)
    public void nonPositiveSigmaIsRejected() {
        filter.removeStripes(randomImage(16, 16, 1), 2, "haar", -1);
    }

    @Test(expected = ConfigurationException.class)
    public void zeroLevelIsRejected() {
        filter.removeStripes(randomImage(16, 16, 1), 0, "haar", 10);
    }

    @Test
    public void defaultLevelOnSmallImageKeepsConstant() {
        // db10 at level 6 on 10x10 runs entirely in the boundary extension
        Mat image = new Mat(10, 10, CvType.CV_64F);
        image.setTo(new Scalar(7.5));
        Mat output = filter.removeStripes(image, 6, "db10", 10);

        assertEquals(10, output.rows());
        assertEquals(10, output.cols());
        for (double v : MatUtils.toDoubleArray(output)) {
            assertEquals(7.5, v, 1e-6);
        }
    }

    @Test
    public void singleRowImageIsAccepted() {
        Mat output = filter.removeStripes(randomImage(1, 16, 3), 3, "haar", 10);
        assertEquals(1, output.rows());
        assertEquals(16, output.cols());
    }

    @Test(expected = ConfigurationException.class)
    public void multiChannelInputIsRejected() {
        filter.removeStripes(new Mat(8, 8, CvType.CV_8UC3), 1, "haar", 10);
    }

    @Test
    public void validateLevelAcceptsAnyDepthOnNonEmptyImage() {
        WaveletStripeFilter.validateLevel(12, 10, 12, Wavelets.get("db10"));
        WaveletStripeFilter.validateLevel(5, 1, 5, Wavelets.get("haar"));
    }

    @Test(expected = ConfigurationException.class)
    public void validateLevelRejectsEmptyImage() {
        WaveletStripeFilter.validateLevel(1, 0, 5, Wavelets.get("haar"));
    }

    private static double rms(double[][] a, double[][] b) {
        double sum = 0;
        int count = 0;
        for (int r = 0; r < a.length; r++) {
            for (int c = 0; c < a[r].length; c++) {
                double d = a[r][c] - b[r][c];
                sum += d * d;
                count++;
            }
        }
        return Math.sqrt(sum / count);
    }

    private static Mat randomImage(int rows, int cols, long seed) {
        Random random = new Random(seed);
        double[] data = new double[rows * cols];
        for (int i = 0; i < data.length; i++) {
            data[i] = random.nextDouble();
        }
        return MatUtils.fromDoubleArray(data, rows, cols);
    }
}
