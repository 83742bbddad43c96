package com.ttennebkram.rmstripes.wavelet;

import com.ttennebkram.rmstripes.util.MatUtils;
import org.junit.BeforeClass;
import org.junit.Test;
import org.opencv.core.Mat;

import java.util.Arrays;
import java.util.Random;

import static org.junit.Assert.*;

public class SymmetricWaveletTransformTest {

    private static final double H = Math.sqrt(0.5);

    private final SymmetricWaveletTransform transform = new SymmetricWaveletTransform();

    @BeforeClass
    public static void loadOpenCV() {
        nu.pattern.OpenCV.loadLocally();
    }

    @Test
    public void coefficientCounts() {
        assertEquals(5, SymmetricWaveletTransform.analysisLength(10, 2));
        assertEquals(14, SymmetricWaveletTransform.analysisLength(10, 20));
        assertEquals(6, SymmetricWaveletTransform.analysisLength(11, 2));
        assertEquals(10, SymmetricWaveletTransform.synthesisLength(5, 2));
        assertEquals(10, SymmetricWaveletTransform.synthesisLength(14, 20));
    }

    @Test
    public void symmetricExtensionMirrorsAroundBothEdges() {
        assertEquals(0, SymmetricWaveletTransform.symmetricIndex(-1, 5));
        assertEquals(1, SymmetricWaveletTransform.symmetricIndex(-2, 5));
        assertEquals(4, SymmetricWaveletTransform.symmetricIndex(5, 5));
        assertEquals(3, SymmetricWaveletTransform.symmetricIndex(6, 5));
        assertEquals(0, SymmetricWaveletTransform.symmetricIndex(10, 5));
        assertEquals(0, SymmetricWaveletTransform.symmetricIndex(7, 1));
    }

    @Test
    public void haarAnalysisOfShortSignal() {
        double[] low = new double[2];
        double[] high = new double[2];
        Wavelet haar = Wavelets.get("haar");
        SymmetricWaveletTransform.analyze(new double[]{1, 2, 3, 4},
                haar.getScalingDecomposition(), haar.getWaveletDecomposition(), low, high);
        assertArrayEquals(new double[]{3 * H, 7 * H}, low, 1e-12);
        assertArrayEquals(new double[]{-H, -H}, high, 1e-12);
    }

    @Test
    public void pyramidIsOrderedCoarsestFirst() {
        Mat image = randomImage(40, 30, 1);
        CoefficientPyramid pyramid = transform.decompose(image, Wavelets.get("haar"), 3);

        assertEquals(3, pyramid.getDecompositionLevel());
        assertEquals(4, pyramid.levels().size());
        assertTrue(pyramid.levels().get(0).isApproximation());
        assertTrue(pyramid.levels().get(1).isDetail());

        // 40x30 -> 20x15 -> 10x8 -> 5x4
        assertEquals(5, pyramid.getApproximation().getApproximation().rows());
        assertEquals(4, pyramid.getApproximation().getApproximation().cols());
        assertEquals(5, pyramid.getDetails().get(0).rows());
        assertEquals(20, pyramid.getDetails().get(2).rows());
        assertEquals(15, pyramid.getDetails().get(2).cols());

        pyramid.release();
        image.release();
    }

    @Test
    public void reconstructionRecoversEveryRegisteredBasis() {
        Mat image = randomImage(37, 23, 7);
        double[] expected = MatUtils.toDoubleArray(image);
        for (String name : Wavelets.names()) {
            Wavelet wavelet = Wavelets.get(name);
            CoefficientPyramid pyramid = transform.decompose(image, wavelet, 2);
            Mat restored = transform.reconstruct(pyramid, wavelet);

            assertEquals(name, 37, restored.rows());
            assertEquals(name, 23, restored.cols());
            assertArrayEquals(name, expected, MatUtils.toDoubleArray(restored), 1e-9);

            restored.release();
            pyramid.release();
        }
        image.release();
    }

    @Test
    public void reconstructionOfDeepOddDecomposition() {
        Mat image = randomImage(13, 17, 3);
        Wavelet wavelet = Wavelets.get("sym5");
        CoefficientPyramid pyramid = transform.decompose(image, wavelet, 4);
        Mat restored = transform.reconstruct(pyramid, wavelet);
        assertArrayEquals(MatUtils.toDoubleArray(image), MatUtils.toDoubleArray(restored), 1e-9);
    }

    @Test
    public void constantImageHasNoDetail() {
        double[] data = new double[12 * 9];
        Arrays.fill(data, 4.5);
        Mat image = MatUtils.fromDoubleArray(data, 12, 9);
        Wavelet wavelet = Wavelets.get("db4");

        CoefficientPyramid pyramid = transform.decompose(image, wavelet, 2);
        for (DetailLevel level : pyramid.getDetails()) {
            for (Mat band : level.bands()) {
                for (double v : MatUtils.toDoubleArray(band)) {
                    assertEquals(0.0, v, 1e-9);
                }
            }
        }
        Mat restored = transform.reconstruct(pyramid, wavelet);
        assertArrayEquals(data, MatUtils.toDoubleArray(restored), 1e-9);
    }

    @Test(expected = IllegalArgumentException.class)
    public void approximationSmallerThanDetailIsRejected() {
        Wavelet haar = Wavelets.get("haar");
        CoefficientPyramid pyramid = transform.decompose(randomImage(16, 16, 1), haar, 2);
        // Coarsest detail level is 4x4
        CoefficientPyramid broken = new CoefficientPyramid(
                new ApproximationLevel(MatUtils.fromDoubleArray(new double[4], 2, 2)),
                pyramid.getDetails(), 16, 16);
        transform.reconstruct(broken, haar);
    }

    static Mat randomImage(int rows, int cols, long seed) {
        Random random = new Random(seed);
        double[] data = new double[rows * cols];
        for (int i = 0; i < data.length; i++) {
            data[i] = random.nextDouble() * 100 - 50;
        }
        return MatUtils.fromDoubleArray(data, rows, cols);
    }
}
