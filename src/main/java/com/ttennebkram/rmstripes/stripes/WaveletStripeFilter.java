package com.ttennebkram.rmstripes.stripes;

import com.ttennebkram.rmstripes.ConfigurationException;
import com.ttennebkram.rmstripes.util.MatUtils;
import com.ttennebkram.rmstripes.wavelet.CoefficientPyramid;
import com.ttennebkram.rmstripes.wavelet.DetailLevel;
import com.ttennebkram.rmstripes.wavelet.SymmetricWaveletTransform;
import com.ttennebkram.rmstripes.wavelet.Wavelet;
import com.ttennebkram.rmstripes.wavelet.WaveletTransform2D;
import com.ttennebkram.rmstripes.wavelet.Wavelets;
import org.opencv.core.Mat;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Combined wavelet-Fourier stripe removal.
 *
 * The image is decomposed into a multilevel wavelet pyramid with symmetric boundary
 * extension. At every level the horizontal and vertical detail sub-bands are passed
 * through a {@link CoefficientDamper}; the approximation and the diagonal details are
 * left untouched. The filtered pyramid is then reconstructed.
 *
 * Reference: B. Münch, P. Trtik, F. Marone, M. Stampanoni, "Stripe and ring artifact
 * removal with combined wavelet-Fourier filtering", Optics Express 17(10), 2009.
 */
public class WaveletStripeFilter {

    private final WaveletTransform2D transform;
    private final CoefficientDamper damper;
    private final ExecutorService executor;

    public WaveletStripeFilter() {
        this(new SymmetricWaveletTransform(), new CoefficientDamper(), null);
    }

    /**
     * @param executor when non-null, the two damped sub-bands of every level are
     *                 processed on it concurrently; results are identical to the serial path
     */
    public WaveletStripeFilter(WaveletTransform2D transform, CoefficientDamper damper, ExecutorService executor) {
        this.transform = transform;
        this.damper = damper;
        this.executor = executor;
    }

    /**
     * Remove stripes from a single-band image.
     *
     * @param image              input image, any depth (not modified)
     * @param decompositionLevel number of wavelet levels
     * @param waveletName        registered wavelet name, see {@link Wavelets#names()}
     * @param sigma              width of the Gaussian notch applied to the detail spectra
     * @return new CV_64F image of the same shape
     * @throws ConfigurationException for an unknown wavelet, a non-positive sigma or a
     *                                level the image cannot support
     */
    public Mat removeStripes(Mat image, int decompositionLevel, String waveletName, double sigma) {
        MatUtils.requireSingleChannel(image);
        Wavelet wavelet = Wavelets.get(waveletName);
        CoefficientDamper.validateSigma(sigma);
        validateLevel(decompositionLevel, image.rows(), image.cols(), wavelet);

        CoefficientPyramid pyramid = transform.decompose(image, wavelet, decompositionLevel);
        CoefficientPyramid damped = null;
        try {
            damped = dampDetails(pyramid, sigma);
            return transform.reconstruct(damped, wavelet);
        } finally {
            pyramid.release();
            if (damped != null) {
                damped.release();
            }
        }
    }

    private CoefficientPyramid dampDetails(CoefficientPyramid pyramid, double sigma) {
        if (executor == null) {
            return pyramid.mapDetails(level -> new DetailLevel(
                    damper.damp(level.getHorizontal(), sigma),
                    damper.damp(level.getVertical(), sigma),
                    level.getDiagonal()));
        }

        List<Future<Mat>> horizontal = new ArrayList<>();
        List<Future<Mat>> vertical = new ArrayList<>();
        for (DetailLevel level : pyramid.getDetails()) {
            horizontal.add(executor.submit(() -> damper.damp(level.getHorizontal(), sigma)));
            vertical.add(executor.submit(() -> damper.damp(level.getVertical(), sigma)));
        }

        List<Mat> collected = new ArrayList<>();
        boolean complete = false;
        try {
            CoefficientPyramid damped = pyramid;
            for (int i = 0; i < horizontal.size(); i++) {
                Mat h = await(horizontal.get(i));
                collected.add(h);
                Mat v = await(vertical.get(i));
                collected.add(v);
                damped = damped.withDetail(i, new DetailLevel(h, v, pyramid.getDetails().get(i).getDiagonal()));
            }
            complete = true;
            return damped;
        } finally {
            if (!complete) {
                for (int i = 0; i < horizontal.size(); i++) {
                    horizontal.get(i).cancel(true);
                    vertical.get(i).cancel(true);
                }
                for (Mat mat : collected) {
                    mat.release();
                }
            }
        }
    }

    private static Mat await(Future<Mat> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while damping coefficients", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Damping failed", cause);
        }
    }

    /**
     * @throws ConfigurationException if the level is not positive or a sub-band of the
     *                                decomposition would have fewer than one coefficient
     */
    public static void validateLevel(int decompositionLevel, int rows, int cols, Wavelet wavelet) {
        if (decompositionLevel < 1) {
            throw new ConfigurationException("Decomposition level must be at least 1, got " + decompositionLevel);
        }
        int taps = wavelet.getFilterLength();
        int bandRows = rows;
        int bandCols = cols;
        for (int level = 1; level <= decompositionLevel; level++) {
            bandRows = SymmetricWaveletTransform.analysisLength(bandRows, taps);
            bandCols = SymmetricWaveletTransform.analysisLength(bandCols, taps);
            if (bandRows < 1 || bandCols < 1) {
                throw new ConfigurationException(String.format(
                        "Decomposition level %d is too large for a %dx%d image: level %d sub-bands would be %dx%d",
                        decompositionLevel, rows, cols, level, bandRows, bandCols));
            }
        }
    }
}
