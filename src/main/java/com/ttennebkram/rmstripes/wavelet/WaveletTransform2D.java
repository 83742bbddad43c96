package com.ttennebkram.rmstripes.wavelet;

import org.opencv.core.Mat;

/**
 * Multilevel separable 2D discrete wavelet transform.
 * Implementations must satisfy {@code reconstruct(decompose(x, w, n), w) == x}
 * up to floating point rounding.
 */
public interface WaveletTransform2D {

    /**
     * Decompose a single-channel image into exactly {@code levels} detail levels.
     *
     * @param image  input image (not modified)
     * @param wavelet filter bank
     * @param levels number of decomposition levels, at least 1
     * @return new pyramid the caller owns
     */
    CoefficientPyramid decompose(Mat image, Wavelet wavelet, int levels);

    /**
     * Inverse of {@link #decompose}. The result has the shape recorded in the pyramid
     * and depth CV_64F.
     */
    Mat reconstruct(CoefficientPyramid pyramid, Wavelet wavelet);
}
