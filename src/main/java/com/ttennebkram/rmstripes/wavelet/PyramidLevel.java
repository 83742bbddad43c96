package com.ttennebkram.rmstripes.wavelet;

import org.opencv.core.Mat;

import java.util.List;

/**
 * One level of a {@link CoefficientPyramid}: either the coarse approximation
 * or a triple of oriented detail sub-bands.
 */
public abstract class PyramidLevel {

    PyramidLevel() {
    }

    /**
     * The sub-bands of this level, in a fixed order.
     */
    public abstract List<Mat> bands();

    public boolean isApproximation() {
        return false;
    }

    public boolean isDetail() {
        return false;
    }

    public void release() {
        for (Mat band : bands()) {
            band.release();
        }
    }
}
