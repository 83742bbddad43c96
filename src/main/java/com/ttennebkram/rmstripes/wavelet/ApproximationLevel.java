package com.ttennebkram.rmstripes.wavelet;

import org.opencv.core.Mat;

import java.util.Collections;
import java.util.List;

/**
 * Coarsest low-pass sub-band of a pyramid.
 */
public final class ApproximationLevel extends PyramidLevel {

    private final Mat approximation;

    public ApproximationLevel(Mat approximation) {
        this.approximation = approximation;
    }

    public Mat getApproximation() {
        return approximation;
    }

    @Override
    public List<Mat> bands() {
        return Collections.singletonList(approximation);
    }

    @Override
    public boolean isApproximation() {
        return true;
    }
}
