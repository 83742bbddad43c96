package com.ttennebkram.rmstripes.processing;

import org.opencv.core.Mat;

/**
 * Functional interface for operations on an image and its invalid-pixel mask.
 * Used by the gap filling processors.
 */
@FunctionalInterface
public interface DualImageProcessor {
    /**
     * Process an image together with its mask and return the result.
     *
     * @param image Input image (caller owns this Mat)
     * @param mask  Mask of the same shape, non-zero = invalid (caller owns this Mat)
     * @return Processed output image (caller must release when done)
     */
    Mat process(Mat image, Mat mask);
}
