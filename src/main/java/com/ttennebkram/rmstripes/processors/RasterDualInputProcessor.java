package com.ttennebkram.rmstripes.processors;

import com.ttennebkram.rmstripes.ShapeMismatchException;
import com.ttennebkram.rmstripes.processing.DualImageProcessor;
import com.ttennebkram.rmstripes.util.MatUtils;
import org.opencv.core.Mat;

/**
 * Base class for processors that consume an image together with its invalid-pixel mask.
 * Extends RasterProcessorBase with dual-input specific functionality.
 */
public abstract class RasterDualInputProcessor extends RasterProcessorBase {

    /**
     * Process an image and its mask.
     *
     * @param image Input image
     * @param mask  Mask of the same shape, non-zero = invalid
     * @return Processed output image
     */
    public abstract Mat processDual(Mat image, Mat mask);

    /**
     * Single-input process() is not used for dual-input processors.
     * Throws UnsupportedOperationException.
     */
    @Override
    public Mat process(Mat input) {
        throw new UnsupportedOperationException(
                "Dual-input processors must use processDual(Mat, Mat)");
    }

    /**
     * Create a DualImageProcessor lambda for use in a ProcessingPipeline.
     */
    public DualImageProcessor createDualImageProcessor() {
        return this::processDual;
    }

    /**
     * Helper to check both inputs before processing.
     * Unlike blending two images, a mask is never resized to fit.
     */
    protected void requireInputs(Mat image, Mat mask) {
        requireInput(image);
        requireInput(mask);
        if (!MatUtils.sameShape(image, mask)) {
            throw ShapeMismatchException.of(image, mask);
        }
    }
}
