package com.ttennebkram.rmstripes.processing;

import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered chain of processing steps: an optional gap-filling step that consumes the
 * mask, followed by single-input steps such as stripe removal.
 *
 * Usage:
 *   Mat out = new ProcessingPipeline()
 *       .fillWith(fillProcessor)
 *       .then(stripeProcessor)
 *       .run(image, mask);
 */
public class ProcessingPipeline {

    private static final Logger logger = LoggerFactory.getLogger(ProcessingPipeline.class);

    private DualImageProcessor fill;
    private final List<ImageProcessor> steps = new ArrayList<>();

    /**
     * Set the step that fills masked pixels. Skipped when {@link #run} gets no mask.
     */
    public ProcessingPipeline fillWith(DualImageProcessor fill) {
        this.fill = fill;
        return this;
    }

    public ProcessingPipeline then(ImageProcessor step) {
        steps.add(step);
        return this;
    }

    public List<ImageProcessor> getSteps() {
        return Collections.unmodifiableList(steps);
    }

    public boolean hasFill() {
        return fill != null;
    }

    /**
     * Run the pipeline. Intermediate results are released; the input is not modified.
     *
     * @param image input image
     * @param mask  invalid-pixel mask, or null when the image has no gaps
     * @return new output Mat the caller owns
     */
    public Mat run(Mat image, Mat mask) {
        Mat current = image;
        if (mask != null && fill != null) {
            logger.debug("Filling masked pixels");
            current = fill.process(image, mask);
        }

        for (int i = 0; i < steps.size(); i++) {
            logger.debug("Running step {} of {}", i + 1, steps.size());
            Mat next = steps.get(i).process(current);
            if (current != image && current != next) {
                current.release();
            }
            current = next;
        }

        // Never hand back the caller's Mat
        return current == image ? image.clone() : current;
    }
}
