package com.ttennebkram.rmstripes.processors;

import com.google.gson.JsonObject;
import com.ttennebkram.rmstripes.fill.MaskedImage;
import com.ttennebkram.rmstripes.fill.NearestNeighborFill;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fill Mask Nearest processor.
 * Copies the value of the nearest valid pixel into every masked pixel.
 */
@ProcessorInfo(nodeType = "FillMaskNearest", displayName = "Fill Mask (Nearest)", category = "Fill", dualInput = true)
public class FillMaskNearestProcessor extends RasterDualInputProcessor {

    private static final Logger logger = LoggerFactory.getLogger(FillMaskNearestProcessor.class);

    @Override
    public String getNodeType() {
        return "FillMaskNearest";
    }

    @Override
    public String getCategory() {
        return "Fill";
    }

    @Override
    public String getDescription() {
        return "Fill masked pixels with the nearest valid value\n"
                + "Imgproc.distanceTransformWithLabels(src, dst, labels, DIST_L2, 5, DIST_LABEL_PIXEL)";
    }

    @Override
    public Mat processDual(Mat image, Mat mask) {
        requireInputs(image, mask);
        MaskedImage maskedImage = new MaskedImage(image, mask);
        logger.debug("Nearest-neighbour fill of {} masked pixels", maskedImage.maskedCount());
        return new NearestNeighborFill().fill(maskedImage);
    }

    @Override
    public boolean hasProperties() {
        return false;
    }

    @Override
    public void serializeProperties(JsonObject json) {
        // No properties
    }

    @Override
    public void deserializeProperties(JsonObject json) {
        // No properties
    }
}
