package com.ttennebkram.rmstripes.processors;

import com.google.gson.JsonObject;
import com.ttennebkram.rmstripes.fill.MaskGrowthEngine;
import com.ttennebkram.rmstripes.fill.MaskedImage;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fill Mask Expand processor.
 * Grows the valid region into the mask and blends local means towards a constant.
 */
@ProcessorInfo(nodeType = "FillMaskExpand", displayName = "Fill Mask (Expand)", category = "Fill", dualInput = true)
public class FillMaskExpandProcessor extends RasterDualInputProcessor {

    private static final Logger logger = LoggerFactory.getLogger(FillMaskExpandProcessor.class);

    public static final double DEFAULT_CONSTANT = 0.0;
    public static final int DEFAULT_GROW = 10;
    public static final int KERNEL_MARGIN = 5;

    // Properties with defaults; a null kernel radius follows nGrow
    private double constant = DEFAULT_CONSTANT;
    private int nGrow = DEFAULT_GROW;
    private Integer kernelRadius = null;

    @Override
    public String getNodeType() {
        return "FillMaskExpand";
    }

    @Override
    public String getCategory() {
        return "Fill";
    }

    @Override
    public String getDescription() {
        return "Fill masked pixels by growing the valid region\n"
                + "fill(maskedImage, constant, nGrow, kernelRadius)";
    }

    @Override
    public Mat processDual(Mat image, Mat mask) {
        requireInputs(image, mask);
        int radius = getEffectiveKernelRadius();
        MaskGrowthEngine.validate(nGrow, radius);

        MaskedImage maskedImage = new MaskedImage(image, mask);
        logger.debug("Filling {} masked pixels: constant={}, nGrow={}, kernelRadius={}",
                maskedImage.maskedCount(), constant, nGrow, radius);
        long start = System.currentTimeMillis();

        Mat output = new MaskGrowthEngine().fill(maskedImage, constant, nGrow, radius);

        logger.debug("Mask growth fill took {} ms", System.currentTimeMillis() - start);
        return output;
    }

    public double getConstant() {
        return constant;
    }

    public void setConstant(double constant) {
        this.constant = constant;
    }

    public int getNGrow() {
        return nGrow;
    }

    public void setNGrow(int nGrow) {
        this.nGrow = nGrow;
    }

    /**
     * @return the configured radius, or null when it follows nGrow
     */
    public Integer getKernelRadius() {
        return kernelRadius;
    }

    public void setKernelRadius(Integer kernelRadius) {
        this.kernelRadius = kernelRadius;
    }

    public int getEffectiveKernelRadius() {
        return kernelRadius != null ? kernelRadius : nGrow + KERNEL_MARGIN;
    }

    @Override
    public void serializeProperties(JsonObject json) {
        json.addProperty("constant", constant);
        json.addProperty("nGrow", nGrow);
        if (kernelRadius != null) {
            json.addProperty("kernelRadius", kernelRadius);
        }
    }

    @Override
    public void deserializeProperties(JsonObject json) {
        constant = getJsonDouble(json, "constant", constant);
        nGrow = getJsonInt(json, "nGrow", nGrow);
        kernelRadius = getJsonInteger(json, "kernelRadius", kernelRadius);
    }
}
