package com.ttennebkram.rmstripes.processors;

import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.ttennebkram.rmstripes.ConfigurationException;
import com.ttennebkram.rmstripes.ShapeMismatchException;
import com.ttennebkram.rmstripes.processing.DualImageProcessor;
import com.ttennebkram.rmstripes.util.MatUtils;
import org.junit.BeforeClass;
import org.junit.Test;
import org.opencv.core.Mat;

import static org.junit.Assert.*;

public class FillMaskProcessorsTest {

    @BeforeClass
    public static void loadOpenCV() {
        nu.pattern.OpenCV.loadLocally();
    }

    @Test
    public void kernelRadiusFollowsGrowStepsUntilSet() {
        FillMaskExpandProcessor processor = new FillMaskExpandProcessor();
        assertEquals(15, processor.getEffectiveKernelRadius());
        processor.setNGrow(4);
        assertEquals(9, processor.getEffectiveKernelRadius());
        processor.setKernelRadius(6);
        assertEquals(6, processor.getEffectiveKernelRadius());
    }

    @Test
    public void unsetKernelRadiusIsNotSerialized() {
        FillMaskExpandProcessor processor = new FillMaskExpandProcessor();
        processor.setConstant(-1);
        JsonObject json = new JsonObject();
        processor.serializeProperties(json);
        assertFalse(json.has("kernelRadius"));

        FillMaskExpandProcessor restored = new FillMaskExpandProcessor();
        restored.setKernelRadius(30);
        json.add("kernelRadius", JsonNull.INSTANCE);
        restored.deserializeProperties(json);
        assertEquals(-1.0, restored.getConstant(), 0.0);
        assertEquals(30, restored.getKernelRadius().intValue());
    }

    @Test
    public void expandFillsThroughDualProcessor() {
        double[][] rows = {
                {2, 2, 2, 2},
                {2, 0, 2, 2},
                {2, 2, 2, 2}};
        boolean[] mask = new boolean[12];
        mask[5] = true;

        FillMaskExpandProcessor processor = new FillMaskExpandProcessor();
        processor.setNGrow(1);
        processor.setKernelRadius(2);
        DualImageProcessor dual = processor.createDualImageProcessor();
        double[] filled = MatUtils.toDoubleArray(dual.process(MatUtils.fromRows(rows), MatUtils.fromBooleanArray(mask, 3, 4)));
        assertEquals(2.0, filled[5], 1e-12);
    }

    @Test(expected = ConfigurationException.class)
    public void kernelRadiusNotAboveGrowStepsIsRejected() {
        FillMaskExpandProcessor processor = new FillMaskExpandProcessor();
        processor.setKernelRadius(10);
        processor.processDual(MatUtils.fromDoubleArray(new double[4], 2, 2), MatUtils.fromBooleanArray(new boolean[4], 2, 2));
    }

    @Test(expected = ShapeMismatchException.class)
    public void maskOfOtherShapeIsRejected() {
        new FillMaskNearestProcessor().processDual(MatUtils.fromDoubleArray(new double[6], 2, 3),
                MatUtils.fromBooleanArray(new boolean[6], 3, 2));
    }

    @Test(expected = UnsupportedOperationException.class)
    public void singleInputProcessIsUnsupported() {
        new FillMaskNearestProcessor().process(MatUtils.fromDoubleArray(new double[4], 2, 2));
    }

    @Test
    public void nearestFill() {
        boolean[] mask = {false, true, true, true};
        Mat image = MatUtils.fromDoubleArray(new double[]{9, 0, 0, 0}, 1, 4);
        Mat filled = new FillMaskNearestProcessor().processDual(image, MatUtils.fromBooleanArray(mask, 1, 4));
        assertArrayEquals(new double[]{9, 9, 9, 9}, MatUtils.toDoubleArray(filled), 0.0);
        assertFalse(new FillMaskNearestProcessor().hasProperties());
    }
}
