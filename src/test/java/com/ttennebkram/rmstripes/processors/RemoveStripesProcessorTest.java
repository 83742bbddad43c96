package com.ttennebkram.rmstripes.processors;

import com.google.gson.JsonObject;
import com.ttennebkram.rmstripes.ConfigurationException;
import com.ttennebkram.rmstripes.util.MatUtils;
import org.junit.BeforeClass;
import org.junit.Test;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

import static org.junit.Assert.*;

public class RemoveStripesProcessorTest {

    @BeforeClass
    public static void loadOpenCV() {
        nu.pattern.OpenCV.loadLocally();
    }

    @Test
    public void defaults() {
        RemoveStripesProcessor processor = new RemoveStripesProcessor();
        assertEquals("db10", processor.getWavelet());
        assertEquals(6, processor.getDecompositionLevel());
        assertEquals(10.0, processor.getSigma(), 0.0);
        assertFalse(processor.isParallel());
    }

    @Test
    public void defaultsProcessA64PixelImage() {
        Mat image = new Mat(64, 64, CvType.CV_64F);
        for (int r = 0; r < 64; r++) {
            for (int c = 0; c < 64; c++) {
                image.put(r, c, Math.sin(r * 0.3) + (c % 5 == 0 ? 2 : 0));
            }
        }
        Mat output = new RemoveStripesProcessor().process(image);
        assertEquals(64, output.rows());
        assertEquals(64, output.cols());
    }

    @Test
    public void propertiesSurviveJson() {
        RemoveStripesProcessor processor = new RemoveStripesProcessor();
        processor.setWavelet("sym8");
        processor.setDecompositionLevel(3);
        processor.setSigma(2.5);
        processor.setParallel(true);

        JsonObject json = new JsonObject();
        processor.serializeProperties(json);
        assertEquals("sym8", json.get("wavelet").getAsString());
        assertEquals(3, json.get("level").getAsInt());

        RemoveStripesProcessor restored = new RemoveStripesProcessor();
        restored.deserializeProperties(json);
        assertEquals("sym8", restored.getWavelet());
        assertEquals(3, restored.getDecompositionLevel());
        assertEquals(2.5, restored.getSigma(), 0.0);
        assertTrue(restored.isParallel());
    }

    @Test
    public void missingKeysKeepCurrentValues() {
        RemoveStripesProcessor processor = new RemoveStripesProcessor();
        processor.setSigma(4);
        JsonObject json = new JsonObject();
        json.addProperty("level", 2);
        processor.deserializeProperties(json);
        assertEquals(2, processor.getDecompositionLevel());
        assertEquals(4.0, processor.getSigma(), 0.0);
        assertEquals("db10", processor.getWavelet());
    }

    @Test(expected = ConfigurationException.class)
    public void nestedPropertyIsRejected() {
        JsonObject json = new JsonObject();
        json.add("sigma", new JsonObject());
        new RemoveStripesProcessor().deserializeProperties(json);
    }

    @Test
    public void defaultsProcessA10PixelImage() {
        Mat output = new RemoveStripesProcessor().process(MatUtils.fromDoubleArray(new double[100], 10, 10));
        assertEquals(10, output.rows());
        assertEquals(10, output.cols());
    }

    @Test(expected = ConfigurationException.class)
    public void emptyInputIsRejected() {
        new RemoveStripesProcessor().process(new Mat());
    }
}
