package com.ttennebkram.rmstripes.processing;

import com.ttennebkram.rmstripes.util.MatUtils;
import org.junit.BeforeClass;
import org.junit.Test;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class ProcessingPipelineTest {

    @BeforeClass
    public static void loadOpenCV() {
        nu.pattern.OpenCV.loadLocally();
    }

    @Test
    public void fillRunsBeforeSteps() {
        List<String> calls = new ArrayList<>();
        ProcessingPipeline pipeline = new ProcessingPipeline()
                .fillWith((image, mask) -> {
                    calls.add("fill");
                    return image.clone();
                })
                .then(input -> {
                    calls.add("step");
                    return addOne(input);
                });

        Mat image = MatUtils.fromDoubleArray(new double[]{1, 2}, 1, 2);
        Mat output = pipeline.run(image, MatUtils.fromBooleanArray(new boolean[2], 1, 2));

        assertEquals(2, calls.size());
        assertEquals("fill", calls.get(0));
        assertArrayEquals(new double[]{2, 3}, MatUtils.toDoubleArray(output), 0.0);
        assertArrayEquals(new double[]{1, 2}, MatUtils.toDoubleArray(image), 0.0);
    }

    @Test
    public void fillIsSkippedWithoutMask() {
        List<String> calls = new ArrayList<>();
        ProcessingPipeline pipeline = new ProcessingPipeline()
                .fillWith((image, mask) -> {
                    calls.add("fill");
                    return image.clone();
                })
                .then(ProcessingPipelineTest::addOne)
                .then(ProcessingPipelineTest::addOne);

        Mat output = pipeline.run(MatUtils.fromDoubleArray(new double[]{5}, 1, 1), null);
        assertTrue(calls.isEmpty());
        assertTrue(pipeline.hasFill());
        assertEquals(2, pipeline.getSteps().size());
        assertEquals(7.0, MatUtils.toDoubleArray(output)[0], 0.0);
    }

    @Test
    public void emptyPipelineReturnsCopy() {
        Mat image = MatUtils.fromDoubleArray(new double[]{4}, 1, 1);
        Mat output = new ProcessingPipeline().run(image, null);
        assertNotSame(image, output);
        assertEquals(4.0, MatUtils.toDoubleArray(output)[0], 0.0);
    }

    private static Mat addOne(Mat input) {
        Mat output = new Mat();
        Core.add(input, new Scalar(1), output);
        return output;
    }
}
