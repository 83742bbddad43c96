package com.ttennebkram.rmstripes.fill;

import com.ttennebkram.rmstripes.util.MatUtils;
import org.junit.BeforeClass;
import org.junit.Test;
import org.opencv.core.Mat;

import java.util.Random;

import static org.junit.Assert.assertArrayEquals;

public class OpenCvDilationTest {

    @BeforeClass
    public static void loadOpenCV() {
        nu.pattern.OpenCV.loadLocally();
    }

    @Test
    public void matchesEightConnectedReference() {
        Random random = new Random(17);
        boolean[] region = new boolean[13 * 10];
        for (int i = 0; i < region.length; i++) {
            region[i] = random.nextDouble() < 0.1;
        }
        // Touch every border
        region[0] = true;
        region[region.length - 1] = true;

        Mat input = MatUtils.fromBooleanArray(region, 13, 10);
        boolean[] expected = MatUtils.toBooleanArray(referenceDilate(input));
        boolean[] actual = MatUtils.toBooleanArray(new OpenCvDilation().dilate(input));
        assertArrayEquals(expected, actual);
    }

    @Test
    public void emptyRegionStaysEmpty() {
        Mat input = MatUtils.fromBooleanArray(new boolean[16], 4, 4);
        assertArrayEquals(new boolean[16], MatUtils.toBooleanArray(new OpenCvDilation().dilate(input)));
    }

    /**
     * Plain Java 8-connected dilation.
     */
    static Mat referenceDilate(Mat region) {
        int rows = region.rows();
        int cols = region.cols();
        boolean[] in = MatUtils.toBooleanArray(region);
        boolean[] out = new boolean[in.length];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                for (int dr = -1; dr <= 1 && !out[r * cols + c]; dr++) {
                    for (int dc = -1; dc <= 1; dc++) {
                        int rr = r + dr;
                        int cc = c + dc;
                        if (rr >= 0 && rr < rows && cc >= 0 && cc < cols && in[rr * cols + cc]) {
                            out[r * cols + c] = true;
                            break;
                        }
                    }
                }
            }
        }
        return MatUtils.fromBooleanArray(out, rows, cols);
    }
}
