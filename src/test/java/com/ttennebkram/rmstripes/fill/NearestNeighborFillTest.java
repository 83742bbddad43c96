package com.ttennebkram.rmstripes.fill;

import com.ttennebkram.rmstripes.ConfigurationException;
import com.ttennebkram.rmstripes.util.MatUtils;
import org.junit.BeforeClass;
import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.assertEquals;

public class NearestNeighborFillTest {

    @BeforeClass
    public static void loadOpenCV() {
        nu.pattern.OpenCV.loadLocally();
    }

    @Test
    public void maskedPixelsCopyNearestValidValue() {
        double[] values = new double[25];
        boolean[] mask = new boolean[25];
        Arrays.fill(mask, true);
        values[0] = 7;
        mask[0] = false;
        values[24] = 3;
        mask[24] = false;

        MaskedImage image = new MaskedImage(MatUtils.fromDoubleArray(values, 5, 5),
                MatUtils.fromBooleanArray(mask, 5, 5));
        double[][] filled = MatUtils.toRows(new NearestNeighborFill().fill(image));

        assertEquals(7.0, filled[0][0], 0.0);
        assertEquals(7.0, filled[0][1], 0.0);
        assertEquals(7.0, filled[1][1], 0.0);
        assertEquals(3.0, filled[3][3], 0.0);
        assertEquals(3.0, filled[4][3], 0.0);
        assertEquals(3.0, filled[4][4], 0.0);
    }

    @Test
    public void validPixelsAreKept() {
        double[][] rows = {{1, 2, 3}, {4, 5, 6}};
        boolean[] mask = {false, true, true, false, false, false};
        MaskedImage image = new MaskedImage(MatUtils.fromRows(rows), MatUtils.fromBooleanArray(mask, 2, 3));
        double[][] filled = MatUtils.toRows(new NearestNeighborFill().fill(image));

        assertEquals(1.0, filled[0][0], 0.0);
        assertEquals(4.0, filled[1][0], 0.0);
        assertEquals(6.0, filled[1][2], 0.0);
        // Directly below is closer than the diagonal neighbour
        assertEquals(6.0, filled[0][2], 0.0);
    }

    @Test(expected = ConfigurationException.class)
    public void fullyMaskedImageIsRejected() {
        boolean[] mask = new boolean[4];
        Arrays.fill(mask, true);
        new NearestNeighborFill().fill(new MaskedImage(MatUtils.fromDoubleArray(new double[4], 2, 2),
                MatUtils.fromBooleanArray(mask, 2, 2)));
    }
}
