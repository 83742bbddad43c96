package com.ttennebkram.rmstripes.fill;

import org.junit.BeforeClass;
import org.junit.Test;

import java.util.Random;

import static org.junit.Assert.assertEquals;

public class SummedAreaTableTest {

    @BeforeClass
    public static void loadOpenCV() {
        nu.pattern.OpenCV.loadLocally();
    }

    @Test
    public void rectangleSumsMatchDirectSums() {
        int rows = 9;
        int cols = 7;
        Random random = new Random(5);
        double[] data = new double[rows * cols];
        for (int i = 0; i < data.length; i++) {
            data[i] = random.nextInt(10) - 3;
        }
        SummedAreaTable table = new SummedAreaTable(data, rows, cols);

        for (int top = 0; top < rows; top++) {
            for (int bottom = top; bottom < rows; bottom += 2) {
                for (int left = 0; left < cols; left++) {
                    for (int right = left; right < cols; right += 3) {
                        double expected = 0;
                        for (int r = top; r <= bottom; r++) {
                            for (int c = left; c <= right; c++) {
                                expected += data[r * cols + c];
                            }
                        }
                        assertEquals(expected, table.sum(top, left, bottom, right), 1e-9);
                    }
                }
            }
        }
    }
}
