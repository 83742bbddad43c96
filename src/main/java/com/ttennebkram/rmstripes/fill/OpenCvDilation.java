package com.ttennebkram.rmstripes.fill;

import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

/**
 * {@link Dilation} backed by {@code Imgproc.dilate} with a 3x3 rectangular kernel.
 */
public class OpenCvDilation implements Dilation {

    @Override
    public Mat dilate(Mat region) {
        Mat kernel = Imgproc.getStructuringElement(Imgproc.MORPH_RECT, new Size(3, 3));

        Mat output = new Mat();
        // Default border value for dilate is the minimum, so the border never grows the region
        Imgproc.dilate(region, output, kernel, new Point(-1, -1), 1);

        kernel.release();
        return output;
    }
}
