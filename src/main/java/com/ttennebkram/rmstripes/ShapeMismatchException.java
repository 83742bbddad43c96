package com.ttennebkram.rmstripes;

import org.opencv.core.Mat;

/**
 * Thrown when an image and its companion mask do not have the same shape.
 */
public class ShapeMismatchException extends IllegalArgumentException {

    public ShapeMismatchException(String message) {
        super(message);
    }

    public static ShapeMismatchException of(Mat image, Mat mask) {
        return new ShapeMismatchException(String.format(
                "Image is %dx%d but mask is %dx%d",
                image.rows(), image.cols(), mask.rows(), mask.cols()));
    }
}
