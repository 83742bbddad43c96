package com.ttennebkram.rmstripes.fill;

import org.opencv.core.Mat;

/**
 * One step of binary dilation with 8-connectivity.
 * Pixels outside the image never count as set.
 */
@FunctionalInterface
public interface Dilation {

    /**
     * @param region CV_8U mask, non-zero = set (not modified)
     * @return new CV_8U mask, 255 where the region or any of its 8 neighbours is set
     */
    Mat dilate(Mat region);
}
