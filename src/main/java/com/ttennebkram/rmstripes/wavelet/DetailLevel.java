package com.ttennebkram.rmstripes.wavelet;

import org.opencv.core.Mat;

import java.util.Arrays;
import java.util.List;

/**
 * Detail sub-bands of one decomposition level.
 * Horizontal is high-pass along the rows axis, vertical is high-pass along
 * the columns axis, diagonal is high-pass along both. All three share one shape.
 */
public final class DetailLevel extends PyramidLevel {

    private final Mat horizontal;
    private final Mat vertical;
    private final Mat diagonal;

    public DetailLevel(Mat horizontal, Mat vertical, Mat diagonal) {
        if (horizontal.rows() != vertical.rows() || horizontal.cols() != vertical.cols()
                || horizontal.rows() != diagonal.rows() || horizontal.cols() != diagonal.cols()) {
            throw new IllegalArgumentException("Detail sub-bands of one level must share a shape");
        }
        this.horizontal = horizontal;
        this.vertical = vertical;
        this.diagonal = diagonal;
    }

    public Mat getHorizontal() {
        return horizontal;
    }

    public Mat getVertical() {
        return vertical;
    }

    public Mat getDiagonal() {
        return diagonal;
    }

    public int rows() {
        return horizontal.rows();
    }

    public int cols() {
        return horizontal.cols();
    }

    @Override
    public List<Mat> bands() {
        return Arrays.asList(horizontal, vertical, diagonal);
    }

    @Override
    public boolean isDetail() {
        return true;
    }
}
