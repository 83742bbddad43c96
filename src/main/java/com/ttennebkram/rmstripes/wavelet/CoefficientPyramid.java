package com.ttennebkram.rmstripes.wavelet;

import org.opencv.core.Mat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Result of a multilevel 2D decomposition.
 *
 * Index 0 holds the {@link ApproximationLevel}; indices 1..n hold {@link DetailLevel}s
 * ordered from the coarsest to the finest. The shape of the decomposed image is kept
 * so reconstruction can return exactly that shape.
 */
public final class CoefficientPyramid {

    private final ApproximationLevel approximation;
    private final List<DetailLevel> details;
    private final int rows;
    private final int cols;

    public CoefficientPyramid(ApproximationLevel approximation, List<DetailLevel> details, int rows, int cols) {
        this.approximation = approximation;
        this.details = Collections.unmodifiableList(new ArrayList<>(details));
        this.rows = rows;
        this.cols = cols;
    }

    public ApproximationLevel getApproximation() {
        return approximation;
    }

    /**
     * Detail levels, coarsest first.
     */
    public List<DetailLevel> getDetails() {
        return details;
    }

    /**
     * All levels in order: approximation then details, coarsest first.
     */
    public List<PyramidLevel> levels() {
        List<PyramidLevel> levels = new ArrayList<>(details.size() + 1);
        levels.add(approximation);
        levels.addAll(details);
        return levels;
    }

    public int getDecompositionLevel() {
        return details.size();
    }

    public int getRows() {
        return rows;
    }

    public int getCols() {
        return cols;
    }

    /**
     * New pyramid sharing the approximation, with every detail level replaced by
     * the operator's result. Sub-bands the operator returns unchanged stay shared.
     */
    public CoefficientPyramid mapDetails(UnaryOperator<DetailLevel> operator) {
        List<DetailLevel> mapped = new ArrayList<>(details.size());
        for (DetailLevel level : details) {
            mapped.add(operator.apply(level));
        }
        return new CoefficientPyramid(approximation, mapped, rows, cols);
    }

    /**
     * New pyramid with the detail level at {@code index} (0 = coarsest) replaced.
     */
    public CoefficientPyramid withDetail(int index, DetailLevel level) {
        List<DetailLevel> replaced = new ArrayList<>(details);
        replaced.set(index, level);
        return new CoefficientPyramid(approximation, replaced, rows, cols);
    }

    /**
     * Release the native buffers of every sub-band.
     */
    public void release() {
        for (PyramidLevel level : levels()) {
            for (Mat band : level.bands()) {
                band.release();
            }
        }
    }
}
