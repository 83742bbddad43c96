package com.ttennebkram.rmstripes.wavelet;

/**
 * A two-channel filter bank: low/high pass filters for decomposition and for reconstruction.
 * Filters are stored in convolution order, all four with the same even length.
 */
public final class Wavelet {

    private final String name;
    private final double[] scalingDecomposition;
    private final double[] waveletDecomposition;
    private final double[] scalingReconstruction;
    private final double[] waveletReconstruction;

    public Wavelet(String name,
                   double[] scalingDecomposition, double[] waveletDecomposition,
                   double[] scalingReconstruction, double[] waveletReconstruction) {
        int length = scalingDecomposition.length;
        if (length < 2 || length % 2 != 0) {
            throw new IllegalArgumentException("Filter length of " + name + " must be even and at least 2, got " + length);
        }
        if (waveletDecomposition.length != length
                || scalingReconstruction.length != length
                || waveletReconstruction.length != length) {
            throw new IllegalArgumentException("All filters of " + name + " must have length " + length);
        }
        this.name = name;
        this.scalingDecomposition = scalingDecomposition.clone();
        this.waveletDecomposition = waveletDecomposition.clone();
        this.scalingReconstruction = scalingReconstruction.clone();
        this.waveletReconstruction = waveletReconstruction.clone();
    }

    public String getName() {
        return name;
    }

    public int getFilterLength() {
        return scalingDecomposition.length;
    }

    /** Decomposition low-pass filter. */
    public double[] getScalingDecomposition() {
        return scalingDecomposition.clone();
    }

    /** Decomposition high-pass filter. */
    public double[] getWaveletDecomposition() {
        return waveletDecomposition.clone();
    }

    /** Reconstruction low-pass filter. */
    public double[] getScalingReconstruction() {
        return scalingReconstruction.clone();
    }

    /** Reconstruction high-pass filter. */
    public double[] getWaveletReconstruction() {
        return waveletReconstruction.clone();
    }

    /**
     * Deepest level at which no coefficient of a signal of the given length is
     * influenced by boundary extension alone.
     */
    public int boundaryFreeLevel(int signalLength) {
        long span = getFilterLength() - 1;
        int level = 0;
        while ((span << (level + 1)) <= signalLength) {
            level++;
        }
        return level;
    }

    @Override
    public String toString() {
        return name + " (" + getFilterLength() + " taps)";
    }
}
