package com.ttennebkram.rmstripes.processors;

import com.google.gson.JsonObject;
import com.ttennebkram.rmstripes.stripes.CoefficientDamper;
import com.ttennebkram.rmstripes.stripes.WaveletStripeFilter;
import com.ttennebkram.rmstripes.wavelet.SymmetricWaveletTransform;
import com.ttennebkram.rmstripes.wavelet.Wavelet;
import com.ttennebkram.rmstripes.wavelet.Wavelets;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Remove Stripes processor.
 * Wavelet-Fourier filtering of vertical and horizontal stripes in a single band.
 */
@ProcessorInfo(nodeType = "RemoveStripes", displayName = "Remove Stripes", category = "Destripe")
public class RemoveStripesProcessor extends RasterProcessorBase {

    private static final Logger logger = LoggerFactory.getLogger(RemoveStripesProcessor.class);

    public static final String DEFAULT_WAVELET = "db10";
    public static final int DEFAULT_LEVEL = 6;
    public static final double DEFAULT_SIGMA = 10.0;

    // Properties with defaults
    private String wavelet = DEFAULT_WAVELET;
    private int decompositionLevel = DEFAULT_LEVEL;
    private double sigma = DEFAULT_SIGMA;
    private boolean parallel = false;

    @Override
    public String getNodeType() {
        return "RemoveStripes";
    }

    @Override
    public String getCategory() {
        return "Destripe";
    }

    @Override
    public String getDescription() {
        return "Remove stripes with combined wavelet-Fourier filtering\n"
                + "removeStripes(image, level, wavelet, sigma)";
    }

    @Override
    public Mat process(Mat input) {
        requireInput(input);

        Wavelet basis = Wavelets.get(wavelet);
        CoefficientDamper.validateSigma(sigma);
        WaveletStripeFilter.validateLevel(decompositionLevel, input.rows(), input.cols(), basis);

        int side = Math.min(input.rows(), input.cols());
        int boundaryFree = basis.boundaryFreeLevel(side);
        if (decompositionLevel > boundaryFree) {
            logger.warn("Level {} is deeper than {} for {} on a {}x{} image; coarse levels are dominated by boundary effects",
                    decompositionLevel, boundaryFree, basis.getName(), input.rows(), input.cols());
        }

        logger.debug("Removing stripes: wavelet={}, level={}, sigma={}, parallel={}",
                basis.getName(), decompositionLevel, sigma, parallel);
        long start = System.currentTimeMillis();

        Mat output;
        if (parallel) {
            ExecutorService executor = Executors.newFixedThreadPool(2);
            try {
                output = new WaveletStripeFilter(new SymmetricWaveletTransform(), new CoefficientDamper(), executor)
                        .removeStripes(input, decompositionLevel, wavelet, sigma);
            } finally {
                executor.shutdownNow();
            }
        } else {
            output = new WaveletStripeFilter().removeStripes(input, decompositionLevel, wavelet, sigma);
        }

        logger.debug("Stripe removal on {}x{} took {} ms", input.rows(), input.cols(),
                System.currentTimeMillis() - start);
        return output;
    }

    public String getWavelet() {
        return wavelet;
    }

    public void setWavelet(String wavelet) {
        this.wavelet = wavelet;
    }

    public int getDecompositionLevel() {
        return decompositionLevel;
    }

    public void setDecompositionLevel(int decompositionLevel) {
        this.decompositionLevel = decompositionLevel;
    }

    public double getSigma() {
        return sigma;
    }

    public void setSigma(double sigma) {
        this.sigma = sigma;
    }

    public boolean isParallel() {
        return parallel;
    }

    public void setParallel(boolean parallel) {
        this.parallel = parallel;
    }

    @Override
    public void serializeProperties(JsonObject json) {
        json.addProperty("wavelet", wavelet);
        json.addProperty("level", decompositionLevel);
        json.addProperty("sigma", sigma);
        json.addProperty("parallel", parallel);
    }

    @Override
    public void deserializeProperties(JsonObject json) {
        wavelet = getJsonString(json, "wavelet", wavelet);
        decompositionLevel = getJsonInt(json, "level", decompositionLevel);
        sigma = getJsonDouble(json, "sigma", sigma);
        parallel = getJsonBoolean(json, "parallel", parallel);
    }
}
