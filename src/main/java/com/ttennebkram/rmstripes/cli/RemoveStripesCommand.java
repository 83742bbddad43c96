package com.ttennebkram.rmstripes.cli;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import com.ttennebkram.rmstripes.io.RasterIO;
import com.ttennebkram.rmstripes.processing.ProcessingPipeline;
import com.ttennebkram.rmstripes.processors.FillMaskExpandProcessor;
import com.ttennebkram.rmstripes.processors.RemoveStripesProcessor;
import com.ttennebkram.rmstripes.util.MatUtils;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;

/**
 * {@code rmstripes INFILE -o OUT}: wavelet-Fourier stripe removal of one band,
 * optionally preceded by a mask growth fill.
 */
@Parameters(commandNames = "rmstripes", commandDescription = "Remove stripes from a band with wavelet-Fourier filtering")
public class RemoveStripesCommand extends CliCommand {

    private static final Logger logger = LoggerFactory.getLogger(RemoveStripesCommand.class);

    // Null means "not given": keep the default or the --config value
    @Parameter(
            names = {"-w", "--wavelet"},
            description = "Wavelet basis (default " + RemoveStripesProcessor.DEFAULT_WAVELET + "; see --wavelets)")
    public String wavelet;

    @Parameter(
            names = {"-l", "--level"},
            description = "Number of wavelet decomposition levels (default 6)")
    public Integer level;

    @Parameter(
            names = {"-s", "--sigma"},
            description = "Width of the Gaussian notch in frequency bins (default 10)")
    public Double sigma;

    @Parameter(
            names = "--mask",
            description = "Mask file (1 = invalid); masked pixels are filled by mask growth before destriping")
    public File mask;

    @Parameter(
            names = "--parallel",
            description = "Damp the detail sub-bands of each level concurrently")
    public Boolean parallel;

    @Override
    public String getName() {
        return "rmstripes";
    }

    @Override
    protected String[] getInputNames() {
        return new String[]{"INFILE"};
    }

    @Override
    public void execute() throws IOException {
        RemoveStripesProcessor processor = new RemoveStripesProcessor();
        FillMaskExpandProcessor fill = mask != null ? new FillMaskExpandProcessor() : null;
        applySettings(processor, fill);

        if (wavelet != null) processor.setWavelet(wavelet);
        if (level != null) processor.setDecompositionLevel(level);
        if (sigma != null) processor.setSigma(sigma);
        if (parallel != null) processor.setParallel(parallel);
        saveSettings(processor, fill);

        File inFile = input(0);
        logger.info("Reading band {} of {}", common.band, inFile);
        Mat image = RasterIO.readBand(inFile, common.band);
        Mat maskMat = null;
        Mat output = null;
        try {
            ProcessingPipeline pipeline = new ProcessingPipeline().then(processor.createImageProcessor());
            if (fill != null) {
                logger.info("Reading band {} of mask {}", common.band, mask);
                maskMat = RasterIO.readMask(mask, common.band);
                pipeline.fillWith(fill.createDualImageProcessor());
            }

            logger.info("Removing stripes: {}", processor);
            output = pipeline.run(image, maskMat);
            RasterIO.write(common.output, output);
            logger.info("Wrote {}", common.output);
        } finally {
            MatUtils.release(image, maskMat, output);
        }
    }
}
