package com.ttennebkram.rmstripes.cli;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import com.ttennebkram.rmstripes.io.RasterIO;
import com.ttennebkram.rmstripes.processors.FillMaskExpandProcessor;
import com.ttennebkram.rmstripes.util.MatUtils;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * {@code fill-mask-expand INFILE MASKFILE -o OUT}: mask growth fill of one band.
 */
@Parameters(commandNames = "fill-mask-expand", commandDescription = "Fill masked pixels by growing the valid region")
public class FillMaskExpandCommand extends CliCommand {

    private static final Logger logger = LoggerFactory.getLogger(FillMaskExpandCommand.class);

    @Parameter(
            names = {"-c", "--constant"},
            description = "Value the fill decays to far from valid pixels (default 0)")
    public Double constant;

    @Parameter(
            names = {"-n", "--n-grow"},
            description = "Number of dilation steps (default 10)")
    public Integer nGrow;

    @Parameter(
            names = {"-k", "--kernel-radius"},
            description = "Radius of the averaging window, must exceed --n-grow (default n-grow + 5)")
    public Integer kernelRadius;

    @Override
    public String getName() {
        return "fill-mask-expand";
    }

    @Override
    protected String[] getInputNames() {
        return new String[]{"INFILE", "MASKFILE"};
    }

    @Override
    public void execute() throws IOException {
        FillMaskExpandProcessor processor = new FillMaskExpandProcessor();
        applySettings(processor);

        if (constant != null) processor.setConstant(constant);
        if (nGrow != null) processor.setNGrow(nGrow);
        if (kernelRadius != null) processor.setKernelRadius(kernelRadius);
        saveSettings(processor);

        logger.info("Reading band {} of {} and {}", common.band, files.get(0), files.get(1));
        Mat image = RasterIO.readBand(input(0), common.band);
        Mat mask = null;
        Mat output = null;
        try {
            mask = RasterIO.readMask(input(1), common.band);
            logger.info("Filling mask: {}", processor);
            output = processor.processDual(image, mask);
            RasterIO.write(common.output, output);
            logger.info("Wrote {}", common.output);
        } finally {
            MatUtils.release(image, mask, output);
        }
    }
}
