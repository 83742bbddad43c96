package com.ttennebkram.rmstripes.cli;

import com.beust.jcommander.Parameters;
import com.ttennebkram.rmstripes.io.RasterIO;
import com.ttennebkram.rmstripes.processors.FillMaskNearestProcessor;
import com.ttennebkram.rmstripes.util.MatUtils;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * {@code fill-mask-nn INFILE MASKFILE -o OUT}: nearest-neighbour fill of one band.
 */
@Parameters(commandNames = "fill-mask-nn", commandDescription = "Fill masked pixels with the nearest valid value")
public class FillMaskNearestCommand extends CliCommand {

    private static final Logger logger = LoggerFactory.getLogger(FillMaskNearestCommand.class);

    @Override
    public String getName() {
        return "fill-mask-nn";
    }

    @Override
    protected String[] getInputNames() {
        return new String[]{"INFILE", "MASKFILE"};
    }

    @Override
    public void execute() throws IOException {
        FillMaskNearestProcessor processor = new FillMaskNearestProcessor();
        applySettings(processor);
        saveSettings(processor);

        logger.info("Reading band {} of {} and {}", common.band, files.get(0), files.get(1));
        Mat image = RasterIO.readBand(input(0), common.band);
        Mat mask = null;
        Mat output = null;
        try {
            mask = RasterIO.readMask(input(1), common.band);
            output = processor.processDual(image, mask);
            RasterIO.write(common.output, output);
            logger.info("Wrote {}", common.output);
        } finally {
            MatUtils.release(image, mask, output);
        }
    }
}
