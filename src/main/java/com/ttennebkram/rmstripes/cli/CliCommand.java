package com.ttennebkram.rmstripes.cli;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.ParametersDelegate;
import com.ttennebkram.rmstripes.processors.RasterProcessor;
import com.ttennebkram.rmstripes.serialization.ProcessorSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Base class for the console commands: positional input files, shared options and
 * settings file handling.
 */
public abstract class CliCommand {

    private static final Logger logger = LoggerFactory.getLogger(CliCommand.class);

    @Parameter(description = "input files")
    public List<String> files = new ArrayList<>();

    @ParametersDelegate
    public CommonOptions common = new CommonOptions();

    public abstract String getName();

    /**
     * Names of the positional arguments, in order.
     */
    protected abstract String[] getInputNames();

    /**
     * Run the command after parsing.
     *
     * @throws IOException if an input cannot be read or the output cannot be written
     */
    public abstract void execute() throws IOException;

    public boolean isHelp() {
        return common.help;
    }

    /**
     * Check the positional arguments.
     *
     * @throws ParameterException if their count is wrong
     */
    public void validate() {
        String[] names = getInputNames();
        if (files.size() != names.length) {
            throw new ParameterException(getName() + " expects " + String.join(" ", names)
                    + ", got " + files.size() + " file argument(s)");
        }
        if (common.band < 1) {
            throw new ParameterException("--band must be at least 1, got " + common.band);
        }
    }

    protected File input(int index) {
        return new File(files.get(index));
    }

    /**
     * Apply the --config file, if any, to the given processors.
     */
    protected void applySettings(RasterProcessor... processors) throws IOException {
        if (common.config == null) {
            return;
        }
        logger.info("Reading settings from {}", common.config);
        ProcessorSettings settings = ProcessorSettings.load(common.config);
        for (RasterProcessor processor : processors) {
            if (processor != null && settings.applyTo(processor)) {
                logger.debug("Configured {} from settings file", processor.getNodeType());
            }
        }
    }

    /**
     * Write the effective settings of the given processors to --save-config, if set.
     */
    protected void saveSettings(RasterProcessor... processors) throws IOException {
        if (common.saveConfig == null) {
            return;
        }
        ProcessorSettings settings = new ProcessorSettings();
        for (RasterProcessor processor : processors) {
            if (processor != null) {
                settings.put(processor);
            }
        }
        settings.save(common.saveConfig);
        logger.info("Saved settings to {}", common.saveConfig);
    }
}
