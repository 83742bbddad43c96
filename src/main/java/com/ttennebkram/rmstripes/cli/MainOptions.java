package com.ttennebkram.rmstripes.cli;

import com.beust.jcommander.Parameter;

/**
 * Options accepted before the command name.
 */
public class MainOptions {

    @Parameter(
            names = {"-h", "--help"},
            description = "Show usage",
            help = true)
    public boolean help;

    @Parameter(
            names = "--wavelets",
            description = "List the wavelet names accepted by --wavelet and exit",
            help = true)
    public boolean listWavelets;
}
