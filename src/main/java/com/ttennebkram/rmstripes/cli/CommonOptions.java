package com.ttennebkram.rmstripes.cli;

import com.beust.jcommander.Parameter;

import java.io.File;

/**
 * Options shared by every command.
 */
public class CommonOptions {

    @Parameter(
            names = {"-o", "--output"},
            description = "Output file; the format follows the extension and must store float samples (e.g. .tif)",
            required = true)
    public File output;

    @Parameter(
            names = {"-b", "--band"},
            description = "Band of the input files to process, starting at 1")
    public int band = 1;

    @Parameter(
            names = "--config",
            description = "JSON settings file; options given on the command line take precedence")
    public File config;

    @Parameter(
            names = "--save-config",
            description = "Write the effective settings to this JSON file")
    public File saveConfig;

    @Parameter(
            names = {"-h", "--help"},
            description = "Show usage of this command",
            help = true)
    public boolean help;
}
