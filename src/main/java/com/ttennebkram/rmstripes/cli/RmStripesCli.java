package com.ttennebkram.rmstripes.cli;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import com.ttennebkram.rmstripes.InvariantViolationException;
import com.ttennebkram.rmstripes.wavelet.Wavelets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Console entry point: parses the command line, runs one command and maps the outcome
 * to an exit code.
 */
public class RmStripesCli {

    private static final Logger logger = LoggerFactory.getLogger(RmStripesCli.class);

    public static final String PROGRAM_NAME = "rmstripes-tool";

    public static final int EXIT_OK = 0;
    public static final int EXIT_ERROR = 1;
    public static final int EXIT_USAGE = 2;

    private final PrintStream out;
    private final PrintStream err;

    public RmStripesCli() {
        this(System.out, System.err);
    }

    public RmStripesCli(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    /**
     * Parse and run.
     *
     * @return process exit code
     */
    public int run(String[] args) {
        MainOptions options = new MainOptions();
        Map<String, CliCommand> commands = new LinkedHashMap<>();
        for (CliCommand command : new CliCommand[]{
                new RemoveStripesCommand(), new FillMaskExpandCommand(), new FillMaskNearestCommand()}) {
            commands.put(command.getName(), command);
        }

        JCommander.Builder builder = JCommander.newBuilder()
                .programName(PROGRAM_NAME)
                .addObject(options);
        for (CliCommand command : commands.values()) {
            builder.addCommand(command);
        }
        JCommander jc = builder.build();

        try {
            jc.parse(args);
        } catch (ParameterException e) {
            err.println("Error: " + e.getMessage());
            printUsage(jc, jc.getParsedCommand(), err);
            return EXIT_USAGE;
        }

        if (options.listWavelets) {
            for (String name : Wavelets.names()) {
                out.println(name);
            }
            return EXIT_OK;
        }

        String parsed = jc.getParsedCommand();
        if (options.help) {
            printUsage(jc, null, out);
            return EXIT_OK;
        }
        if (parsed == null) {
            err.println("Error: no command given");
            printUsage(jc, null, err);
            return EXIT_USAGE;
        }

        CliCommand command = commands.get(parsed);
        if (command.isHelp()) {
            printUsage(jc, parsed, out);
            return EXIT_OK;
        }

        try {
            command.validate();
        } catch (ParameterException e) {
            err.println("Error: " + e.getMessage());
            printUsage(jc, parsed, err);
            return EXIT_USAGE;
        }

        try {
            command.execute();
            return EXIT_OK;
        } catch (IOException e) {
            logger.error("I/O error: {}", e.getMessage());
            logger.debug("I/O error details", e);
            return EXIT_ERROR;
        } catch (IllegalArgumentException e) {
            // ConfigurationException and ShapeMismatchException
            logger.error("Invalid input: {}", e.getMessage());
            return EXIT_ERROR;
        } catch (InvariantViolationException e) {
            logger.error("Processing failed: {}", e.getMessage(), e);
            return EXIT_ERROR;
        }
    }

    private static void printUsage(JCommander jc, String command, PrintStream stream) {
        StringBuilder sb = new StringBuilder();
        if (command != null) {
            jc.getUsageFormatter().usage(command, sb);
        } else {
            jc.getUsageFormatter().usage(sb);
        }
        stream.print(sb);
    }
}
