package com.astrepr.cli;

import com.astrepr.FormatException;
import com.astrepr.ReprParser;
import com.astrepr.codegen.CodeGenerator;
import com.astrepr.codegen.GeneratorOptions;
import com.astrepr.config.ConverterConfig;
import com.astrepr.json.ReprJsonException;
import com.astrepr.json.ReprJsonProvider;
import com.astrepr.logging.LoggingConfigurator;
import com.astrepr.tree.ReprNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Entry point: reads a dump, converts it and writes the result to stdout or a file.
 *
 * Exit codes are 0 on success, 2 for invalid arguments or a missing input file and 1 when
 * the input is malformed or cannot be read or written.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_FAILURE = 1;

    private final PrintWriter out;
    private final PrintWriter err;

    public CliApplication() {
        this(new PrintWriter(System.out, true, StandardCharsets.UTF_8),
            new PrintWriter(System.err, true, StandardCharsets.UTF_8));
    }

    CliApplication(PrintWriter out, PrintWriter err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments arguments = new CliArguments();
        CommandLine commandLine = new CommandLine(arguments).setOut(out).setErr(err);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        LoggingConfigurator.configure(arguments.verbose());

        Path input = arguments.input();
        if (!Files.isRegularFile(input)) {
            commandLine.getErr().println("Input file not found: " + input);
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        GeneratorOptions options = arguments.applyTo(ConverterConfig.load(arguments.configFile()).toGeneratorOptions());
        LOGGER.debug("Converting {} with {}", input, options);

        try {
            String source = Files.readString(input, StandardCharsets.UTF_8);
            ReprNode tree = ReprParser.parse(source);
            String result = arguments.dumpTree()
                ? ReprJsonProvider.getProvider().getSerializer().serializePretty(tree) + "\n"
                : new CodeGenerator(options).generate(tree);
            write(result, arguments.output());
            return 0;
        } catch (FormatException e) {
            LOGGER.error("Cannot convert {}: {}", input, e.getMessage());
            return EXIT_FAILURE;
        } catch (ReprJsonException e) {
            LOGGER.error("Cannot dump the tree of {}", input, e);
            return EXIT_FAILURE;
        } catch (IOException e) {
            LOGGER.error("I/O failure while converting {}: {}", input, e.toString());
            return EXIT_FAILURE;
        }
    }

    private void write(String result, Path output) throws IOException {
        if (output == null) {
            out.print(result);
            out.flush();
            return;
        }
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(output, result, StandardCharsets.UTF_8);
        LOGGER.info("Wrote {}", output);
    }
}
