package com.astrepr.cli;

import com.astrepr.codegen.GeneratorOptions;
import com.astrepr.config.ConverterConfig;
import picocli.CommandLine;

import java.nio.file.Path;

@CommandLine.Command(name = "astrepr", mixinStandardHelpOptions = true, version = "astrepr 1.0.0",
    description = "Reconstructs approximate source code from a compiler's desugared AST dump")
public class CliArguments {

    static final String DEFAULT_INPUT = "desugared-ast-repr.txt";

    @CommandLine.Parameters(index = "0", arity = "0..1", defaultValue = DEFAULT_INPUT, paramLabel = "INPUT",
        description = "AST-repr dump to read (default: ${DEFAULT-VALUE})")
    private Path input;

    @CommandLine.Option(names = "--no-comments", description = "Do not emit // position: comments")
    private boolean noComments;

    @CommandLine.Option(names = "--sanitize-identifiers", description = "Rewrite '-' and '$' in identifiers")
    private boolean sanitizeIdentifiers;

    @CommandLine.Option(names = {"-o", "--output"}, paramLabel = "FILE", description = "Write to FILE instead of stdout")
    private Path output;

    @CommandLine.Option(names = "--dump-tree", description = "Print the parsed tree as JSON instead of source")
    private boolean dumpTree;

    @CommandLine.Option(names = "--config", paramLabel = "FILE", defaultValue = ConverterConfig.CONFIG_FILE_NAME,
        description = "YAML file with default settings (default: ${DEFAULT-VALUE}, optional)")
    private Path configFile;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Log debug details to stderr")
    private boolean verbose;

    public Path input() {
        return input;
    }

    public Path output() {
        return output;
    }

    public boolean dumpTree() {
        return dumpTree;
    }

    public Path configFile() {
        return configFile;
    }

    public boolean verbose() {
        return verbose;
    }

    /**
     * Flags only ever switch away from the configured values, they never restore a default.
     */
    public GeneratorOptions applyTo(GeneratorOptions configured) {
        GeneratorOptions options = configured;
        if (noComments) {
            options = options.withPositionComments(false);
        }
        if (sanitizeIdentifiers) {
            options = options.withSanitizedIdentifiers(true);
        }
        return options;
    }
}
