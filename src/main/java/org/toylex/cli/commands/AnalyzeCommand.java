package org.toylex.cli.commands;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.toylex.analyzer.AnalyzerOptions;
import org.toylex.analyzer.LexicalAnalyzer;
import org.toylex.analyzer.api.AnalysisResult;
import org.toylex.analyzer.api.InvalidTokenException;
import org.toylex.cli.CommandLineInterface;
import org.toylex.cli.rendering.AnalysisRenderer;
import org.toylex.cli.rendering.OutputFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "analyze", description = "Analyzes source files and prints their symbol table and program internal form.")
public class AnalyzeCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(AnalyzeCommand.class);

    /** Exit code when a file contains an invalid token. */
    public static final int EXIT_INVALID_TOKEN = 1;
    /** Exit code when a file cannot be read. */
    public static final int EXIT_IO_ERROR = 2;

    @Parameters(arity = "1..*", paramLabel = "FILE", description = "The source files to analyze.")
    private List<File> files;

    @Option(names = {"-F", "--format"}, description = "Output format: ${COMPLETION-CANDIDATES} (default: from configuration)")
    private OutputFormat format;

    @Option(names = {"-v", "--verbosity"}, description = "Analyzer log verbosity, 0=errors only to 4=trace.")
    private Integer verbosity;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        Config config = parent.getConfig();
        OutputFormat outputFormat;
        AnalyzerOptions options;
        try {
            outputFormat = format != null ? format : OutputFormat.fromConfig(config);
            options = AnalyzerOptions.fromConfig(config);
        } catch (ConfigException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e);
        }

        LexicalAnalyzer analyzer = new LexicalAnalyzer(options);
        if (verbosity != null) {
            analyzer.setVerbosity(verbosity);
        }

        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        List<AnalysisResult> results = new ArrayList<>();
        int exitCode = 0;

        // Each file gets its own symbol table; a failing file does not stop the others.
        for (File file : files) {
            try {
                results.add(analyzer.analyze(file.toPath()));
            } catch (InvalidTokenException e) {
                LOG.debug("Analysis of {} failed", file, e);
                err.println(e.getMessage());
                exitCode = Math.max(exitCode, EXIT_INVALID_TOKEN);
            } catch (IOException e) {
                err.println("Cannot read " + file.getPath() + ": " + e.getMessage());
                exitCode = EXIT_IO_ERROR;
            }
        }
        err.flush();

        if (!results.isEmpty()) {
            new AnalysisRenderer().render(results, outputFormat, out);
        }
        return exitCode;
    }
}
